package com.serge.community.access;

/**
 * Result of a permission check. A denial is a value, not an exception,
 * so callers decide how to present it.
 */
public record AccessDecision(Outcome outcome, String reason) {

    public enum Outcome { ALLOW, UNAUTHENTICATED, FORBIDDEN }

    private static final AccessDecision ALLOWED = new AccessDecision(Outcome.ALLOW, null);

    public static AccessDecision allow() {
        return ALLOWED;
    }

    public static AccessDecision unauthenticated(String reason) {
        return new AccessDecision(Outcome.UNAUTHENTICATED, reason);
    }

    public static AccessDecision forbidden(String reason) {
        return new AccessDecision(Outcome.FORBIDDEN, reason);
    }

    public boolean allowed() {
        return outcome == Outcome.ALLOW;
    }
}
