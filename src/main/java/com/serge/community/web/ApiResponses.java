package com.serge.community.web;

import com.serge.community.access.AccessDecision;
import org.springframework.http.ResponseEntity;

import java.util.Map;

final class ApiResponses {
    private ApiResponses() {
    }

    static ResponseEntity<?> denied(AccessDecision decision) {
        if (decision.outcome() == AccessDecision.Outcome.UNAUTHENTICATED) {
            return error(401, "UNAUTHENTICATED", decision.reason());
        }
        return error(403, "FORBIDDEN", decision.reason());
    }

    static ResponseEntity<?> notFound(String message) {
        return error(404, "NOT_FOUND", message);
    }

    static ResponseEntity<?> error(int status, String code, String message) {
        return ResponseEntity.status(status).body(Map.of("error", code, "message", message == null ? code : message));
    }
}
