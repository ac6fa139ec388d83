package com.serge.community.access;

import com.serge.community.domain.Authored;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Decides whether an actor may perform an action. Stateless; an absent actor means anonymous.
 */
@Component
public class PermissionEvaluator {
    private static final Logger log = LoggerFactory.getLogger(PermissionEvaluator.class);

    public AccessDecision canPerform(Actor actor, Action action) {
        return decide(actor, action, null, false);
    }

    public AccessDecision canPerform(Actor actor, Action action, Authored resource) {
        UUID ownerId = resource == null || resource.getAuthor() == null ? null : resource.getAuthor().getId();
        return decide(actor, action, ownerId, resource != null);
    }

    /** For view models: the same decision collapsed to a flag. */
    public boolean allows(Actor actor, Action action, Authored resource) {
        return canPerform(actor, action, resource).allowed();
    }

    public boolean allows(Actor actor, Action action) {
        return canPerform(actor, action).allowed();
    }

    /** Ownership check for cached view data that only carries the author id. */
    public AccessDecision canPerformOnOwner(Actor actor, Action action, UUID ownerId) {
        return decide(actor, action, ownerId, ownerId != null);
    }

    private AccessDecision decide(Actor actor, Action action, UUID ownerId, boolean resourcePresent) {
        if (actor == null) {
            log.debug("access.denied action={} reason=anonymous", action);
            return AccessDecision.unauthenticated("Login required");
        }
        AccessDecision decision = switch (action.gate()) {
            case AUTHENTICATED -> AccessDecision.allow();
            case ROLE -> actor.hasAnyRole(action.roles())
                    ? AccessDecision.allow()
                    : AccessDecision.forbidden("Requires one of roles " + action.roles());
            case OWNERSHIP -> {
                if (!resourcePresent) {
                    yield AccessDecision.forbidden("Resource missing");
                }
                if (ownerId != null && ownerId.equals(actor.id())) {
                    yield AccessDecision.allow();
                }
                yield actor.hasAnyRole(action.roles())
                        ? AccessDecision.allow()
                        : AccessDecision.forbidden("Only the author may do this");
            }
        };
        if (!decision.allowed()) {
            log.debug("access.denied action={} actor={} reason={}", action, actor.id(), decision.reason());
        }
        return decision;
    }
}
