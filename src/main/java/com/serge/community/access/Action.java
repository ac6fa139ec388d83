package com.serge.community.access;

import com.serge.community.domain.RoleName;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Everything the site gates. Each action names how it is gated and which roles
 * grant it (or, for ownership-gated actions, which roles may act on someone else's resource).
 */
public enum Action {
    EDIT_TERMS(Gate.AUTHENTICATED),
    EDIT_ROLES(Gate.ROLE, RoleName.ADMINISTRATOR),

    CREATE_NEWS(Gate.AUTHENTICATED),
    EDIT_NEWS(Gate.OWNERSHIP),
    APPROVE_NEWS(Gate.ROLE, RoleName.ADMINISTRATOR, RoleName.MODERATOR),

    CREATE_ARTICLE(Gate.AUTHENTICATED),
    EDIT_ARTICLE(Gate.OWNERSHIP, RoleName.ADMINISTRATOR),

    CREATE_TIP(Gate.AUTHENTICATED),
    EDIT_TIP(Gate.OWNERSHIP, RoleName.ADMINISTRATOR, RoleName.LIBRARIAN),

    CREATE_COMMENT(Gate.AUTHENTICATED),
    EDIT_COMMENT(Gate.OWNERSHIP, RoleName.ADMINISTRATOR, RoleName.MODERATOR);

    public enum Gate {
        /** Any logged-in account. */
        AUTHENTICATED,
        /** Only holders of one of the action's roles. */
        ROLE,
        /** The resource author, or holders of one of the action's roles. */
        OWNERSHIP
    }

    private final Gate gate;
    private final Set<RoleName> roles;

    Action(Gate gate, RoleName... roles) {
        this.gate = gate;
        EnumSet<RoleName> set = EnumSet.noneOf(RoleName.class);
        set.addAll(Arrays.asList(roles));
        this.roles = Collections.unmodifiableSet(set);
    }

    public Gate gate() {
        return gate;
    }

    public Set<RoleName> roles() {
        return roles;
    }
}
