package com.serge.community.access;

import com.serge.community.domain.Account;
import com.serge.community.domain.Role;
import com.serge.community.domain.RoleName;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * The account performing a request, reduced to what authorization needs.
 */
public record Actor(UUID id, Set<RoleName> roles) {

    public Actor {
        roles = roles == null || roles.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(roles));
    }

    public static Actor of(Account account) {
        EnumSet<RoleName> names = EnumSet.noneOf(RoleName.class);
        if (account.getRoles() != null) {
            for (Role r : account.getRoles()) names.add(r.getName());
        }
        return new Actor(account.getId(), names);
    }

    public boolean hasAnyRole(Set<RoleName> wanted) {
        for (RoleName r : wanted) {
            if (roles.contains(r)) return true;
        }
        return false;
    }
}
