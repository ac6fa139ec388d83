package com.serge.community.service;

import com.serge.community.domain.Account;
import com.serge.community.domain.Role;
import com.serge.community.domain.RoleName;
import com.serge.community.repo.AccountRepository;
import com.serge.community.repo.RoleRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class RoleService {
    private static final Logger log = LoggerFactory.getLogger(RoleService.class);

    private final AccountRepository accounts;
    private final RoleRepository roles;
    private final Clock clock;

    /** Replaces the account's roles with exactly the given set. */
    @Transactional
    public Account setRoles(UUID accountId, Set<RoleName> names) {
        Account account = accounts.findById(accountId)
                .orElseThrow(() -> new NoSuchElementException("Account not found: " + accountId));
        Set<Role> wanted = names == null || names.isEmpty()
                ? new HashSet<>()
                : new HashSet<>(roles.findByNameIn(names));
        account.setRoles(wanted);
        account.setUpdatedAt(OffsetDateTime.now(clock));
        log.info("roles.set accountId={} roles={}", accountId, names);
        return accounts.save(account);
    }
}
