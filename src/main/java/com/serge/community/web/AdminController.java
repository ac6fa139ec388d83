package com.serge.community.web;

import com.serge.community.domain.Account;
import com.serge.community.service.PresenceTracker;
import com.serge.community.service.ProfileService;
import com.serge.community.service.RoleService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Surface for the registered admin client (client credentials, scope admin:write).
 * The scope is enforced by the security chain.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {
    private static final Logger log = LoggerFactory.getLogger(AdminController.class);
    private final RoleService roleService;
    private final PresenceTracker presence;
    private final ProfileService profiles;

    @PutMapping("/accounts/{id}/roles")
    public AccountController.AccountDto setRoles(@PathVariable UUID id,
                                                 @RequestBody @Valid AccountController.RolesReq req,
                                                 @AuthenticationPrincipal Jwt jwt) {
        log.info("admin.roles.set client={} accountId={} roles={}", jwt == null ? "-" : jwt.getSubject(), id, req.getRoles());
        Account a = roleService.setRoles(id, req.getRoles());
        return AccountController.AccountDto.from(a, presence.isOnline(a), profiles.avatarUrl(a));
    }
}
