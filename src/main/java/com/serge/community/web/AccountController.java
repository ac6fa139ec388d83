package com.serge.community.web;

import com.serge.community.access.AccessDecision;
import com.serge.community.access.Action;
import com.serge.community.access.Actor;
import com.serge.community.access.PermissionEvaluator;
import com.serge.community.domain.Account;
import com.serge.community.domain.Role;
import com.serge.community.domain.RoleName;
import com.serge.community.repo.AccountRepository;
import com.serge.community.service.PresenceTracker;
import com.serge.community.service.ProfileService;
import com.serge.community.service.RoleService;
import com.serge.community.service.SessionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {
    private static final Logger log = LoggerFactory.getLogger(AccountController.class);
    static final int MAX_SEARCH_RESULTS = 20;
    static final int MAX_PRESENCE_PAGE = 100;

    private final AccountRepository accountRepository;
    private final SessionService sessions;
    private final PermissionEvaluator permissions;
    private final PresenceTracker presence;
    private final ProfileService profiles;
    private final RoleService roleService;

    @GetMapping("/by-name/{username}")
    public ResponseEntity<?> profile(@PathVariable String username) {
        Optional<Account> a = accountRepository.findByUsername(username);
        if (a.isEmpty()) return ApiResponses.notFound("No such user");
        return ResponseEntity.ok(toDto(a.get()));
    }

    @GetMapping("/search")
    public List<AccountDto> search(@RequestParam("q") String text) {
        String q = text == null ? "" : text.trim();
        if (q.isEmpty()) return List.of();
        List<AccountDto> out = accountRepository.searchByUsername(q, PageRequest.of(0, MAX_SEARCH_RESULTS))
                .stream().map(this::toDto).collect(Collectors.toList());
        log.debug("accounts.search q={} count={}", q, out.size());
        return out;
    }

    @GetMapping("/online")
    public List<AccountDto> online(@RequestParam(defaultValue = "0") int page,
                                   @RequestParam(defaultValue = "50") int size) {
        return presence.onlineAccounts(presencePage(page, size)).stream()
                .map(this::toDto).collect(Collectors.toList());
    }

    @GetMapping("/offline")
    public List<AccountDto> offline(@RequestParam(defaultValue = "0") int page,
                                    @RequestParam(defaultValue = "50") int size) {
        return presence.offlineAccounts(presencePage(page, size)).stream()
                .map(this::toDto).collect(Collectors.toList());
    }

    @PostMapping(value = "/me/avatar", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> uploadAvatar(@RequestParam("file") MultipartFile file,
                                          @AuthenticationPrincipal Jwt jwt) throws IOException {
        Optional<Account> me = sessions.resolveAccount(jwt);
        if (me.isEmpty()) return ApiResponses.error(401, "UNAUTHENTICATED", "Login required");
        Account saved = profiles.updateAvatar(me.get(), file.getBytes(), file.getContentType());
        return ResponseEntity.ok(toDto(saved));
    }

    @PutMapping("/me/social-links")
    public ResponseEntity<?> socialLinks(@RequestBody Map<String, String> links,
                                         @AuthenticationPrincipal Jwt jwt) {
        Optional<Account> me = sessions.resolveAccount(jwt);
        if (me.isEmpty()) return ApiResponses.error(401, "UNAUTHENTICATED", "Login required");
        Account saved = profiles.updateSocialLinks(me.get(), links);
        return ResponseEntity.ok(toDto(saved));
    }

    @PutMapping("/{id}/roles")
    public ResponseEntity<?> setRoles(@PathVariable UUID id, @RequestBody @Valid RolesReq req,
                                      @AuthenticationPrincipal Jwt jwt) {
        Actor actor = sessions.resolveActor(jwt);
        AccessDecision d = permissions.canPerform(actor, Action.EDIT_ROLES);
        if (!d.allowed()) return ApiResponses.denied(d);
        log.info("accounts.roles.set by={} accountId={} roles={}", actor.id(), id, req.getRoles());
        return ResponseEntity.ok(toDto(roleService.setRoles(id, req.getRoles())));
    }

    static PageRequest presencePage(int page, int size) {
        return PageRequest.of(Math.max(page, 0), Math.max(1, Math.min(size, MAX_PRESENCE_PAGE)));
    }

    private AccountDto toDto(Account a) {
        return AccountDto.from(a, presence.isOnline(a), profiles.avatarUrl(a));
    }

    @Data
    public static class RolesReq {
        @NotNull
        private Set<RoleName> roles;
    }

    @Data
    public static class AccountDto {
        private UUID id;
        private String username;
        private boolean online;
        private String avatarUrl;
        private Map<String, String> socialLinks;
        private List<String> roles;
        private OffsetDateTime lastLoginAt;
        private OffsetDateTime createdAt;

        public static AccountDto from(Account a, boolean online, String avatarUrl) {
            AccountDto d = new AccountDto();
            d.id = a.getId();
            d.username = a.getUsername();
            d.online = online;
            d.avatarUrl = avatarUrl;
            d.socialLinks = a.getSocialLinks() == null ? Map.of() : a.getSocialLinks();
            d.roles = a.getRoles() == null ? List.of() : a.getRoles().stream()
                    .map(Role::getName).map(Enum::name).sorted().collect(Collectors.toList());
            d.lastLoginAt = a.getLastLoginAt();
            d.createdAt = a.getCreatedAt();
            return d;
        }
    }
}
