package com.serge.community.web;

import com.serge.community.domain.Account;
import com.serge.community.service.IssuedSession;
import com.serge.community.service.PresenceTracker;
import com.serge.community.service.ProfileService;
import com.serge.community.service.RegistrationService;
import com.serge.community.service.SessionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {
    private static final Logger log = LoggerFactory.getLogger(AuthController.class);
    private final RegistrationService registrationService;
    private final SessionService sessions;
    private final PresenceTracker presence;
    private final ProfileService profiles;

    @PostMapping("/register")
    public ResponseEntity<?> register(@RequestBody RegisterReq req) {
        Account a = registrationService.register(req.getUsername(), req.getEmail(), req.getPassword());
        log.info("auth.register.success accountId={}", a.getId());
        return ResponseEntity.status(201).body(Map.of("accountId", a.getId(), "status", "PENDING_CONFIRMATION"));
    }

    @GetMapping("/confirm/{code}")
    public ResponseEntity<?> confirm(@PathVariable String code) {
        Optional<IssuedSession> session = registrationService.confirm(code);
        if (session.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "INVALID_TOKEN"));
        }
        return ResponseEntity.ok(SessionDto.from(session.get(), "CONFIRMED"));
    }

    @PostMapping("/login")
    public ResponseEntity<?> login(@RequestBody @Valid LoginReq req) {
        Optional<IssuedSession> session = registrationService.login(req.getEmail(), req.getPassword());
        if (session.isEmpty()) {
            return ResponseEntity.status(401).body(Map.of("error", "INVALID_CREDENTIALS"));
        }
        return ResponseEntity.ok(SessionDto.from(session.get(), "AUTHENTICATED"));
    }

    @PostMapping("/logout")
    public ResponseEntity<?> logout(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        registrationService.logout(authorization);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/me")
    public ResponseEntity<?> me(@AuthenticationPrincipal Jwt jwt) {
        Optional<Account> me = sessions.resolveAccount(jwt);
        if (me.isEmpty()) {
            return ResponseEntity.status(401).body(Map.of("error", "UNAUTHENTICATED"));
        }
        Account a = me.get();
        return ResponseEntity.ok(AccountController.AccountDto.from(a, presence.isOnline(a), profiles.avatarUrl(a)));
    }

    @Data
    public static class RegisterReq {
        private String username;
        private String email;
        private String password;
    }

    @Data
    public static class LoginReq {
        @NotBlank
        private String email;
        @NotBlank
        private String password;
    }

    @Data
    public static class SessionDto {
        private String status;
        private UUID accountId;
        private String accessToken;
        private String tokenType;
        private OffsetDateTime expiresAt;

        public static SessionDto from(IssuedSession s, String status) {
            SessionDto d = new SessionDto();
            d.status = status;
            d.accountId = s.accountId();
            d.accessToken = s.accessToken();
            d.tokenType = "Bearer";
            d.expiresAt = s.expiresAt();
            return d;
        }
    }
}
