package com.serge.community.service;

import com.serge.community.access.Actor;
import com.serge.community.domain.Account;
import com.serge.community.domain.UserSession;
import com.serge.community.repo.UserSessionRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.oauth2.jose.jws.SignatureAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Opens, resolves and revokes member sessions. Every request resolves its actor here,
 * from the bearer token handed in by the controller.
 */
@Service
@RequiredArgsConstructor
public class SessionService {
    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    public static final String SESSION_CLAIM = "sid";
    public static final String MEMBER_SCOPE = "community";
    private static final String BEARER_PREFIX = "Bearer ";

    private final UserSessionRepository sessions;
    private final JwtEncoder jwtEncoder;
    private final JwtDecoder jwtDecoder;
    private final Clock clock;

    @Value("${AUTH_SERVER_ISSUER:http://localhost:8080}")
    private String issuer = "http://localhost:8080";

    @Value("${SESSION_TTL_DAYS:30}")
    private long ttlDays = 30;

    @Transactional
    public IssuedSession open(Account account) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        UserSession session = UserSession.builder()
                .account(account)
                .issuedAt(now)
                .expiresAt(now.plus(Duration.ofDays(ttlDays)))
                .build();
        sessions.save(session);

        JwtClaimsSet claims = JwtClaimsSet.builder()
                .issuer(issuer)
                .subject(account.getId().toString())
                .issuedAt(session.getIssuedAt().toInstant())
                .expiresAt(session.getExpiresAt().toInstant())
                .claim(SESSION_CLAIM, session.getId().toString())
                .claim("scope", MEMBER_SCOPE)
                .build();
        JwsHeader header = JwsHeader.with(SignatureAlgorithm.RS256).build();
        String token = jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
        log.info("session.open accountId={} sessionId={} expiresAt={}", account.getId(), session.getId(), session.getExpiresAt());
        return new IssuedSession(session.getId(), account.getId(), token, session.getExpiresAt());
    }

    /**
     * The account behind a bearer token, provided its session is still active and belongs
     * to the token subject. Anything else (no token, client token, revoked or expired session)
     * resolves to empty, i.e. anonymous.
     */
    @Transactional(readOnly = true)
    public Optional<Account> resolveAccount(Jwt jwt) {
        if (jwt == null) return Optional.empty();
        UUID sessionId = parseUuid(jwt.getClaimAsString(SESSION_CLAIM));
        if (sessionId == null) return Optional.empty();
        return sessions.findActive(sessionId, OffsetDateTime.now(clock))
                .map(UserSession::getAccount)
                .filter(a -> a.getId().toString().equals(jwt.getSubject()));
    }

    @Transactional(readOnly = true)
    public Actor resolveActor(Jwt jwt) {
        return resolveAccount(jwt).map(Actor::of).orElse(null);
    }

    /** Revokes the token's session. Returns false when there was nothing active to revoke. */
    @Transactional
    public boolean revoke(Jwt jwt, String reason) {
        if (jwt == null) return false;
        UUID sessionId = parseUuid(jwt.getClaimAsString(SESSION_CLAIM));
        if (sessionId == null) return false;
        boolean revoked = sessions.revoke(sessionId, OffsetDateTime.now(clock), reason) > 0;
        log.info("session.revoke sessionId={} reason={} revoked={}", sessionId, reason, revoked);
        return revoked;
    }

    /**
     * Revokes the session behind an Authorization header value. A missing, malformed, expired or
     * tampered token has nothing to revoke.
     */
    @Transactional
    public boolean revokeBearer(String authorization, String reason) {
        if (authorization == null
                || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return false;
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) return false;
        Jwt jwt;
        try {
            jwt = jwtDecoder.decode(token);
        } catch (JwtException e) {
            log.info("session.revoke.unusable_token reason={} err={}", reason, e.getMessage());
            return false;
        }
        return revoke(jwt, reason);
    }

    private static UUID parseUuid(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            log.warn("session.bad_sid value={}", value);
            return null;
        }
    }
}
