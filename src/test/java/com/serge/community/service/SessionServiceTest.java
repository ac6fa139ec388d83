package com.serge.community.service;

import com.serge.community.access.Actor;
import com.serge.community.domain.Account;
import com.serge.community.domain.UserSession;
import com.serge.community.repo.UserSessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private UserSessionRepository sessions;
    @Mock
    private JwtEncoder jwtEncoder;
    @Mock
    private JwtDecoder jwtDecoder;

    private SessionService service;
    private Account account;

    @BeforeEach
    void setUp() {
        service = new SessionService(sessions, jwtEncoder, jwtDecoder, CLOCK);
        account = Account.builder().id(UUID.randomUUID()).username("alice").build();
    }

    private static Jwt token(String subject, String sid) {
        Jwt.Builder b = Jwt.withTokenValue("token").header("alg", "RS256").subject(subject);
        if (sid != null) b.claim(SessionService.SESSION_CLAIM, sid);
        return b.build();
    }

    @Test
    void openPersistsSessionAndSignsClaims() {
        UUID sessionId = UUID.randomUUID();
        when(sessions.save(any(UserSession.class))).thenAnswer(inv -> {
            UserSession s = inv.getArgument(0);
            s.setId(sessionId);
            return s;
        });
        when(jwtEncoder.encode(any())).thenReturn(token(account.getId().toString(), sessionId.toString()));

        IssuedSession issued = service.open(account);

        assertThat(issued.sessionId()).isEqualTo(sessionId);
        assertThat(issued.accessToken()).isEqualTo("token");
        assertThat(issued.expiresAt()).isEqualTo(OffsetDateTime.now(CLOCK).plusDays(30));

        ArgumentCaptor<JwtEncoderParameters> params = ArgumentCaptor.forClass(JwtEncoderParameters.class);
        verify(jwtEncoder).encode(params.capture());
        JwtClaimsSet claims = params.getValue().getClaims();
        assertThat(claims.getSubject()).isEqualTo(account.getId().toString());
        assertThat((String) claims.getClaim(SessionService.SESSION_CLAIM)).isEqualTo(sessionId.toString());
        assertThat((String) claims.getClaim("scope")).isEqualTo(SessionService.MEMBER_SCOPE);
    }

    @Test
    void activeSessionResolvesToActor() {
        UUID sid = UUID.randomUUID();
        UserSession s = UserSession.builder().id(sid).account(account).build();
        when(sessions.findActive(sid, OffsetDateTime.now(CLOCK))).thenReturn(Optional.of(s));

        Actor actor = service.resolveActor(token(account.getId().toString(), sid.toString()));

        assertThat(actor).isNotNull();
        assertThat(actor.id()).isEqualTo(account.getId());
    }

    @Test
    void revokedOrExpiredSessionIsAnonymous() {
        UUID sid = UUID.randomUUID();
        when(sessions.findActive(eq(sid), any())).thenReturn(Optional.empty());

        assertThat(service.resolveActor(token(account.getId().toString(), sid.toString()))).isNull();
    }

    @Test
    void subjectMismatchIsAnonymous() {
        UUID sid = UUID.randomUUID();
        UserSession s = UserSession.builder().id(sid).account(account).build();
        when(sessions.findActive(eq(sid), any())).thenReturn(Optional.of(s));

        assertThat(service.resolveAccount(token(UUID.randomUUID().toString(), sid.toString()))).isEmpty();
    }

    @Test
    void tokensWithoutSessionAreAnonymous() {
        assertThat(service.resolveActor(null)).isNull();
        assertThat(service.resolveActor(token("community-admin", null))).isNull();
        assertThat(service.resolveActor(token("x", "not-a-uuid"))).isNull();
        verifyNoInteractions(sessions);
    }

    @Test
    void revokeIsIdempotent() {
        UUID sid = UUID.randomUUID();
        when(sessions.revoke(eq(sid), any(), eq("LOGOUT"))).thenReturn(1, 0);
        Jwt jwt = token(account.getId().toString(), sid.toString());

        assertThat(service.revoke(jwt, "LOGOUT")).isTrue();
        assertThat(service.revoke(jwt, "LOGOUT")).isFalse();
        assertThat(service.revoke(null, "LOGOUT")).isFalse();
    }

    @Test
    void bearerHeaderRevokesItsSession() {
        UUID sid = UUID.randomUUID();
        when(jwtDecoder.decode("abc.def.ghi")).thenReturn(token(account.getId().toString(), sid.toString()));
        when(sessions.revoke(eq(sid), any(), eq("LOGOUT"))).thenReturn(1);

        assertThat(service.revokeBearer("Bearer abc.def.ghi", "LOGOUT")).isTrue();
    }

    @Test
    void unusableBearerHasNothingToRevoke() {
        when(jwtDecoder.decode("expired")).thenThrow(new BadJwtException("Jwt expired"));

        assertThat(service.revokeBearer("Bearer expired", "LOGOUT")).isFalse();
        assertThat(service.revokeBearer("Basic dXNlcjpwdw==", "LOGOUT")).isFalse();
        assertThat(service.revokeBearer("Bearer ", "LOGOUT")).isFalse();
        assertThat(service.revokeBearer(null, "LOGOUT")).isFalse();
        verifyNoInteractions(sessions);
    }
}
