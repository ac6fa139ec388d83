package com.serge.community.service;

import com.serge.community.domain.Account;
import com.serge.community.domain.ConfirmationToken;
import com.serge.community.repo.AccountRepository;
import com.serge.community.repo.ConfirmationTokenRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RegistrationServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private AccountRepository accounts;
    @Mock
    private ConfirmationTokenRepository tokens;
    @Mock
    private SessionService sessions;
    @Mock
    private PresenceTracker presence;
    @Mock
    private PasswordEncoder encoder;
    @Mock
    private ApplicationEventPublisher events;

    private RegistrationService service;

    @BeforeEach
    void setUp() {
        service = new RegistrationService(accounts, tokens, sessions, presence, encoder, events, CLOCK);
    }

    private Account account(boolean confirmed) {
        return Account.builder()
                .id(UUID.randomUUID())
                .username("alice")
                .email("a@x.com")
                .passwordHash("hash")
                .confirmed(confirmed)
                .build();
    }

    private IssuedSession issued(Account a) {
        return new IssuedSession(UUID.randomUUID(), a.getId(), "token", OffsetDateTime.now(CLOCK).plusDays(30));
    }

    @Test
    void registerCreatesPendingAccountTokenAndEvent() {
        UUID id = UUID.randomUUID();
        when(encoder.encode("p@ss1")).thenReturn("hash");
        when(accounts.saveAndFlush(any(Account.class))).thenAnswer(inv -> {
            Account a = inv.getArgument(0);
            a.setId(id);
            return a;
        });

        Account a = service.register("alice", "a@x.com", "p@ss1");

        assertThat(a.isConfirmed()).isFalse();
        assertThat(a.getPasswordHash()).isEqualTo("hash");

        ArgumentCaptor<ConfirmationToken> token = ArgumentCaptor.forClass(ConfirmationToken.class);
        verify(tokens).save(token.capture());
        assertThat(token.getValue().getAccount()).isSameAs(a);
        assertThat(token.getValue().getCode()).hasSize(RegistrationService.CODE_LENGTH).matches("[A-Za-z0-9]+");

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(events).publishEvent(event.capture());
        AccountRegisteredEvent e = (AccountRegisteredEvent) event.getValue();
        assertThat(e.accountId()).isEqualTo(id);
        assertThat(e.email()).isEqualTo("a@x.com");
        assertThat(e.confirmationCode()).isEqualTo(token.getValue().getCode());
    }

    @Test
    void invalidInputIsRejectedPerFieldAndNothingPersisted() {
        assertThatThrownBy(() -> service.register("al", "not-an-email", "1234"))
                .isInstanceOf(InputRejectedException.class)
                .satisfies(ex -> assertThat(((InputRejectedException) ex).getFieldErrors())
                        .containsOnlyKeys("username", "email", "password"));

        verify(accounts, never()).saveAndFlush(any());
        verifyNoInteractions(tokens, events);
    }

    @Test
    void takenEmailIsRejected() {
        when(accounts.existsByEmailIgnoreCase("a@x.com")).thenReturn(true);

        assertThatThrownBy(() -> service.register("alice", "A@x.com", "p@ss1"))
                .isInstanceOf(InputRejectedException.class)
                .satisfies(ex -> assertThat(((InputRejectedException) ex).getFieldErrors())
                        .containsOnlyKeys("email"));
        verifyNoInteractions(tokens, events);
    }

    @Test
    void raceOnUniqueConstraintBecomesRejection() {
        when(encoder.encode("p@ss1")).thenReturn("hash");
        when(accounts.saveAndFlush(any(Account.class))).thenThrow(new DataIntegrityViolationException("dup"));

        assertThatThrownBy(() -> service.register("alice", "a@x.com", "p@ss1"))
                .isInstanceOf(InputRejectedException.class);
        verifyNoInteractions(tokens, events);
    }

    @Test
    void confirmationCodesDiffer() {
        Set<String> codes = new HashSet<>();
        for (int i = 0; i < 100; i++) codes.add(service.newConfirmationCode());
        assertThat(codes).hasSize(100);
    }

    @Test
    void unknownCodeIsInvalidAndChangesNothing() {
        when(tokens.findByCode("zzz")).thenReturn(Optional.empty());

        assertThat(service.confirm("zzz")).isEmpty();

        verify(tokens, never()).deleteByCode(any());
        verifyNoInteractions(sessions, presence);
    }

    @Test
    void confirmConsumesTokenAndOpensSession() {
        Account a = account(false);
        when(tokens.findByCode("CODE")).thenReturn(Optional.of(ConfirmationToken.builder().code("CODE").account(a).build()));
        when(tokens.deleteByCode("CODE")).thenReturn(1);
        IssuedSession s = issued(a);
        when(sessions.open(a)).thenReturn(s);

        assertThat(service.confirm("CODE")).contains(s);
        assertThat(a.isConfirmed()).isTrue();
        verify(accounts).save(a);
        verify(presence).touchLogin(a);
    }

    @Test
    void confirmLosingTheRaceIsInvalid() {
        Account a = account(false);
        when(tokens.findByCode("CODE")).thenReturn(Optional.of(ConfirmationToken.builder().code("CODE").account(a).build()));
        when(tokens.deleteByCode("CODE")).thenReturn(0);

        assertThat(service.confirm("CODE")).isEmpty();
        assertThat(a.isConfirmed()).isFalse();
        verifyNoInteractions(sessions, presence);
    }

    @Test
    void unknownEmailStillHashesAndFails() {
        when(accounts.findByEmailIgnoreCase("nobody@x.com")).thenReturn(Optional.empty());

        assertThat(service.login("nobody@x.com", "pw")).isEmpty();

        verify(encoder).matches(eq("pw"), any());
        verifyNoInteractions(sessions, presence);
    }

    @Test
    void wrongPasswordFails() {
        Account a = account(true);
        when(accounts.findByEmailIgnoreCase("a@x.com")).thenReturn(Optional.of(a));
        when(encoder.matches("wrong", "hash")).thenReturn(false);

        assertThat(service.login("a@x.com", "wrong")).isEmpty();
        verifyNoInteractions(sessions, presence);
    }

    @Test
    void loginOpensSessionAndTouchesPresence() {
        Account a = account(true);
        when(accounts.findByEmailIgnoreCase("a@x.com")).thenReturn(Optional.of(a));
        when(encoder.matches("p@ss1", "hash")).thenReturn(true);
        IssuedSession s = issued(a);
        when(sessions.open(a)).thenReturn(s);

        assertThat(service.login("a@x.com", "p@ss1")).contains(s);
        verify(presence).touchLogin(a);
    }

    @Test
    void unconfirmedAccountMayLogInByDefault() {
        Account a = account(false);
        when(accounts.findByEmailIgnoreCase("a@x.com")).thenReturn(Optional.of(a));
        when(encoder.matches("p@ss1", "hash")).thenReturn(true);
        when(sessions.open(a)).thenReturn(issued(a));

        assertThat(service.login("a@x.com", "p@ss1")).isPresent();
    }

    @Test
    void unconfirmedAccountIsRejectedWhenConfirmationRequired() {
        ReflectionTestUtils.setField(service, "requireConfirmed", true);
        Account a = account(false);
        when(accounts.findByEmailIgnoreCase("a@x.com")).thenReturn(Optional.of(a));
        when(encoder.matches("p@ss1", "hash")).thenReturn(true);

        assertThat(service.login("a@x.com", "p@ss1")).isEmpty();
        verifyNoInteractions(sessions, presence);
    }

    @Test
    void logoutRevokesSession() {
        service.logout("Bearer abc");

        verify(sessions).revokeBearer("Bearer abc", "LOGOUT");
    }
}
