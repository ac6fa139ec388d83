package com.serge.community.service;

import com.serge.community.domain.Account;
import com.serge.community.domain.ConfirmationToken;
import com.serge.community.repo.AccountRepository;
import com.serge.community.repo.ConfirmationTokenRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Account lifecycle: register (pending), confirm by emailed code, login, logout.
 */
@Service
@RequiredArgsConstructor
public class RegistrationService {
    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    static final int CODE_LENGTH = 20;
    private static final String CODE_ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final Pattern USERNAME = Pattern.compile("^[A-Za-z0-9_.-]{3,32}$");
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    static final int MIN_PASSWORD_LENGTH = 5;

    private final AccountRepository accounts;
    private final ConfirmationTokenRepository tokens;
    private final SessionService sessions;
    private final PresenceTracker presence;
    private final PasswordEncoder encoder;
    private final ApplicationEventPublisher events;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    // Unconfirmed accounts may log in unless this is switched on.
    @Value("${AUTH_REQUIRE_CONFIRMED:false}")
    private boolean requireConfirmed;

    private volatile String dummyHash;

    /**
     * Creates an unconfirmed account and its confirmation token, and queues the confirmation mail.
     *
     * @throws InputRejectedException with per-field messages; nothing is persisted in that case
     */
    @Transactional
    public Account register(String username, String email, String password) {
        String handle = username == null ? null : username.trim();
        String mail = email == null ? null : email.trim().toLowerCase(Locale.ROOT);
        log.info("registration.register username={} email={}", handle, mail);

        Map<String, String> errors = validate(handle, mail, password);
        if (!errors.isEmpty()) {
            log.info("registration.rejected username={} fields={}", handle, errors.keySet());
            throw new InputRejectedException(errors);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Account account = Account.builder()
                .username(handle)
                .email(mail)
                .passwordHash(encoder.encode(password))
                .confirmed(false)
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            accounts.saveAndFlush(account);
        } catch (DataIntegrityViolationException e) {
            // lost a race with a concurrent registration for the same handle or email
            log.info("registration.rejected.duplicate username={} email={}", handle, mail);
            throw new InputRejectedException(Map.of("account", "Username or email is already taken"));
        }

        ConfirmationToken token = ConfirmationToken.builder()
                .code(newConfirmationCode())
                .account(account)
                .createdAt(now)
                .build();
        tokens.save(token);
        log.debug("registration.token_created accountId={} code.preview={}", account.getId(), token.getCode().substring(0, 4));

        events.publishEvent(new AccountRegisteredEvent(account.getId(), handle, mail, token.getCode()));
        return account;
    }

    /**
     * Consumes a confirmation code. The token row is removed with a conditional delete, so of
     * several concurrent calls with the same code exactly one succeeds.
     *
     * @return the session opened for the confirmed account, or empty for an unknown or already used code
     */
    @Transactional
    public Optional<IssuedSession> confirm(String code) {
        if (code == null || code.isBlank()) return Optional.empty();
        Optional<ConfirmationToken> found = tokens.findByCode(code);
        if (found.isEmpty()) {
            log.warn("registration.confirm.unknown_code");
            return Optional.empty();
        }
        if (tokens.deleteByCode(code) == 0) {
            log.warn("registration.confirm.already_consumed");
            return Optional.empty();
        }
        Account account = found.get().getAccount();
        account.setConfirmed(true);
        account.setUpdatedAt(OffsetDateTime.now(clock));
        accounts.save(account);

        IssuedSession session = sessions.open(account);
        presence.touchLogin(account);
        log.info("registration.confirm.success accountId={}", account.getId());
        return Optional.of(session);
    }

    /**
     * Password login. Unknown email, wrong password and (when required) unconfirmed account all
     * yield the same empty result.
     */
    @Transactional
    public Optional<IssuedSession> login(String email, String password) {
        Optional<Account> found = email == null
                ? Optional.empty()
                : accounts.findByEmailIgnoreCase(email.trim());
        if (found.isEmpty() || password == null) {
            // spend the same hashing time as a real check
            encoder.matches(password == null ? "" : password, dummyHash());
            log.info("auth.login.failed");
            return Optional.empty();
        }
        Account account = found.get();
        if (!encoder.matches(password, account.getPasswordHash())) {
            log.info("auth.login.failed accountId={}", account.getId());
            return Optional.empty();
        }
        if (requireConfirmed && !account.isConfirmed()) {
            log.info("auth.login.unconfirmed accountId={}", account.getId());
            return Optional.empty();
        }
        IssuedSession session = sessions.open(account);
        presence.touchLogin(account);
        log.info("auth.login.success accountId={}", account.getId());
        return Optional.of(session);
    }

    /** Ends the session named by the Authorization header. Safe to call without a usable one. */
    @Transactional
    public void logout(String authorization) {
        sessions.revokeBearer(authorization, "LOGOUT");
    }

    Map<String, String> validate(String username, String email, String password) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (username == null || username.isEmpty()) {
            errors.put("username", "Username is required");
        } else if (!USERNAME.matcher(username).matches()) {
            errors.put("username", "Use 3-32 letters, digits, '.', '_' or '-'");
        } else if (accounts.existsByUsernameIgnoreCase(username)) {
            errors.put("username", "Username is already taken");
        }

        if (email == null || email.isEmpty()) {
            errors.put("email", "Email is required");
        } else if (!EMAIL.matcher(email).matches()) {
            errors.put("email", "Email is not valid");
        } else if (accounts.existsByEmailIgnoreCase(email)) {
            errors.put("email", "Email is already registered");
        }

        if (password == null || password.isEmpty()) {
            errors.put("password", "Password is required");
        } else if (password.length() < MIN_PASSWORD_LENGTH) {
            errors.put("password", "Password must have at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        return errors;
    }

    String newConfirmationCode() {
        StringBuilder sb = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            sb.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
        }
        return sb.toString();
    }

    private String dummyHash() {
        String h = dummyHash;
        if (h == null) {
            h = encoder.encode("not-a-real-password");
            dummyHash = h;
        }
        return h;
    }
}
