package com.serge.community.service;

import com.serge.community.domain.Account;
import com.serge.community.repo.AccountRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Last-activity bookkeeping. Activity writes are debounced to one per presence window,
 * and "online" means active within that window.
 */
@Service
@RequiredArgsConstructor
public class PresenceTracker {
    private static final Logger log = LoggerFactory.getLogger(PresenceTracker.class);

    public static final Duration PRESENCE_WINDOW = Duration.ofSeconds(120);

    private final AccountRepository accounts;
    private final Clock clock;

    /**
     * Records activity unless the account was already active within the window.
     *
     * @return true when the timestamp was written, false when the call was debounced
     */
    @Transactional
    public boolean touchActivity(Account account) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (isOnline(account, now)) {
            log.trace("presence.touch.skipped accountId={} lastActivityAt={}", account.getId(), account.getLastActivityAt());
            return false;
        }
        int updated = accounts.touchActivity(account.getId(), now, now.minus(PRESENCE_WINDOW));
        if (updated == 0) {
            // a concurrent request already wrote it
            return false;
        }
        account.setLastActivityAt(now);
        log.debug("presence.touch accountId={} at={}", account.getId(), now);
        return true;
    }

    @Transactional
    public void touchLogin(Account account) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        accounts.touchLogin(account.getId(), now);
        account.setLastLoginAt(now);
        account.setLastActivityAt(now);
        log.debug("presence.login accountId={} at={}", account.getId(), now);
    }

    public boolean isOnline(Account account) {
        return isOnline(account, OffsetDateTime.now(clock));
    }

    /** Online iff active at most PRESENCE_WINDOW before {@code asOf}; the boundary counts as online. */
    public boolean isOnline(Account account, OffsetDateTime asOf) {
        OffsetDateTime last = account.getLastActivityAt();
        if (last == null) return false;
        return Duration.between(last, asOf).compareTo(PRESENCE_WINDOW) <= 0;
    }

    @Transactional(readOnly = true)
    public List<Account> onlineAccounts(Pageable page) {
        return accounts.findOnline(threshold(), page);
    }

    @Transactional(readOnly = true)
    public List<Account> offlineAccounts(Pageable page) {
        return accounts.findOffline(threshold(), page);
    }

    private OffsetDateTime threshold() {
        return OffsetDateTime.now(clock).minus(PRESENCE_WINDOW);
    }
}
