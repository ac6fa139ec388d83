package com.serge.community.service;

import com.serge.community.domain.Account;
import com.serge.community.repo.AccountRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class ProfileService {
    private static final Logger log = LoggerFactory.getLogger(ProfileService.class);

    public static final Set<String> SOCIAL_NETWORKS = Set.of("github", "twitter", "linkedin", "website");
    static final int MAX_LINK_LENGTH = 255;

    private final AccountRepository accounts;
    private final StorageService storage;
    private final Clock clock;

    /** Uploaded avatar if there is one, otherwise the Gravatar for the account email. */
    public String avatarUrl(Account account) {
        if (account.getAvatarKey() != null) {
            return storage.publicUrl(account.getAvatarKey());
        }
        String hash = DigestUtils.md5DigestAsHex(
                account.getEmail().trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
        return "https://www.gravatar.com/avatar/" + hash + "?d=identicon";
    }

    @Transactional
    public Account updateAvatar(Account account, byte[] bytes, String contentType) {
        String key = storage.uploadAvatar(account.getId(), bytes, contentType);
        account.setAvatarKey(key);
        account.setUpdatedAt(OffsetDateTime.now(clock));
        log.info("profile.avatar.updated accountId={}", account.getId());
        return accounts.save(account);
    }

    /**
     * Replaces the social links. Blank values drop the entry.
     *
     * @throws InputRejectedException for unknown networks or values that are not http(s) links
     */
    @Transactional
    public Account updateSocialLinks(Account account, Map<String, String> links) {
        Map<String, String> clean = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        if (links != null) {
            links.forEach((network, url) -> {
                String key = network == null ? "" : network.trim().toLowerCase(Locale.ROOT);
                if (!SOCIAL_NETWORKS.contains(key)) {
                    errors.put(String.valueOf(network), "Unknown network");
                    return;
                }
                if (url == null || url.isBlank()) return;
                String value = url.trim();
                if (value.length() > MAX_LINK_LENGTH
                        || !(value.startsWith("https://") || value.startsWith("http://"))) {
                    errors.put(key, "Must be an http(s) link");
                    return;
                }
                clean.put(key, value);
            });
        }
        if (!errors.isEmpty()) {
            throw new InputRejectedException(errors);
        }
        account.setSocialLinks(clean);
        account.setUpdatedAt(OffsetDateTime.now(clock));
        log.info("profile.social.updated accountId={} networks={}", account.getId(), clean.keySet());
        return accounts.save(account);
    }
}
