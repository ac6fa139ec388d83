package com.serge.community.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.serge.community.domain.Tip;
import com.serge.community.repo.TipRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Latest-tips feed, cached in Redis. The cache holds the newest {@link #CACHED_TIPS} and is
 * dropped after a tip is created or edited and that change has committed, so a concurrent
 * reader cannot put the old rows back. Redis being down only costs a database read.
 */
@Service
@RequiredArgsConstructor
public class TipFeedService {
    private static final Logger log = LoggerFactory.getLogger(TipFeedService.class);

    static final String CACHE_KEY = "tips:latest";
    static final int CACHED_TIPS = 50;
    private static final Duration TTL = Duration.ofMinutes(5);
    private static final TypeReference<List<TipItem>> ITEMS = new TypeReference<>() {};

    private final TipRepository tips;
    private final StringRedisTemplate redis;
    private final ObjectMapper mapper;

    public record TipItem(UUID id, UUID authorId, String authorUsername, String body, String publishedAt) {
        public static TipItem of(Tip t) {
            return new TipItem(t.getId(), t.getAuthor().getId(), t.getAuthor().getUsername(),
                    t.getBody(), t.getPublishedAt().toString());
        }
    }

    @Transactional(readOnly = true)
    public List<TipItem> latest(int limit) {
        int n = Math.max(1, Math.min(limit, CACHED_TIPS));
        List<TipItem> all = readCache();
        if (all == null) {
            all = tips.findAllByOrderByPublishedAtDesc(PageRequest.of(0, CACHED_TIPS)).stream()
                    .map(TipItem::of)
                    .toList();
            writeCache(all);
        }
        return all.size() <= n ? all : all.subList(0, n);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onTipChanged(TipChangedEvent event) {
        log.debug("tips.changed id={}", event.tipId());
        evict();
    }

    public void evict() {
        try {
            redis.delete(CACHE_KEY);
            log.debug("tips.cache.evicted key={}", CACHE_KEY);
        } catch (RuntimeException e) {
            log.warn("tips.cache.evict_failed key={} err={}", CACHE_KEY, e.toString());
        }
    }

    private List<TipItem> readCache() {
        try {
            String json = redis.opsForValue().get(CACHE_KEY);
            if (json == null) return null;
            List<TipItem> hit = mapper.readValue(json, ITEMS);
            log.trace("tips.cache.hit key={} size={}", CACHE_KEY, hit.size());
            return hit;
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("tips.cache.read_failed key={} err={}", CACHE_KEY, e.toString());
            return null;
        }
    }

    private void writeCache(List<TipItem> items) {
        try {
            redis.opsForValue().set(CACHE_KEY, mapper.writeValueAsString(items), TTL);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("tips.cache.write_failed key={} err={}", CACHE_KEY, e.toString());
        }
    }
}
