package com.github.salilvnair.convflow.engine.inheritance.cache;

import com.github.salilvnair.convflow.config.ConvFlowProperties;
import com.github.salilvnair.convflow.engine.constants.ConvFlowStoreKey;
import com.github.salilvnair.convflow.engine.exception.ConvFlowErrorCode;
import com.github.salilvnair.convflow.store.core.KeyValueStore;
import com.github.salilvnair.convflow.util.JsonUtil;
import com.github.salilvnair.convflow.util.SlotValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Memoizes inheritance results per user, intent, slot set and context
 * fingerprint. Expired and unreadable entries are deleted on read and count
 * as misses.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class InheritanceCacheManager {

    private final KeyValueStore store;
    private final ConvFlowProperties properties;
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public Optional<CachedInheritanceResult> get(InheritanceCacheKey key) {
        String renderedKey = key.render();
        Optional<String> payload = store.get(renderedKey);
        if (payload.isEmpty()) {
            misses.incrementAndGet();
            return Optional.empty();
        }

        CachedInheritanceResult cached;
        try {
            cached = JsonUtil.fromTypedJson(payload.get(), CachedInheritanceResult.class);
        } catch (IllegalStateException e) {
            log.warn("{} key={} msg={}", ConvFlowErrorCode.CACHE_CORRUPT.defaultMessage(), renderedKey, e.getMessage());
            store.delete(renderedKey);
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (cached == null || cached.cachedAt() == null || cached.values() == null) {
            log.warn("{} key={}", ConvFlowErrorCode.CACHE_CORRUPT.defaultMessage(), renderedKey);
            store.delete(renderedKey);
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (cached.isExpired(clock.instant())) {
            store.delete(renderedKey);
            misses.incrementAndGet();
            return Optional.empty();
        }

        hits.incrementAndGet();
        log.debug("Inheritance cache hit key={}", renderedKey);
        return Optional.of(cached);
    }

    public void set(InheritanceCacheKey key, Map<String, Object> values, Map<String, String> sources) {
        set(key, values, sources, properties.getCache().getDefaultTtl());
    }

    /**
     * Overwrites any entry under the same key. Values keep their JDK types
     * across the round trip.
     */
    public void set(InheritanceCacheKey key, Map<String, Object> values, Map<String, String> sources, Duration ttl) {
        Instant now = clock.instant();
        Map<String, Object> detached = new LinkedHashMap<>();
        values.forEach((slot, value) -> detached.put(slot, SlotValues.detach(value)));
        CachedInheritanceResult entry = new CachedInheritanceResult(detached, new LinkedHashMap<>(sources), now, ttl.getSeconds());
        store.set(key.render(), JsonUtil.toTypedJson(entry), ttl);
        log.debug("Cached inheritance result key={} ttl={}s", key.render(), ttl.getSeconds());
    }

    public int invalidateUser(String userId) {
        int deleted = store.deleteByPrefix(ConvFlowStoreKey.inheritanceUserPrefix(userId));
        log.info("Invalidated inheritance cache userId={} deleted={}", userId, deleted);
        return deleted;
    }

    public int invalidateIntent(String intentName) {
        int deleted = 0;
        for (String renderedKey : store.keysByPrefix(ConvFlowStoreKey.INHERITANCE)) {
            if (intentName.equals(InheritanceCacheKey.intentSegment(renderedKey)) && store.delete(renderedKey)) {
                deleted++;
            }
        }
        log.info("Invalidated inheritance cache intent={} deleted={}", intentName, deleted);
        return deleted;
    }

    public CacheStatistics statistics() {
        return CacheStatistics.of(hits.get(), misses.get());
    }

    public void resetStatistics() {
        hits.set(0);
        misses.set(0);
    }
}
