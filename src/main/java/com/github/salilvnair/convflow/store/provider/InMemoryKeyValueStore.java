package com.github.salilvnair.convflow.store.provider;

import com.github.salilvnair.convflow.store.core.KeyValueStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Expired entries are dropped when read, when listed by prefix and in a full
 * purge every {@value #PURGE_INTERVAL_WRITES} writes.
 */
@Slf4j
public class InMemoryKeyValueStore implements KeyValueStore {

    static final int PURGE_INTERVAL_WRITES = 1024;

    private final Map<String, StoredValue> entries = new ConcurrentHashMap<>();
    private final AtomicInteger writesSincePurge = new AtomicInteger();
    private final Clock clock;

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        StoredValue stored = entries.get(key);
        if (stored == null) {
            return Optional.empty();
        }
        if (stored.isExpired(clock.instant())) {
            entries.remove(key, stored);
            return Optional.empty();
        }
        return Optional.of(stored.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        Instant expiresAt = ttl == null ? null : clock.instant().plus(ttl);
        entries.put(key, new StoredValue(value, expiresAt));
        if (writesSincePurge.incrementAndGet() >= PURGE_INTERVAL_WRITES) {
            writesSincePurge.set(0);
            purgeExpired();
        }
    }

    @Override
    public boolean delete(String key) {
        return entries.remove(key) != null;
    }

    @Override
    public int deleteByPrefix(String prefix) {
        int removed = 0;
        for (String key : keysByPrefix(prefix)) {
            if (entries.remove(key) != null) {
                removed++;
            }
        }
        log.debug("Deleted {} entries with prefix={}", removed, prefix);
        return removed;
    }

    @Override
    public Set<String> keysByPrefix(String prefix) {
        Instant now = clock.instant();
        Set<String> keys = new HashSet<>();
        entries.forEach((key, stored) -> {
            if (!key.startsWith(prefix)) {
                return;
            }
            if (stored.isExpired(now)) {
                entries.remove(key, stored);
            } else {
                keys.add(key);
            }
        });
        return keys;
    }

    /**
     * @return number of expired entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, StoredValue> entry : entries.entrySet()) {
            if (entry.getValue().isExpired(now) && entries.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Purged {} expired entries", removed);
        }
        return removed;
    }

    /**
     * Live entries only; expired ones are purged first.
     */
    public int size() {
        purgeExpired();
        return entries.size();
    }

    private record StoredValue(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && now.isAfter(expiresAt);
        }
    }
}
