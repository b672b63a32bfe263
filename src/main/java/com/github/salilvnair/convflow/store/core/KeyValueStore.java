package com.github.salilvnair.convflow.store.core;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Backing store for stacks, activity markers, transfer history and cached
 * inheritance results. Values are JSON text.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    /**
     * @param ttl time to live, or {@code null} to keep the entry until deleted
     */
    void set(String key, String value, Duration ttl);

    boolean delete(String key);

    int deleteByPrefix(String prefix);

    Set<String> keysByPrefix(String prefix);
}
