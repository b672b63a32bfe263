package com.github.salilvnair.convflow.engine.inheritance.cache;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Map;

/**
 * Stored form of an inheritance result. Written once, never updated.
 */
public record CachedInheritanceResult(
        Map<String, Object> values,
        Map<String, String> sources,
        Instant cachedAt,
        long ttlSeconds
) {

    @JsonIgnore
    public boolean isExpired(Instant now) {
        return now.isAfter(cachedAt.plusSeconds(ttlSeconds));
    }
}
