package com.github.salilvnair.convflow.engine.inheritance.source;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record UserProfile(
        Map<String, Object> preferences,
        Map<String, Object> frequentValues,
        Instant lastModified
) {

    private static final String MOST_FREQUENT = "most_frequent";

    /**
     * Flat attribute view used as the USER_PROFILE slot source. Frequent values
     * win over stated preferences; a frequent entry may be a bare value or a map
     * carrying {@code most_frequent}.
     */
    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        if (preferences != null) {
            attributes.putAll(preferences);
        }
        if (frequentValues != null) {
            frequentValues.forEach((slot, value) -> {
                if (value instanceof Map<?, ?> stats) {
                    Object mostFrequent = stats.get(MOST_FREQUENT);
                    if (mostFrequent != null) {
                        attributes.put(slot, mostFrequent);
                    }
                } else if (value != null) {
                    attributes.put(slot, value);
                }
            });
        }
        return attributes;
    }
}
