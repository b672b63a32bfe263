package com.github.salilvnair.convflow.engine.inheritance.cache;

import com.github.salilvnair.convflow.engine.constants.ConvFlowStoreKey;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * {@code inheritance:<user>:<intent>:<sorted slots>:<context hash>}
 */
public record InheritanceCacheKey(String userId, String intentName, List<String> slots, String contextHash) {

    private static final String SLOT_SEPARATOR = ",";

    public InheritanceCacheKey {
        slots = List.copyOf(new TreeSet<>(slots));
    }

    public static InheritanceCacheKey of(String userId, String intentName, Collection<String> slots, String contextHash) {
        return new InheritanceCacheKey(userId, intentName, List.copyOf(slots), contextHash);
    }

    public String render() {
        return ConvFlowStoreKey.inheritanceUserPrefix(userId)
                + intentName + ConvFlowStoreKey.SEPARATOR
                + String.join(SLOT_SEPARATOR, slots) + ConvFlowStoreKey.SEPARATOR
                + contextHash;
    }

    /**
     * Intent segment of a rendered key, read from the right so user ids may
     * contain the separator. {@code null} for keys of another shape.
     */
    static String intentSegment(String renderedKey) {
        String[] parts = renderedKey.split(ConvFlowStoreKey.SEPARATOR, -1);
        return parts.length < 5 ? null : parts[parts.length - 3];
    }
}
