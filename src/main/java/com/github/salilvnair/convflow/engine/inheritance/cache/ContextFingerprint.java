package com.github.salilvnair.convflow.engine.inheritance.cache;

import com.github.salilvnair.convflow.engine.constants.ConvFlowContextKey;
import com.github.salilvnair.convflow.util.JsonUtil;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Short hash of the inputs that can change an inheritance result without
 * changing the cache key's user, intent or slot set.
 */
public final class ContextFingerprint {

    private static final int LENGTH = 16;

    private ContextFingerprint() {
    }

    public static String compute(Map<String, Object> currentValues,
                                 Instant profileLastModified,
                                 Collection<String> sessionContextKeys,
                                 Collection<String> conversationContextKeys) {
        Map<String, Object> relevant = new LinkedHashMap<>();
        relevant.put(ConvFlowContextKey.CURRENT_VALUES, currentValues == null ? Map.of() : currentValues);
        relevant.put(ConvFlowContextKey.USER_PROFILE_TIMESTAMP,
                profileLastModified == null ? null : profileLastModified.toString());
        relevant.put(ConvFlowContextKey.SESSION_CONTEXT_KEYS, sorted(sessionContextKeys));
        relevant.put(ConvFlowContextKey.CONVERSATION_CONTEXT_KEYS, sorted(conversationContextKeys));

        String canonical = JsonUtil.toCanonicalJson(relevant);
        return DigestUtils.md5DigestAsHex(canonical.getBytes(StandardCharsets.UTF_8)).substring(0, LENGTH);
    }

    private static List<String> sorted(Collection<String> keys) {
        return keys == null ? List.of() : List.copyOf(new TreeSet<>(keys));
    }
}
