package com.github.salilvnair.convflow.engine.stack;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.salilvnair.convflow.config.ConvFlowProperties;
import com.github.salilvnair.convflow.engine.constants.ConvFlowStoreKey;
import com.github.salilvnair.convflow.engine.exception.ConvFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.ConvFlowException;
import com.github.salilvnair.convflow.engine.stack.model.IntentFrame;
import com.github.salilvnair.convflow.store.core.KeyValueStore;
import com.github.salilvnair.convflow.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores a session's stack as one JSON list of frame records. Every load
 * returns fresh frame objects, so callers mutate copies and commit with a
 * single {@link #save}.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class IntentStackRepository {

    private static final TypeReference<List<IntentFrame>> FRAME_LIST = new TypeReference<>() {};

    private final KeyValueStore store;
    private final ConvFlowProperties properties;
    private final Clock clock;

    public List<IntentFrame> load(String sessionId) {
        Optional<String> payload = store.get(ConvFlowStoreKey.intentStack(sessionId));
        if (payload.isEmpty()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(JsonUtil.fromJson(payload.get(), FRAME_LIST));
        } catch (IllegalStateException e) {
            log.error("Stored intent stack unreadable sessionId={} msg={}", sessionId, e.getMessage());
            throw new ConvFlowException(
                    ConvFlowErrorCode.STACK_STATE_CORRUPT,
                    "Stored intent stack unreadable for session " + sessionId,
                    e
            );
        }
    }

    public void save(String sessionId, List<IntentFrame> frames) {
        String key = ConvFlowStoreKey.intentStack(sessionId);
        try {
            if (frames.isEmpty()) {
                store.delete(key);
                return;
            }
            store.set(key, JsonUtil.toJson(frames), storeTtl(frames));
        } catch (RuntimeException e) {
            log.error("Failed to persist intent stack sessionId={} msg={}", sessionId, e.getMessage());
            throw new ConvFlowException(
                    ConvFlowErrorCode.STACK_PERSIST_FAILED,
                    "Failed to persist intent stack for session " + sessionId,
                    e
            );
        }
    }

    /**
     * Kept until the newest frame expires, plus the configured store TTL.
     */
    Duration storeTtl(List<IntentFrame> frames) {
        Duration grace = properties.getStack().getStoreTtl();
        Instant now = clock.instant();
        return frames.stream()
                .map(IntentFrame::getExpiresAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .filter(latest -> latest.isAfter(now))
                .map(latest -> Duration.between(now, latest).plus(grace))
                .orElse(grace);
    }

    public boolean clear(String sessionId) {
        return store.delete(ConvFlowStoreKey.intentStack(sessionId));
    }
}
