package com.github.salilvnair.convflow.engine.transfer;

import com.github.salilvnair.convflow.config.ConvFlowProperties;
import com.github.salilvnair.convflow.engine.constants.ConvFlowStoreKey;
import com.github.salilvnair.convflow.store.core.KeyValueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Last-activity marker per session, read by the timeout special case.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class SessionActivityTracker {

    private final KeyValueStore store;
    private final ConvFlowProperties properties;
    private final Clock clock;

    public void touch(String sessionId) {
        store.set(ConvFlowStoreKey.lastActivity(sessionId), clock.instant().toString(), markerTtl());
    }

    /**
     * The marker outlives the stored stack, so a session that still has a
     * frame to resume always has a marker to time out on.
     */
    Duration markerTtl() {
        ConvFlowProperties.Stack stack = properties.getStack();
        Duration stackLifetime = stack.getFrameTtl().plus(stack.getStoreTtl());
        Duration activityTtl = properties.getTransfer().getActivityTtl();
        return activityTtl != null && activityTtl.compareTo(stackLifetime) > 0 ? activityTtl : stackLifetime;
    }

    public Optional<Instant> lastActivity(String sessionId) {
        Optional<String> marker = store.get(ConvFlowStoreKey.lastActivity(sessionId));
        if (marker.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(marker.get()));
        } catch (DateTimeParseException e) {
            log.warn("Unreadable activity marker sessionId={} value={}", sessionId, marker.get());
            return Optional.empty();
        }
    }

    /**
     * A session without a marker has never been active, or has outlived its
     * stack, and is not timed out.
     */
    public boolean isTimedOut(String sessionId) {
        Duration window = properties.getTransfer().getSessionTimeout();
        return lastActivity(sessionId)
                .map(last -> Duration.between(last, clock.instant()).compareTo(window) > 0)
                .orElse(false);
    }
}
