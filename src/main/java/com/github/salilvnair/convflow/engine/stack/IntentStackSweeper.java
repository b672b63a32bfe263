package com.github.salilvnair.convflow.engine.stack;

import com.github.salilvnair.convflow.engine.exception.ConvFlowException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Periodically removes expired top frames from every session the stack
 * service has touched. A session whose stack is gone is forgotten.
 */
@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "convflow.stack.sweep", name = "enabled", havingValue = "true")
public class IntentStackSweeper {

    private final IntentStackService stackService;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${convflow.stack.sweep.interval-ms:60000}")
    public void sweep() {
        Instant now = clock.instant();
        int removed = 0;
        for (String sessionId : stackService.knownSessions()) {
            try {
                removed += stackService.sweepExpired(sessionId, now);
                if (stackService.depth(sessionId) == 0) {
                    stackService.forget(sessionId);
                }
            } catch (ConvFlowException e) {
                log.warn("Stack sweep failed sessionId={} code={} msg={}", sessionId, e.getErrorCode(), e.getMessage());
            }
        }
        if (removed > 0) {
            log.info("Stack sweep removed {} expired frames", removed);
        }
    }
}
