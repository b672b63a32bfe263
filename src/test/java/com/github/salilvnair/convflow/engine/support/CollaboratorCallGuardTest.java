package com.github.salilvnair.convflow.engine.support;

import com.github.salilvnair.convflow.engine.exception.ConvFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.ConvFlowException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.github.salilvnair.convflow.support.TestConstants.BOOM;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CollaboratorCallGuardTest {

    private ExecutorService executor;
    private CollaboratorCallGuard guard;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        guard = new CollaboratorCallGuard(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void returnsValueOfSuccessfulCall() {
        assertEquals("ok", guard.call("profile", Duration.ofSeconds(1), () -> "ok"));
    }

    @Test
    void failingCallBecomesSourceUnavailable() {
        ConvFlowException error = assertThrows(ConvFlowException.class,
                () -> guard.call("profile", Duration.ofSeconds(1), () -> {
                    throw new IllegalStateException(BOOM);
                }));

        assertEquals(ConvFlowErrorCode.SOURCE_UNAVAILABLE, error.getCode());
        assertTrue(error.getMessage().contains(BOOM));
        assertEquals("profile", error.getMetaData().get("source"));
        assertSame(IllegalStateException.class, error.getCause().getClass());
    }

    @Test
    void slowCallTimesOut() {
        CountDownLatch never = new CountDownLatch(1);

        ConvFlowException error = assertThrows(ConvFlowException.class,
                () -> guard.call("classifier", Duration.ofMillis(50), () -> {
                    try {
                        never.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return "late";
                }));

        assertEquals(ConvFlowErrorCode.SOURCE_UNAVAILABLE, error.getCode());
        assertTrue(error.getMessage().contains("timed out"));
    }

    @Test
    void rejectedSubmissionBecomesSourceUnavailable() {
        executor.shutdown();

        ConvFlowException error = assertThrows(ConvFlowException.class,
                () -> guard.call("history", Duration.ofSeconds(1), () -> "never"));

        assertEquals(ConvFlowErrorCode.SOURCE_UNAVAILABLE, error.getCode());
        assertTrue(error.getMessage().contains("rejected"));
    }
}
