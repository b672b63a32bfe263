package com.github.salilvnair.convflow.engine.support;

import com.github.salilvnair.convflow.config.ConvFlowAutoConfiguration;
import com.github.salilvnair.convflow.engine.exception.ConvFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.ConvFlowException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs calls into external collaborators with a time bound. Any failure or
 * timeout surfaces as {@link ConvFlowErrorCode#SOURCE_UNAVAILABLE}; nothing is retried here.
 */
@Slf4j
@Component
public class CollaboratorCallGuard {

    private final ExecutorService executor;

    public CollaboratorCallGuard(@Qualifier(ConvFlowAutoConfiguration.COLLABORATOR_EXECUTOR) ExecutorService executor) {
        this.executor = executor;
    }

    public <T> T call(String source, Duration timeout, Supplier<T> call) {
        Future<T> future;
        try {
            future = executor.submit(call::get);
        } catch (RuntimeException e) {
            throw unavailable(source, "rejected: " + e.getMessage(), e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw unavailable(source, "timed out after " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw unavailable(source, "interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw unavailable(source, cause.getMessage(), cause);
        }
    }

    private ConvFlowException unavailable(String source, String detail, Throwable cause) {
        log.warn("Collaborator unavailable source={} detail={}", source, detail);
        return new ConvFlowException(
                ConvFlowErrorCode.SOURCE_UNAVAILABLE,
                source + " unavailable: " + detail,
                cause
        ).withMetaData(Map.of("source", source));
    }
}
