package com.github.salilvnair.convflow.engine.inheritance.model;

import java.time.Instant;

/**
 * @param timestamp when the value was observed, {@code null} if unknown
 */
public record SourceValue(Object value, Instant timestamp) {

    public static SourceValue of(Object value, Instant timestamp) {
        return new SourceValue(value, timestamp);
    }
}
