package com.github.salilvnair.convflow.engine.inheritance.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Snapshot of every slot source for one inheritance run. A source kind that
 * could not be read is marked unavailable, which differs from a source that
 * is simply missing the slot.
 */
public final class SourceBundle {

    private final Map<SourceKind, Map<String, SourceValue>> sources;
    private final Set<SourceKind> unavailable;
    private final Instant evaluatedAt;

    private SourceBundle(Map<SourceKind, Map<String, SourceValue>> sources,
                         Set<SourceKind> unavailable,
                         Instant evaluatedAt) {
        this.sources = sources;
        this.unavailable = unavailable;
        this.evaluatedAt = evaluatedAt;
    }

    public static Builder builder(Instant evaluatedAt) {
        return new Builder(evaluatedAt);
    }

    public Instant evaluatedAt() {
        return evaluatedAt;
    }

    public boolean isAvailable(SourceKind kind) {
        return !unavailable.contains(kind);
    }

    public Optional<SourceValue> lookup(SourceKind kind, String slot) {
        if (!isAvailable(kind)) {
            return Optional.empty();
        }
        SourceValue value = sources.getOrDefault(kind, Map.of()).get(slot);
        return value == null || value.value() == null ? Optional.empty() : Optional.of(value);
    }

    /**
     * Raw values of one source kind, for conditions such as user attributes.
     */
    public Map<String, Object> values(SourceKind kind) {
        Map<String, Object> plain = new LinkedHashMap<>();
        sources.getOrDefault(kind, Map.of()).forEach((slot, v) -> plain.put(slot, v.value()));
        return plain;
    }

    public Set<String> slotNames(SourceKind kind) {
        return Collections.unmodifiableSet(sources.getOrDefault(kind, Map.of()).keySet());
    }

    public static final class Builder {

        private final Instant evaluatedAt;
        private final Map<SourceKind, Map<String, SourceValue>> sources = new EnumMap<>(SourceKind.class);
        private final Set<SourceKind> unavailable = EnumSet.noneOf(SourceKind.class);

        private Builder(Instant evaluatedAt) {
            this.evaluatedAt = evaluatedAt;
        }

        public Builder source(SourceKind kind, Map<String, SourceValue> values) {
            sources.computeIfAbsent(kind, k -> new LinkedHashMap<>()).putAll(values);
            return this;
        }

        /**
         * Adds plain values observed at {@code timestamp}.
         */
        public Builder values(SourceKind kind, Map<String, ?> values, Instant timestamp) {
            Map<String, SourceValue> target = sources.computeIfAbsent(kind, k -> new LinkedHashMap<>());
            values.forEach((slot, value) -> target.put(slot, SourceValue.of(value, timestamp)));
            return this;
        }

        public Builder value(SourceKind kind, String slot, Object value, Instant timestamp) {
            sources.computeIfAbsent(kind, k -> new LinkedHashMap<>()).put(slot, SourceValue.of(value, timestamp));
            return this;
        }

        public Builder unavailable(SourceKind kind) {
            unavailable.add(kind);
            return this;
        }

        public SourceBundle build() {
            Map<SourceKind, Map<String, SourceValue>> copy = new EnumMap<>(SourceKind.class);
            sources.forEach((kind, values) -> copy.put(kind, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
            return new SourceBundle(copy, EnumSet.copyOf(unavailable), evaluatedAt);
        }
    }
}
