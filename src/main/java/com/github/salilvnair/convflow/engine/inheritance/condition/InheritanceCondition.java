package com.github.salilvnair.convflow.engine.inheritance.condition;

import com.github.salilvnair.convflow.engine.inheritance.model.InheritanceRule;
import com.github.salilvnair.convflow.engine.inheritance.model.SourceBundle;
import com.github.salilvnair.convflow.engine.inheritance.model.SourceKind;
import com.github.salilvnair.convflow.engine.inheritance.model.SourceValue;
import com.github.salilvnair.convflow.util.SlotValues;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Gate evaluated before an inheritance rule reads its source.
 * Slot conditions look at the values as filled so far in the current run.
 */
public sealed interface InheritanceCondition permits InheritanceCondition.Always,
        InheritanceCondition.SlotEmpty,
        InheritanceCondition.SlotEquals,
        InheritanceCondition.UserAttribute,
        InheritanceCondition.TimeWindow {

    boolean holds(InheritanceRule rule, Map<String, Object> values, SourceBundle sources);

    static InheritanceCondition always() {
        return new Always();
    }

    static InheritanceCondition slotEmpty(String slot) {
        return new SlotEmpty(slot);
    }

    static InheritanceCondition slotEquals(String slot, Object value) {
        return new SlotEquals(slot, value);
    }

    static InheritanceCondition userAttribute(String attribute, Object value) {
        return new UserAttribute(attribute, value);
    }

    static InheritanceCondition timeWindow(long maxAgeSeconds) {
        return new TimeWindow(maxAgeSeconds);
    }

    record Always() implements InheritanceCondition {
        @Override
        public boolean holds(InheritanceRule rule, Map<String, Object> values, SourceBundle sources) {
            return true;
        }
    }

    record SlotEmpty(String slot) implements InheritanceCondition {
        @Override
        public boolean holds(InheritanceRule rule, Map<String, Object> values, SourceBundle sources) {
            return SlotValues.isEmpty(values.get(slot));
        }
    }

    /** Compares textual forms, so {@code 1} equals {@code "1"}. */
    record SlotEquals(String slot, Object value) implements InheritanceCondition {
        @Override
        public boolean holds(InheritanceRule rule, Map<String, Object> values, SourceBundle sources) {
            return Objects.equals(String.valueOf(values.get(slot)), String.valueOf(value));
        }
    }

    record UserAttribute(String attribute, Object value) implements InheritanceCondition {
        @Override
        public boolean holds(InheritanceRule rule, Map<String, Object> values, SourceBundle sources) {
            Object actual = sources.values(SourceKind.USER_PROFILE).get(attribute);
            return Objects.equals(String.valueOf(actual), String.valueOf(value));
        }
    }

    /**
     * Holds when the rule's source value was observed at most {@code maxAgeSeconds}
     * ago. A value without timestamp, or no value at all, fails the window.
     */
    record TimeWindow(long maxAgeSeconds) implements InheritanceCondition {
        @Override
        public boolean holds(InheritanceRule rule, Map<String, Object> values, SourceBundle sources) {
            return sources.lookup(rule.getSourceKind(), rule.getSourceSlot())
                    .map(SourceValue::timestamp)
                    .map(observed -> Duration.between(observed, sources.evaluatedAt()).getSeconds() <= maxAgeSeconds)
                    .orElse(false);
        }
    }
}
