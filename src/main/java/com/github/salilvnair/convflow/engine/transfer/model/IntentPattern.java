package com.github.salilvnair.convflow.engine.transfer.model;

import com.github.salilvnair.convflow.engine.constants.ConvFlowValue;

/**
 * Source or target of a transfer rule.
 */
public sealed interface IntentPattern permits IntentPattern.Specific, IntentPattern.Any, IntentPattern.Previous {

    IntentPattern ANY = new Any();
    IntentPattern PREVIOUS = new Previous();

    boolean matches(String intentName);

    String label();

    static IntentPattern of(String intentName) {
        return new Specific(intentName);
    }

    /**
     * Reads the textual form used in configuration: {@code *} or {@code ANY}
     * for a wildcard, {@code previous} for the frame below the top.
     */
    static IntentPattern parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("intent pattern must not be blank");
        }
        String value = raw.trim();
        if (ConvFlowValue.ANY.equals(value) || ConvFlowValue.ANY_ALIAS.equalsIgnoreCase(value)) {
            return ANY;
        }
        if (ConvFlowValue.PREVIOUS.equalsIgnoreCase(value)) {
            return PREVIOUS;
        }
        return new Specific(value);
    }

    record Specific(String intentName) implements IntentPattern {

        public Specific {
            if (intentName == null || intentName.isBlank()) {
                throw new IllegalArgumentException("intentName must not be blank");
            }
        }

        @Override
        public boolean matches(String candidate) {
            return intentName.equals(candidate);
        }

        @Override
        public String label() {
            return intentName;
        }
    }

    record Any() implements IntentPattern {

        @Override
        public boolean matches(String candidate) {
            return true;
        }

        @Override
        public String label() {
            return ConvFlowValue.ANY;
        }
    }

    /**
     * Only meaningful as a target; never equal to a classified candidate.
     */
    record Previous() implements IntentPattern {

        @Override
        public boolean matches(String candidate) {
            return false;
        }

        @Override
        public String label() {
            return ConvFlowValue.PREVIOUS;
        }
    }
}
