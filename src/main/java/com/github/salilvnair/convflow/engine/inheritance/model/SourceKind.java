package com.github.salilvnair.convflow.engine.inheritance.model;

/**
 * Where an inherited slot value comes from.
 */
public enum SourceKind {

    CONTEXT("conversation context"),
    SESSION("session context"),
    USER_PROFILE("user profile"),
    DEPENDENCY("dependency slots"),
    DEFAULT("default values");

    private final String description;

    SourceKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    public String describe(String sourceSlot) {
        return description + " (" + sourceSlot + ")";
    }
}
