package com.github.salilvnair.convflow.engine.exception;

public enum ConvFlowErrorCode {

    // =========================
    // Intent stack errors
    // =========================
    STACK_OVERFLOW(
            "Intent stack reached its maximum depth",
            false
    ),

    FRAME_NOT_FOUND(
            "Intent frame not found in the session stack",
            true
    ),

    STACK_STATE_CORRUPT(
            "Stored intent stack could not be read",
            false
    ),

    STACK_PERSIST_FAILED(
            "Failed to persist intent stack",
            true
    ),

    // =========================
    // Collaborator errors
    // =========================
    SOURCE_UNAVAILABLE(
            "External collaborator failed or timed out",
            true
    ),

    // =========================
    // Cache errors
    // =========================
    CACHE_CORRUPT(
            "Cached inheritance payload is malformed",
            true
    ),

    // =========================
    // Rule errors
    // =========================
    INVALID_RULE(
            "Invalid rule configured",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    ConvFlowErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
