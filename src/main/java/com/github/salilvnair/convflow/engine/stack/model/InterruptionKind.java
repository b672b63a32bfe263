package com.github.salilvnair.convflow.engine.stack.model;

public enum InterruptionKind {
    USER_INITIATED,
    SYSTEM_SUGGESTION,
    URGENT_INTERRUPTION,
    CONTEXT_SWITCH,
    CLARIFICATION
}
