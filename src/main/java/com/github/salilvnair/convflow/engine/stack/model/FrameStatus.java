package com.github.salilvnair.convflow.engine.stack.model;

public enum FrameStatus {
    ACTIVE,
    INTERRUPTED,
    COMPLETED,
    EXPIRED;

    public boolean isTerminal() {
        return this == COMPLETED || this == EXPIRED;
    }
}
