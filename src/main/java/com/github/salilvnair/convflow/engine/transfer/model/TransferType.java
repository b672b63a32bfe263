package com.github.salilvnair.convflow.engine.transfer.model;

public enum TransferType {
    POP_THEN_PUSH,
    PUSH_ONLY,
    POP_ONLY,
    NONE
}
