package com.github.salilvnair.convflow.engine.transfer.model;

public enum TransferCondition {
    CONFIDENCE_THRESHOLD,
    PATTERN_MATCH,
    CONTEXT_MATCH,
    SLOT_COMPLETION,
    SEMANTIC_SIMILARITY
}
