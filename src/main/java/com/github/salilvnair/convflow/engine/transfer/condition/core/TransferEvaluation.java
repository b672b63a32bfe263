package com.github.salilvnair.convflow.engine.transfer.condition.core;

import java.util.Map;

/**
 * Inputs a condition may look at while one transfer rule is checked.
 */
public record TransferEvaluation(
        String currentIntent,
        String candidateIntent,
        double confidence,
        String userInput,
        Map<String, Object> context
) {

    public TransferEvaluation {
        context = context == null ? Map.of() : context;
    }
}
