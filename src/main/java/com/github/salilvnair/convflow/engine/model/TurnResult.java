package com.github.salilvnair.convflow.engine.model;

import com.github.salilvnair.convflow.engine.inheritance.model.InheritanceResult;
import com.github.salilvnair.convflow.engine.stack.model.IntentFrame;
import com.github.salilvnair.convflow.engine.transfer.model.TransferDecision;

/**
 * @param activeFrame {@code null} when no intent is active after the turn
 * @param inheritance {@code null} when the active frame needed nothing
 */
public record TurnResult(
        TransferDecision decision,
        IntentFrame activeFrame,
        InheritanceResult inheritance,
        int stackDepth
) {}
