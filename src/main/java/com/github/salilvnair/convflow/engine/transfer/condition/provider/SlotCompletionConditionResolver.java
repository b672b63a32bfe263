package com.github.salilvnair.convflow.engine.transfer.condition.provider;

import com.github.salilvnair.convflow.engine.constants.ConvFlowContextKey;
import com.github.salilvnair.convflow.engine.transfer.condition.core.TransferConditionResolver;
import com.github.salilvnair.convflow.engine.transfer.condition.core.TransferEvaluation;
import com.github.salilvnair.convflow.engine.transfer.model.TransferCondition;
import com.github.salilvnair.convflow.engine.transfer.model.TransferRule;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Holds once the current intent has nothing left to collect.
 */
@Component
public class SlotCompletionConditionResolver implements TransferConditionResolver {

    @Override
    public TransferCondition condition() {
        return TransferCondition.SLOT_COMPLETION;
    }

    @Override
    public boolean resolve(TransferEvaluation evaluation, TransferRule rule) {
        Object missing = evaluation.context().get(ConvFlowContextKey.MISSING_SLOTS);
        if (missing instanceof Collection<?> slots && slots.isEmpty()) {
            return true;
        }
        Object progress = evaluation.context().get(ConvFlowContextKey.COMPLETION_PROGRESS);
        return progress instanceof Number n && n.doubleValue() >= 1.0d;
    }
}
