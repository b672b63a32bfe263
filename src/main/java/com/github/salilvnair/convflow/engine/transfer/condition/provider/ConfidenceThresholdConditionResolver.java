package com.github.salilvnair.convflow.engine.transfer.condition.provider;

import com.github.salilvnair.convflow.engine.transfer.condition.core.TransferConditionResolver;
import com.github.salilvnair.convflow.engine.transfer.condition.core.TransferEvaluation;
import com.github.salilvnair.convflow.engine.transfer.model.TransferCondition;
import com.github.salilvnair.convflow.engine.transfer.model.TransferRule;
import org.springframework.stereotype.Component;

@Component
public class ConfidenceThresholdConditionResolver implements TransferConditionResolver {

    @Override
    public TransferCondition condition() {
        return TransferCondition.CONFIDENCE_THRESHOLD;
    }

    @Override
    public boolean resolve(TransferEvaluation evaluation, TransferRule rule) {
        return evaluation.confidence() >= rule.getConfidenceThreshold();
    }
}
