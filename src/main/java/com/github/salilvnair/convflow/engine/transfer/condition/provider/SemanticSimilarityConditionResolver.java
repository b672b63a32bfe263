package com.github.salilvnair.convflow.engine.transfer.condition.provider;

import com.github.salilvnair.convflow.engine.constants.ConvFlowContextKey;
import com.github.salilvnair.convflow.engine.transfer.condition.core.TransferConditionResolver;
import com.github.salilvnair.convflow.engine.transfer.condition.core.TransferEvaluation;
import com.github.salilvnair.convflow.engine.transfer.model.TransferCondition;
import com.github.salilvnair.convflow.engine.transfer.model.TransferRule;
import org.springframework.stereotype.Component;

/**
 * Compares a similarity score computed upstream against the rule threshold.
 * A non-numeric score fails the rule.
 */
@Component
public class SemanticSimilarityConditionResolver implements TransferConditionResolver {

    @Override
    public TransferCondition condition() {
        return TransferCondition.SEMANTIC_SIMILARITY;
    }

    @Override
    public boolean resolve(TransferEvaluation evaluation, TransferRule rule) {
        Object score = evaluation.context().get(ConvFlowContextKey.SEMANTIC_SIMILARITY);
        if (score == null) {
            return false;
        }
        double value = score instanceof Number n ? n.doubleValue() : Double.parseDouble(score.toString());
        return value >= rule.getConfidenceThreshold();
    }
}
