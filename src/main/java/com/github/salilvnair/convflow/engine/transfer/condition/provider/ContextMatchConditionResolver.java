package com.github.salilvnair.convflow.engine.transfer.condition.provider;

import com.github.salilvnair.convflow.engine.transfer.condition.core.TransferConditionResolver;
import com.github.salilvnair.convflow.engine.transfer.condition.core.TransferEvaluation;
import com.github.salilvnair.convflow.engine.transfer.model.TransferCondition;
import com.github.salilvnair.convflow.engine.transfer.model.TransferRule;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;

@Component
public class ContextMatchConditionResolver implements TransferConditionResolver {

    @Override
    public TransferCondition condition() {
        return TransferCondition.CONTEXT_MATCH;
    }

    @Override
    public boolean resolve(TransferEvaluation evaluation, TransferRule rule) {
        Map<String, Object> required = rule.getContextRequirements();
        if (required == null || required.isEmpty()) {
            return true;
        }
        Map<String, Object> context = evaluation.context();
        for (Map.Entry<String, Object> entry : required.entrySet()) {
            if (!context.containsKey(entry.getKey()) || !sameValue(entry.getValue(), context.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private boolean sameValue(Object expected, Object actual) {
        if (expected instanceof Number e && actual instanceof Number a) {
            return Double.compare(e.doubleValue(), a.doubleValue()) == 0;
        }
        return Objects.equals(expected, actual);
    }
}
