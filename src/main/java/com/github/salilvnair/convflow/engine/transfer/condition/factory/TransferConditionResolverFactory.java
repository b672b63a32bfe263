package com.github.salilvnair.convflow.engine.transfer.condition.factory;

import com.github.salilvnair.convflow.engine.exception.ConvFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.ConvFlowException;
import com.github.salilvnair.convflow.engine.transfer.condition.core.TransferConditionResolver;
import com.github.salilvnair.convflow.engine.transfer.model.TransferCondition;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class TransferConditionResolverFactory {

    private final Map<TransferCondition, TransferConditionResolver> resolvers = new EnumMap<>(TransferCondition.class);

    public TransferConditionResolverFactory(List<TransferConditionResolver> resolvers) {
        resolvers.forEach(r -> this.resolvers.put(r.condition(), r));
    }

    public TransferConditionResolver get(TransferCondition condition) {
        TransferConditionResolver resolver = resolvers.get(condition);
        if (resolver == null) {
            throw new ConvFlowException(ConvFlowErrorCode.INVALID_RULE, "No resolver for condition " + condition);
        }
        return resolver;
    }
}
