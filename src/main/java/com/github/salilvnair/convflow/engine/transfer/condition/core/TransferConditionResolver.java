package com.github.salilvnair.convflow.engine.transfer.condition.core;

import com.github.salilvnair.convflow.engine.transfer.model.TransferCondition;
import com.github.salilvnair.convflow.engine.transfer.model.TransferRule;

public interface TransferConditionResolver {

    TransferCondition condition();

    boolean resolve(TransferEvaluation evaluation, TransferRule rule);
}
