package com.github.salilvnair.convflow.engine.core;

import com.github.salilvnair.convflow.engine.context.TurnRequest;
import com.github.salilvnair.convflow.engine.model.TurnResult;

public interface ConversationContinuityEngine {
    TurnResult process(TurnRequest request);
}
