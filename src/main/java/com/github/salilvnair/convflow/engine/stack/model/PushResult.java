package com.github.salilvnair.convflow.engine.stack.model;

public record PushResult(
        IntentFrame frame,
        int stackDepth
) {}
