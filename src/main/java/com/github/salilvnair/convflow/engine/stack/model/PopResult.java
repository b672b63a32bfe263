package com.github.salilvnair.convflow.engine.stack.model;

import java.util.List;

/**
 * @param abandonedFrames expired frames dropped on the way down to the resumed frame
 */
public record PopResult(
        IntentFrame frame,
        int stackDepth,
        List<IntentFrame> abandonedFrames
) {}
