package com.github.salilvnair.convflow.engine.stack.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record StackStatistics(
        int totalFrames,
        int currentDepth,
        String activeIntent,
        Map<FrameStatus, Long> statusCounts,
        double averageProgress,
        double utilization,
        List<InterruptionKind> interruptionKinds,
        Instant oldestFrameAt,
        Instant newestFrameAt
) {}
