package com.github.salilvnair.convflow.engine.transfer.model;

import java.time.Instant;

public record TransferRecord(
        String sessionId,
        String userId,
        String fromIntent,
        String toIntent,
        TransferTrigger trigger,
        TransferType transferType,
        double confidence,
        String ruleId,
        String reason,
        Instant transferredAt
) {}
