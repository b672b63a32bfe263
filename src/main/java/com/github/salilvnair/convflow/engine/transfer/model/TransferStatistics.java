package com.github.salilvnair.convflow.engine.transfer.model;

import java.time.Instant;
import java.util.Map;

/**
 * @param commonPatterns {@code from -> to} pairs with their counts, most frequent first
 */
public record TransferStatistics(
        int totalTransfers,
        Map<TransferTrigger, Long> byTrigger,
        Map<TransferType, Long> byType,
        Map<String, Long> commonPatterns,
        double averageConfidence,
        Instant firstTransferAt,
        Instant lastTransferAt
) {

    public static TransferStatistics empty() {
        return new TransferStatistics(0, Map.of(), Map.of(), Map.of(), 0.0d, null, null);
    }
}
