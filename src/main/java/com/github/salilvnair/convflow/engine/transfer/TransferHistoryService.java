package com.github.salilvnair.convflow.engine.transfer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.salilvnair.convflow.config.ConvFlowProperties;
import com.github.salilvnair.convflow.engine.constants.ConvFlowStoreKey;
import com.github.salilvnair.convflow.engine.stack.SessionLockRegistry;
import com.github.salilvnair.convflow.engine.transfer.model.TransferRecord;
import com.github.salilvnair.convflow.engine.transfer.model.TransferStatistics;
import com.github.salilvnair.convflow.engine.transfer.model.TransferTrigger;
import com.github.salilvnair.convflow.engine.transfer.model.TransferType;
import com.github.salilvnair.convflow.store.core.KeyValueStore;
import com.github.salilvnair.convflow.util.JsonUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Bounded per-session log of executed transfers, oldest first in the store.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class TransferHistoryService {

    private static final TypeReference<List<TransferRecord>> RECORD_LIST = new TypeReference<>() {};
    private static final int TOP_PATTERNS = 5;

    private final KeyValueStore store;
    private final SessionLockRegistry locks;
    private final ConvFlowProperties properties;

    public void record(TransferRecord transfer) {
        String sessionId = transfer.sessionId();
        locks.withLock(sessionId, () -> {
            List<TransferRecord> records = load(sessionId);
            records.add(transfer);
            int limit = properties.getTransfer().getHistoryLimit();
            if (records.size() > limit) {
                records = new ArrayList<>(records.subList(records.size() - limit, records.size()));
            }
            store.set(ConvFlowStoreKey.transferHistory(sessionId), JsonUtil.toJson(records),
                    properties.getTransfer().getHistoryTtl());
            return null;
        });
        log.info("Recorded transfer sessionId={} {} -> {} trigger={}",
                sessionId, transfer.fromIntent(), transfer.toIntent(), transfer.trigger());
    }

    /**
     * Newest first.
     */
    public List<TransferRecord> history(String sessionId, int limit) {
        List<TransferRecord> records = load(sessionId);
        Collections.reverse(records);
        return records.size() <= limit ? records : List.copyOf(records.subList(0, limit));
    }

    public Optional<TransferRecord> latest(String sessionId) {
        List<TransferRecord> records = load(sessionId);
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(records.size() - 1));
    }

    public TransferStatistics statistics(String sessionId) {
        List<TransferRecord> records = load(sessionId);
        if (records.isEmpty()) {
            return TransferStatistics.empty();
        }

        Map<TransferTrigger, Long> byTrigger = new EnumMap<>(TransferTrigger.class);
        Map<TransferType, Long> byType = new EnumMap<>(TransferType.class);
        records.forEach(r -> {
            if (r.trigger() != null) {
                byTrigger.merge(r.trigger(), 1L, Long::sum);
            }
            if (r.transferType() != null) {
                byType.merge(r.transferType(), 1L, Long::sum);
            }
        });

        Map<String, Long> patternCounts = records.stream()
                .collect(Collectors.groupingBy(r -> r.fromIntent() + " -> " + r.toIntent(),
                        LinkedHashMap::new, Collectors.counting()));
        Map<String, Long> commonPatterns = patternCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .limit(TOP_PATTERNS)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));

        double averageConfidence = records.stream().mapToDouble(TransferRecord::confidence).average().orElse(0.0d);
        return new TransferStatistics(
                records.size(),
                byTrigger,
                byType,
                commonPatterns,
                averageConfidence,
                records.stream().map(TransferRecord::transferredAt).min(Comparator.naturalOrder()).orElse(null),
                records.stream().map(TransferRecord::transferredAt).max(Comparator.naturalOrder()).orElse(null)
        );
    }

    private List<TransferRecord> load(String sessionId) {
        Optional<String> payload = store.get(ConvFlowStoreKey.transferHistory(sessionId));
        if (payload.isEmpty()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(JsonUtil.fromJson(payload.get(), RECORD_LIST));
        } catch (IllegalStateException e) {
            log.warn("Dropping unreadable transfer history sessionId={} msg={}", sessionId, e.getMessage());
            store.delete(ConvFlowStoreKey.transferHistory(sessionId));
            return new ArrayList<>();
        }
    }
}
