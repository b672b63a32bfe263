package com.github.salilvnair.convflow.engine.inheritance.cache;

import com.github.salilvnair.convflow.config.ConvFlowProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts which slot combinations each user asks to have inherited and keeps
 * the most frequent ones, to tell which cache entries are worth warming.
 */
@RequiredArgsConstructor
@Component
public class SlotPatternTracker {

    private final ConvFlowProperties properties;
    private final Map<String, Map<String, Long>> combinationsByUser = new ConcurrentHashMap<>();

    public void record(String userId, Collection<String> slots) {
        if (slots == null || slots.isEmpty()) {
            return;
        }
        String combination = String.join(",", new TreeSet<>(slots));
        combinationsByUser.compute(userId, (user, counts) -> {
            Map<String, Long> next = counts == null ? new LinkedHashMap<>() : new LinkedHashMap<>(counts);
            next.merge(combination, 1L, Long::sum);
            return topN(next, properties.getCache().getTrackedCombinationsPerUser());
        });
    }

    /**
     * Most frequent first.
     */
    public Map<String, Long> combinations(String userId) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(combinationsByUser.getOrDefault(userId, Map.of())));
    }

    public List<String> predictedCombinations(String userId, int limit) {
        return combinationsByUser.getOrDefault(userId, Map.of()).keySet().stream().limit(limit).toList();
    }

    private Map<String, Long> topN(Map<String, Long> counts, int limit) {
        List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()));
        Map<String, Long> kept = new LinkedHashMap<>();
        entries.stream().limit(limit).forEach(e -> kept.put(e.getKey(), e.getValue()));
        return kept;
    }
}
