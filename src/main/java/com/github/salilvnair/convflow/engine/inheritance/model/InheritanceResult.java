package com.github.salilvnair.convflow.engine.inheritance.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param values  the input values plus everything inherited
 * @param sources description of where each inherited slot came from
 * @param cached  whether this result was served from the inheritance cache
 */
public record InheritanceResult(
        Map<String, Object> values,
        Map<String, String> sources,
        List<String> appliedRules,
        List<SkippedRule> skippedRules,
        boolean cached
) {

    public InheritanceResult {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
        appliedRules = List.copyOf(appliedRules);
        skippedRules = List.copyOf(skippedRules);
    }

    public static InheritanceResult fromCache(Map<String, Object> values, Map<String, String> sources) {
        return new InheritanceResult(values, sources, List.of(), List.of(), true);
    }

    /**
     * Only the slots some rule filled, with their final values.
     */
    public Map<String, Object> inheritedValues() {
        Map<String, Object> inherited = new LinkedHashMap<>();
        sources.keySet().forEach(slot -> inherited.put(slot, values.get(slot)));
        return inherited;
    }
}
