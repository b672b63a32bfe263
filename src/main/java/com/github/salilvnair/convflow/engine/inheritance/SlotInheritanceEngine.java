package com.github.salilvnair.convflow.engine.inheritance;

import com.github.salilvnair.convflow.config.ConvFlowProperties;
import com.github.salilvnair.convflow.engine.exception.ConvFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.ConvFlowException;
import com.github.salilvnair.convflow.engine.inheritance.model.InheritanceResult;
import com.github.salilvnair.convflow.engine.inheritance.model.InheritanceRule;
import com.github.salilvnair.convflow.engine.inheritance.model.MergeStrategy;
import com.github.salilvnair.convflow.engine.inheritance.model.SkippedRule;
import com.github.salilvnair.convflow.engine.inheritance.model.SourceBundle;
import com.github.salilvnair.convflow.engine.inheritance.model.SourceValue;
import com.github.salilvnair.convflow.engine.inheritance.transform.factory.ValueTransformerRegistry;
import com.github.salilvnair.convflow.util.SlotValues;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fills required slots from the slot sources by walking the inheritance rules
 * in descending priority. Input values are never removed; a rule sees the
 * values filled by the rules before it.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class SlotInheritanceEngine {

    private final ValueTransformerRegistry transformers;
    private final ConvFlowProperties properties;

    private final Object writeLock = new Object();
    private volatile List<InheritanceRule> rules = List.of();

    @PostConstruct
    void init() {
        if (properties.getInheritance().isLoadDefaultRules()) {
            DefaultInheritanceRules.rules().forEach(this::addRule);
            log.info("Registered {} default inheritance rules", rules.size());
        }
    }

    public void addRule(InheritanceRule rule) {
        if (rule == null || rule.getSourceKind() == null || rule.getSourceSlot() == null || rule.getTargetSlot() == null) {
            throw new ConvFlowException(ConvFlowErrorCode.INVALID_RULE,
                    "Inheritance rule needs source kind, source slot and target slot");
        }
        synchronized (writeLock) {
            List<InheritanceRule> next = new ArrayList<>(rules);
            next.removeIf(r -> r.id().equals(rule.id()));
            next.add(rule);
            next.sort(Comparator.comparingInt(InheritanceRule::getPriority).reversed());
            rules = List.copyOf(next);
        }
        log.debug("Added inheritance rule id={} {} -> {} priority={}",
                rule.id(), rule.getSourceSlot(), rule.getTargetSlot(), rule.getPriority());
    }

    public boolean removeRule(String ruleId) {
        synchronized (writeLock) {
            List<InheritanceRule> next = new ArrayList<>(rules);
            boolean removed = next.removeIf(r -> r.id().equals(ruleId));
            rules = List.copyOf(next);
            return removed;
        }
    }

    public List<InheritanceRule> rules() {
        return rules;
    }

    public InheritanceResult inherit(Collection<String> requiredSlots,
                                     Map<String, Object> currentValues,
                                     SourceBundle sources) {
        Set<String> required = new LinkedHashSet<>(requiredSlots);
        Map<String, Object> values = new LinkedHashMap<>(currentValues == null ? Map.of() : currentValues);
        Map<String, String> origins = new LinkedHashMap<>();
        List<String> applied = new ArrayList<>();
        List<SkippedRule> skipped = new ArrayList<>();

        for (InheritanceRule rule : rules) {
            if (!required.contains(rule.getTargetSlot())) {
                continue;
            }
            try {
                String reason = apply(rule, values, sources, origins);
                if (reason == null) {
                    applied.add(rule.id());
                    log.debug("Inherited slot={} rule={} source={}",
                            rule.getTargetSlot(), rule.id(), origins.get(rule.getTargetSlot()));
                } else {
                    skipped.add(new SkippedRule(rule.id(), reason));
                }
            } catch (RuntimeException e) {
                log.warn("Inheritance rule failed id={} msg={}", rule.id(), e.getMessage());
                skipped.add(new SkippedRule(rule.id(), "rule failed: " + e.getMessage()));
            }
        }
        return new InheritanceResult(values, origins, applied, skipped, false);
    }

    /**
     * @return the skip reason, or {@code null} when the rule filled its target
     */
    private String apply(InheritanceRule rule,
                         Map<String, Object> values,
                         SourceBundle sources,
                         Map<String, String> origins) {
        String target = rule.getTargetSlot();
        if (rule.getStrategy() == MergeStrategy.SUPPLEMENT && !SlotValues.isEmpty(values.get(target))) {
            return SkippedRule.ALREADY_HAS_VALUE;
        }
        if (rule.getCondition() != null && !rule.getCondition().holds(rule, values, sources)) {
            return SkippedRule.CONDITION_FALSE;
        }
        if (!sources.isAvailable(rule.getSourceKind())) {
            return SkippedRule.SOURCE_UNAVAILABLE;
        }
        Optional<SourceValue> source = sources.lookup(rule.getSourceKind(), rule.getSourceSlot());
        if (rule.getTtlSeconds() != null && source.isPresent() && isOlderThan(source.get(), rule.getTtlSeconds(), sources)) {
            return SkippedRule.TTL_EXPIRED;
        }
        if (source.isEmpty() || SlotValues.isEmpty(source.get().value())) {
            return SkippedRule.SOURCE_EMPTY;
        }

        Object transformed = transformers.apply(rule.getTransform(), source.get().value());
        values.put(target, combine(rule.getStrategy(), values.get(target), transformed));
        origins.put(target, rule.getSourceKind().describe(rule.getSourceSlot()));
        return null;
    }

    private boolean isOlderThan(SourceValue value, long ttlSeconds, SourceBundle sources) {
        if (value.timestamp() == null) {
            return false;
        }
        return Duration.between(value.timestamp(), sources.evaluatedAt()).getSeconds() > ttlSeconds;
    }

    private Object combine(MergeStrategy strategy, Object existing, Object incoming) {
        return switch (strategy) {
            case SUPPLEMENT -> SlotValues.isEmpty(existing) ? incoming : existing;
            case MERGE -> merge(existing, incoming);
            case OVERRIDE, CONDITIONAL -> incoming;
        };
    }

    /**
     * Unions lists and shallow-merges maps; anything else is replaced.
     */
    @SuppressWarnings("unchecked")
    private Object merge(Object existing, Object incoming) {
        if (existing instanceof List<?> current && incoming instanceof List<?> added) {
            Set<Object> union = new LinkedHashSet<>(current);
            union.addAll(added);
            return new ArrayList<>(union);
        }
        if (existing instanceof Map<?, ?> current && incoming instanceof Map<?, ?> added) {
            Map<Object, Object> merged = new LinkedHashMap<>((Map<Object, Object>) current);
            merged.putAll(added);
            return merged;
        }
        return incoming;
    }
}
