package com.github.salilvnair.convflow.engine.transfer;

import com.github.salilvnair.convflow.config.ConvFlowProperties;
import com.github.salilvnair.convflow.engine.exception.ConvFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.ConvFlowException;
import com.github.salilvnair.convflow.engine.transfer.model.IntentPattern;
import com.github.salilvnair.convflow.engine.transfer.model.TransferRule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Holds transfer rules sorted by ascending priority. Rules with equal priority
 * keep their registration order. Readers always see a complete snapshot.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class TransferRuleRegistry {

    private final ConvFlowProperties properties;

    private final Object writeLock = new Object();
    private volatile List<TransferRule> rules = List.of();

    @PostConstruct
    void init() {
        if (properties.getTransfer().isLoadDefaultRules()) {
            DefaultTransferRules.rules().forEach(this::addRule);
            log.info("Registered {} default transfer rules", rules.size());
        }
    }

    public void addRule(TransferRule rule) {
        validate(rule);
        synchronized (writeLock) {
            List<TransferRule> next = new ArrayList<>(rules);
            boolean replaced = next.removeIf(r -> r.getRuleId().equals(rule.getRuleId()));
            next.add(rule);
            next.sort(Comparator.comparingInt(TransferRule::getPriority));
            rules = List.copyOf(next);
            log.info("{} transfer rule ruleId={} from={} to={} priority={}",
                    replaced ? "Replaced" : "Added",
                    rule.getRuleId(), rule.getFromIntent().label(), rule.getToIntent().label(), rule.getPriority());
        }
    }

    public boolean removeRule(String ruleId) {
        synchronized (writeLock) {
            List<TransferRule> next = new ArrayList<>(rules);
            boolean removed = next.removeIf(r -> r.getRuleId().equals(ruleId));
            if (removed) {
                rules = List.copyOf(next);
                log.info("Removed transfer rule ruleId={}", ruleId);
            }
            return removed;
        }
    }

    /**
     * Rules whose source is {@code currentIntent} or a wildcard, in evaluation order.
     */
    public List<TransferRule> rulesFor(String currentIntent) {
        return rules.stream()
                .filter(r -> r.getFromIntent() instanceof IntentPattern.Any
                        || r.getFromIntent().matches(currentIntent))
                .toList();
    }

    public List<TransferRule> allRules() {
        return rules;
    }

    private void validate(TransferRule rule) {
        if (rule == null || rule.getRuleId() == null || rule.getRuleId().isBlank()) {
            throw new ConvFlowException(ConvFlowErrorCode.INVALID_RULE, "Transfer rule needs an id");
        }
        if (rule.getFromIntent() == null || rule.getToIntent() == null || rule.getTrigger() == null) {
            throw new ConvFlowException(
                    ConvFlowErrorCode.INVALID_RULE,
                    "Transfer rule " + rule.getRuleId() + " needs from, to and trigger"
            );
        }
        if (rule.getFromIntent() instanceof IntentPattern.Previous) {
            throw new ConvFlowException(
                    ConvFlowErrorCode.INVALID_RULE,
                    "Transfer rule " + rule.getRuleId() + " cannot start from previous"
            );
        }
    }
}
