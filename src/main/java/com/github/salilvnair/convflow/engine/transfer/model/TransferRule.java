package com.github.salilvnair.convflow.engine.transfer.model;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
public class TransferRule {

    private String ruleId;
    private IntentPattern fromIntent;
    private IntentPattern toIntent;
    private TransferTrigger trigger;

    @Builder.Default
    private List<TransferCondition> conditions = List.of();

    @Builder.Default
    private double confidenceThreshold = 0.7d;

    /** Lower runs first. */
    @Builder.Default
    private int priority = 100;

    @Builder.Default
    private List<String> patterns = List.of();

    @Builder.Default
    private Map<String, Object> contextRequirements = new LinkedHashMap<>();

    @Builder.Default
    private boolean enabled = true;

    private String description;
}
