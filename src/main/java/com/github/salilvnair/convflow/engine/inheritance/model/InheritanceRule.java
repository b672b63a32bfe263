package com.github.salilvnair.convflow.engine.inheritance.model;

import com.github.salilvnair.convflow.engine.inheritance.condition.InheritanceCondition;
import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
public class InheritanceRule {

    private String ruleId;
    private String sourceSlot;
    private String targetSlot;
    private SourceKind sourceKind;

    @Builder.Default
    private MergeStrategy strategy = MergeStrategy.SUPPLEMENT;

    /** {@code null} means unconditional. */
    private InheritanceCondition condition;

    /** Name of a registered value transformer, optional. */
    private String transform;

    /** Higher runs first. */
    private int priority;

    /** Maximum age of the source value in seconds, optional. */
    private Long ttlSeconds;

    public String id() {
        if (ruleId != null && !ruleId.isBlank()) {
            return ruleId;
        }
        return sourceKind.name().toLowerCase() + ":" + sourceSlot + "->" + targetSlot;
    }
}
