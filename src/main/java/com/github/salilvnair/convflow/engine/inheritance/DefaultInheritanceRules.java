package com.github.salilvnair.convflow.engine.inheritance;

import com.github.salilvnair.convflow.engine.inheritance.condition.InheritanceCondition;
import com.github.salilvnair.convflow.engine.inheritance.model.InheritanceRule;
import com.github.salilvnair.convflow.engine.inheritance.model.MergeStrategy;
import com.github.salilvnair.convflow.engine.inheritance.model.SourceKind;

import java.util.List;

/**
 * Travel and payment rules registered at start-up unless
 * {@code convflow.inheritance.load-default-rules=false}.
 */
public final class DefaultInheritanceRules {

    private DefaultInheritanceRules() {
    }

    public static List<InheritanceRule> rules() {
        return List.of(
                InheritanceRule.builder()
                        .ruleId("session_departure_city")
                        .sourceSlot("departure_city")
                        .targetSlot("departure_city")
                        .sourceKind(SourceKind.SESSION)
                        .strategy(MergeStrategy.SUPPLEMENT)
                        .priority(10)
                        .ttlSeconds(3600L)
                        .build(),
                InheritanceRule.builder()
                        .ruleId("session_arrival_as_departure_city")
                        .sourceSlot("arrival_city")
                        .targetSlot("departure_city")
                        .sourceKind(SourceKind.SESSION)
                        .strategy(MergeStrategy.SUPPLEMENT)
                        .condition(InheritanceCondition.slotEmpty("departure_city"))
                        .transform("extract_city")
                        .priority(5)
                        .build(),
                InheritanceRule.builder()
                        .ruleId("profile_passenger_name")
                        .sourceSlot("passenger_name")
                        .targetSlot("passenger_name")
                        .sourceKind(SourceKind.USER_PROFILE)
                        .strategy(MergeStrategy.SUPPLEMENT)
                        .transform("normalize_name")
                        .priority(15)
                        .build(),
                InheritanceRule.builder()
                        .ruleId("profile_phone_number")
                        .sourceSlot("phone_number")
                        .targetSlot("phone_number")
                        .sourceKind(SourceKind.USER_PROFILE)
                        .strategy(MergeStrategy.SUPPLEMENT)
                        .transform("format_phone")
                        .priority(15)
                        .build(),
                InheritanceRule.builder()
                        .ruleId("session_card_number")
                        .sourceSlot("card_number")
                        .targetSlot("card_number")
                        .sourceKind(SourceKind.SESSION)
                        .strategy(MergeStrategy.SUPPLEMENT)
                        .condition(InheritanceCondition.timeWindow(1800L))
                        .priority(20)
                        .build()
        );
    }
}
