package com.github.salilvnair.convflow.engine.transfer;

import com.github.salilvnair.convflow.engine.transfer.model.IntentPattern;
import com.github.salilvnair.convflow.engine.transfer.model.TransferCondition;
import com.github.salilvnair.convflow.engine.transfer.model.TransferRule;
import com.github.salilvnair.convflow.engine.transfer.model.TransferTrigger;

import java.util.List;
import java.util.Map;

/**
 * Rules registered at start-up unless {@code convflow.transfer.load-default-rules=false}.
 */
public final class DefaultTransferRules {

    private DefaultTransferRules() {
    }

    public static List<TransferRule> rules() {
        return List.of(
                TransferRule.builder()
                        .ruleId("cancel_return")
                        .fromIntent(IntentPattern.ANY)
                        .toIntent(IntentPattern.PREVIOUS)
                        .trigger(TransferTrigger.USER_CLARIFICATION)
                        .conditions(List.of(TransferCondition.PATTERN_MATCH))
                        .patterns(List.of("取消", "返回", "回去", "cancel", "back"))
                        .priority(0)
                        .description("Cancel the current intent and return to the one below it")
                        .build(),
                TransferRule.builder()
                        .ruleId("explicit_change_all")
                        .fromIntent(IntentPattern.ANY)
                        .toIntent(IntentPattern.ANY)
                        .trigger(TransferTrigger.EXPLICIT_CHANGE)
                        .conditions(List.of(TransferCondition.CONFIDENCE_THRESHOLD))
                        .confidenceThreshold(0.8d)
                        .priority(1)
                        .description("Switch intent on a confident explicit request")
                        .build(),
                TransferRule.builder()
                        .ruleId("query_interruption")
                        .fromIntent(IntentPattern.ANY)
                        .toIntent(IntentPattern.of("check_balance"))
                        .trigger(TransferTrigger.INTERRUPTION)
                        .conditions(List.of(TransferCondition.PATTERN_MATCH))
                        .patterns(List.of("余额", "账户", "balance"))
                        .priority(2)
                        .description("Balance query interrupts the current task")
                        .build(),
                TransferRule.builder()
                        .ruleId("booking_suggestion")
                        .fromIntent(IntentPattern.of("check_balance"))
                        .toIntent(IntentPattern.of("book_flight"))
                        .trigger(TransferTrigger.SYSTEM_SUGGESTION)
                        .conditions(List.of(TransferCondition.CONTEXT_MATCH))
                        .contextRequirements(Map.of("balance_sufficient", true))
                        .priority(3)
                        .description("Suggest booking once the balance is known to be sufficient")
                        .build()
        );
    }
}
