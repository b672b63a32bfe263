package com.github.salilvnair.convflow.engine.transfer.model;

import java.util.List;

/**
 * Outcome of one transfer evaluation. A negative decision always carries
 * {@link TransferType#NONE}.
 *
 * @param candidateIntent what the classifier proposed, {@code null} when classification was bypassed or failed
 * @param skippedRules    rules left out because evaluating them failed, as {@code ruleId: reason}
 */
public record TransferDecision(
        boolean shouldTransfer,
        String targetIntent,
        TransferTrigger trigger,
        double confidence,
        String ruleId,
        String reason,
        TransferType transferType,
        boolean saveContext,
        String candidateIntent,
        List<String> skippedRules
) {

    public TransferDecision {
        skippedRules = skippedRules == null ? List.of() : List.copyOf(skippedRules);
    }

    public static TransferDecision noTransfer(String reason) {
        return noTransfer(reason, null, 0.0d, List.of());
    }

    public static TransferDecision noTransfer(String reason,
                                              String candidateIntent,
                                              double confidence,
                                              List<String> skippedRules) {
        return new TransferDecision(false, null, null, confidence, null, reason,
                TransferType.NONE, false, candidateIntent, skippedRules);
    }

    /**
     * Transfer type and context saving follow from the trigger and the
     * unresolved target, so {@code previous} still yields a pop.
     */
    public static TransferDecision transfer(String targetIntent,
                                            TransferTrigger trigger,
                                            double confidence,
                                            String ruleId,
                                            String reason,
                                            String candidateIntent,
                                            List<String> skippedRules) {
        return new TransferDecision(
                true,
                targetIntent,
                trigger,
                confidence,
                ruleId,
                reason,
                trigger.transferType(targetIntent),
                trigger.savesContext(),
                candidateIntent,
                skippedRules
        );
    }

    public TransferDecision withTargetIntent(String resolvedTarget) {
        return new TransferDecision(shouldTransfer, resolvedTarget, trigger, confidence, ruleId, reason,
                transferType, saveContext, candidateIntent, skippedRules);
    }
}
