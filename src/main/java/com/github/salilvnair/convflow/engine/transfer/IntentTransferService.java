package com.github.salilvnair.convflow.engine.transfer;

import com.github.salilvnair.convflow.config.ConvFlowProperties;
import com.github.salilvnair.convflow.engine.constants.ConvFlowValue;
import com.github.salilvnair.convflow.engine.exception.ConvFlowException;
import com.github.salilvnair.convflow.engine.stack.IntentStackService;
import com.github.salilvnair.convflow.engine.stack.model.IntentFrame;
import com.github.salilvnair.convflow.engine.support.CollaboratorCallGuard;
import com.github.salilvnair.convflow.engine.transfer.condition.core.TransferEvaluation;
import com.github.salilvnair.convflow.engine.transfer.condition.factory.TransferConditionResolverFactory;
import com.github.salilvnair.convflow.engine.transfer.model.IntentPattern;
import com.github.salilvnair.convflow.engine.transfer.model.TransferCondition;
import com.github.salilvnair.convflow.engine.transfer.model.TransferDecision;
import com.github.salilvnair.convflow.engine.transfer.model.TransferRecord;
import com.github.salilvnair.convflow.engine.transfer.model.TransferRule;
import com.github.salilvnair.convflow.intent.ClassifiedIntent;
import com.github.salilvnair.convflow.intent.IntentClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a turn moves the conversation to another intent and applies
 * that decision to the intent stack.
 */
@Slf4j
@Service
public class IntentTransferService {

    private static final String SOURCE_CLASSIFIER = "intent classifier";

    private final TransferRuleRegistry ruleRegistry;
    private final TransferConditionResolverFactory conditionResolverFactory;
    private final SpecialTransferDetector specialTransferDetector;
    private final TransferHistoryService historyService;
    private final IntentStackService stackService;
    private final CollaboratorCallGuard callGuard;
    private final ObjectProvider<IntentClassifier> classifierProvider;
    private final ConvFlowProperties properties;
    private final Clock clock;

    public IntentTransferService(TransferRuleRegistry ruleRegistry,
                                 TransferConditionResolverFactory conditionResolverFactory,
                                 SpecialTransferDetector specialTransferDetector,
                                 TransferHistoryService historyService,
                                 IntentStackService stackService,
                                 CollaboratorCallGuard callGuard,
                                 ObjectProvider<IntentClassifier> classifierProvider,
                                 ConvFlowProperties properties,
                                 Clock clock) {
        this.ruleRegistry = ruleRegistry;
        this.conditionResolverFactory = conditionResolverFactory;
        this.specialTransferDetector = specialTransferDetector;
        this.historyService = historyService;
        this.stackService = stackService;
        this.callGuard = callGuard;
        this.classifierProvider = classifierProvider;
        this.properties = properties;
        this.clock = clock;
    }

    public TransferDecision evaluate(String sessionId,
                                     String userId,
                                     String currentIntent,
                                     String userInput,
                                     Map<String, Object> context) {
        Map<String, Object> safeContext = context == null ? Map.of() : context;

        Optional<TransferDecision> special = specialTransferDetector.detect(sessionId, userInput, safeContext);
        if (special.isPresent()) {
            TransferDecision decision = resolveTarget(sessionId, special.get());
            log.info("Special transfer sessionId={} {} -> {} rule={}",
                    sessionId, currentIntent, decision.targetIntent(), decision.ruleId());
            return decision;
        }

        ClassifiedIntent candidate;
        try {
            candidate = classify(userInput, safeContext);
        } catch (ConvFlowException e) {
            return TransferDecision.noTransfer("classification failed: " + e.getMessage());
        }
        if (candidate == null || !candidate.isResolved()) {
            return TransferDecision.noTransfer("no intent recognised");
        }
        String candidateIntent = candidate.intentName();
        if (candidateIntent.equals(currentIntent)) {
            return TransferDecision.noTransfer("candidate equals current intent",
                    candidateIntent, candidate.confidence(), List.of());
        }

        TransferEvaluation evaluation = new TransferEvaluation(
                currentIntent, candidateIntent, candidate.confidence(), userInput, safeContext);
        List<String> skippedRules = new ArrayList<>();
        for (TransferRule rule : ruleRegistry.rulesFor(currentIntent)) {
            if (!rule.isEnabled()) {
                continue;
            }
            if (rule.getToIntent() instanceof IntentPattern.Specific specific && !specific.matches(candidateIntent)) {
                continue;
            }
            boolean matched;
            try {
                matched = conditionsHold(evaluation, rule);
            } catch (RuntimeException e) {
                log.warn("Skipping transfer rule ruleId={} sessionId={} msg={}", rule.getRuleId(), sessionId, e.getMessage());
                skippedRules.add(rule.getRuleId() + ": " + e.getMessage());
                continue;
            }
            if (!matched) {
                continue;
            }
            String target = rule.getToIntent() instanceof IntentPattern.Previous
                    ? ConvFlowValue.PREVIOUS
                    : candidateIntent;
            TransferDecision decision = resolveTarget(sessionId, TransferDecision.transfer(
                    target,
                    rule.getTrigger(),
                    candidate.confidence(),
                    rule.getRuleId(),
                    rule.getDescription() == null ? "matched rule " + rule.getRuleId() : rule.getDescription(),
                    candidateIntent,
                    skippedRules
            ));
            log.info("Transfer decided sessionId={} {} -> {} rule={} confidence={}",
                    sessionId, currentIntent, decision.targetIntent(), rule.getRuleId(), candidate.confidence());
            return decision;
        }

        log.debug("No transfer rule matched sessionId={} current={} candidate={}", sessionId, currentIntent, candidateIntent);
        return TransferDecision.noTransfer("no transfer rule matched", candidateIntent, candidate.confidence(), skippedRules);
    }

    /**
     * Applies a positive decision to the stack and records it. A pushed frame
     * always starts from the turn context; when the decision saves context the
     * interrupted frame keeps a copy of it as well.
     *
     * @return {@code false} when the decision is negative
     */
    public boolean executeTransfer(String sessionId,
                                   String userId,
                                   TransferDecision decision,
                                   Map<String, Object> context) {
        if (decision == null || !decision.shouldTransfer()) {
            return false;
        }
        Optional<IntentFrame> interrupted = stackService.getActive(sessionId);
        String fromIntent = interrupted.map(IntentFrame::getIntentName).orElse(ConvFlowValue.UNKNOWN);
        Map<String, Object> turnContext = context == null ? Map.of() : context;

        switch (decision.transferType()) {
            case POP_THEN_PUSH -> stackService.replaceTop(sessionId, userId, decision.targetIntent(), turnContext,
                    decision.trigger().interruptionKind(), decision.reason());
            case PUSH_ONLY -> {
                stackService.push(sessionId, userId, decision.targetIntent(), turnContext,
                        decision.trigger().interruptionKind(), decision.reason());
                if (decision.saveContext() && interrupted.isPresent() && !turnContext.isEmpty()) {
                    stackService.updateContext(sessionId, interrupted.get().getFrameId(), turnContext);
                }
            }
            case POP_ONLY -> stackService.pop(sessionId, decision.reason());
            case NONE -> {
                return false;
            }
        }

        historyService.record(new TransferRecord(
                sessionId,
                userId,
                fromIntent,
                decision.targetIntent(),
                decision.trigger(),
                decision.transferType(),
                decision.confidence(),
                decision.ruleId(),
                decision.reason(),
                clock.instant()
        ));
        log.info("Transfer executed sessionId={} {} -> {} type={}",
                sessionId, fromIntent, decision.targetIntent(), decision.transferType());
        return true;
    }

    private ClassifiedIntent classify(String userInput, Map<String, Object> context) {
        IntentClassifier classifier = classifierProvider.getIfAvailable();
        if (classifier == null) {
            log.debug("No intent classifier configured");
            return null;
        }
        return callGuard.call(SOURCE_CLASSIFIER, properties.getTransfer().getClassifierTimeout(),
                () -> classifier.classify(userInput, context));
    }

    private boolean conditionsHold(TransferEvaluation evaluation, TransferRule rule) {
        for (TransferCondition condition : rule.getConditions()) {
            if (!conditionResolverFactory.get(condition).resolve(evaluation, rule)) {
                return false;
            }
        }
        return true;
    }

    private TransferDecision resolveTarget(String sessionId, TransferDecision decision) {
        if (!ConvFlowValue.PREVIOUS.equals(decision.targetIntent())) {
            return decision;
        }
        return decision.withTargetIntent(previousIntent(sessionId));
    }

    /**
     * The intent one level below the top, else the source of the latest
     * recorded transfer, else {@code unknown}.
     */
    private String previousIntent(String sessionId) {
        List<IntentFrame> frames = stackService.getStack(sessionId);
        if (frames.size() >= 2) {
            return frames.get(frames.size() - 2).getIntentName();
        }
        return historyService.latest(sessionId)
                .map(TransferRecord::fromIntent)
                .orElse(ConvFlowValue.UNKNOWN);
    }
}
