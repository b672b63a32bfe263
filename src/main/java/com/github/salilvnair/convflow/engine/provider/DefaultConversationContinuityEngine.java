package com.github.salilvnair.convflow.engine.provider;

import com.github.salilvnair.convflow.engine.constants.ConvFlowValue;
import com.github.salilvnair.convflow.engine.context.TurnRequest;
import com.github.salilvnair.convflow.engine.core.ConversationContinuityEngine;
import com.github.salilvnair.convflow.engine.inheritance.SlotInheritanceService;
import com.github.salilvnair.convflow.engine.inheritance.model.InheritanceRequest;
import com.github.salilvnair.convflow.engine.inheritance.model.InheritanceResult;
import com.github.salilvnair.convflow.engine.model.TurnResult;
import com.github.salilvnair.convflow.engine.stack.IntentStackService;
import com.github.salilvnair.convflow.engine.stack.model.IntentFrame;
import com.github.salilvnair.convflow.engine.transfer.IntentTransferService;
import com.github.salilvnair.convflow.engine.transfer.SessionActivityTracker;
import com.github.salilvnair.convflow.engine.transfer.model.TransferDecision;
import com.github.salilvnair.convflow.intent.RequiredSlotsProvider;
import com.github.salilvnair.convflow.util.SlotValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Component
public class DefaultConversationContinuityEngine implements ConversationContinuityEngine {

    private static final String INITIAL_INTENT_REASON = "initial intent";

    private final IntentStackService stackService;
    private final IntentTransferService transferService;
    private final SlotInheritanceService inheritanceService;
    private final SessionActivityTracker activityTracker;
    private final ObjectProvider<RequiredSlotsProvider> requiredSlotsProvider;

    public DefaultConversationContinuityEngine(IntentStackService stackService,
                                               IntentTransferService transferService,
                                               SlotInheritanceService inheritanceService,
                                               SessionActivityTracker activityTracker,
                                               ObjectProvider<RequiredSlotsProvider> requiredSlotsProvider) {
        this.stackService = stackService;
        this.transferService = transferService;
        this.inheritanceService = inheritanceService;
        this.activityTracker = activityTracker;
        this.requiredSlotsProvider = requiredSlotsProvider;
    }

    @Override
    public TurnResult process(TurnRequest request) {
        String sessionId = request.getSessionId();
        String userId = request.getUserId();
        Map<String, Object> context = request.getContext() == null ? Map.of() : request.getContext();

        // ------------------------------------------------------------
        // 1. Decide the transfer against the intent active before this turn
        // ------------------------------------------------------------
        Optional<IntentFrame> before = stackService.getActive(sessionId);
        String currentIntent = before.map(IntentFrame::getIntentName).orElse(ConvFlowValue.UNKNOWN);
        TransferDecision decision = transferService.evaluate(sessionId, userId, currentIntent, request.getUserText(), context);

        // ------------------------------------------------------------
        // 2. Apply it; an empty stack adopts the classified intent
        // ------------------------------------------------------------
        if (decision.shouldTransfer()) {
            transferService.executeTransfer(sessionId, userId, decision, context);
        } else if (before.isEmpty() && decision.candidateIntent() != null) {
            stackService.push(sessionId, userId, decision.candidateIntent(), context, null, INITIAL_INTENT_REASON);
        }
        activityTracker.touch(sessionId);

        // ------------------------------------------------------------
        // 3. Fill what the active intent is still missing
        // ------------------------------------------------------------
        Optional<IntentFrame> active = stackService.getActive(sessionId);
        InheritanceResult inheritance = null;
        if (active.isPresent()) {
            inheritance = inheritMissingSlots(sessionId, userId, active.get(), context);
            active = stackService.getActive(sessionId);
        }

        TurnResult result = new TurnResult(decision, active.orElse(null), inheritance, stackService.depth(sessionId));
        log.info("Turn processed sessionId={} transfer={} active={} depth={}",
                sessionId, decision.shouldTransfer(),
                active.map(IntentFrame::getIntentName).orElse(null), result.stackDepth());
        return result;
    }

    private InheritanceResult inheritMissingSlots(String sessionId,
                                                  String userId,
                                                  IntentFrame frame,
                                                  Map<String, Object> context) {
        List<String> required = requiredSlots(frame);
        List<String> missing = missing(required, frame.getCollectedSlots());
        if (missing.isEmpty()) {
            return null;
        }

        InheritanceResult result = inheritanceService.inherit(InheritanceRequest.builder()
                .userId(userId)
                .sessionId(sessionId)
                .intentName(frame.getIntentName())
                .requiredSlots(required)
                .currentValues(frame.getCollectedSlots())
                .conversationContext(context)
                .build());

        Map<String, Object> inherited = result.inheritedValues();
        if (!inherited.isEmpty()) {
            stackService.updateSlots(sessionId, frame.getFrameId(), inherited, missing(required, result.values()));
        }
        return result;
    }

    private List<String> requiredSlots(IntentFrame frame) {
        RequiredSlotsProvider provider = requiredSlotsProvider.getIfAvailable();
        if (provider != null) {
            List<String> declared = provider.requiredSlots(frame.getIntentName());
            if (declared != null && !declared.isEmpty()) {
                return List.copyOf(declared);
            }
        }
        Set<String> derived = new LinkedHashSet<>(frame.getCollectedSlots().keySet());
        derived.addAll(frame.getMissingSlots());
        return new ArrayList<>(derived);
    }

    private List<String> missing(List<String> required, Map<String, Object> values) {
        return required.stream().filter(slot -> SlotValues.isEmpty(values.get(slot))).toList();
    }
}
