package com.github.salilvnair.convflow.engine.transfer;

import com.github.salilvnair.convflow.engine.constants.ConvFlowContextKey;
import com.github.salilvnair.convflow.engine.constants.ConvFlowValue;
import com.github.salilvnair.convflow.engine.stack.IntentStackService;
import com.github.salilvnair.convflow.engine.stack.model.FrameStatus;
import com.github.salilvnair.convflow.engine.stack.model.IntentFrame;
import com.github.salilvnair.convflow.engine.stack.model.InterruptionKind;
import com.github.salilvnair.convflow.engine.transfer.model.IntentPattern;
import com.github.salilvnair.convflow.engine.transfer.model.TransferCondition;
import com.github.salilvnair.convflow.engine.transfer.model.TransferDecision;
import com.github.salilvnair.convflow.engine.transfer.model.TransferRecord;
import com.github.salilvnair.convflow.engine.transfer.model.TransferRule;
import com.github.salilvnair.convflow.engine.transfer.model.TransferTrigger;
import com.github.salilvnair.convflow.engine.transfer.model.TransferType;
import com.github.salilvnair.convflow.intent.ClassifiedIntent;
import com.github.salilvnair.convflow.intent.IntentClassifier;
import com.github.salilvnair.convflow.support.ConvFlowFixture;
import com.github.salilvnair.convflow.support.Providers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.github.salilvnair.convflow.support.TestConstants.BOOM;
import static com.github.salilvnair.convflow.support.TestConstants.INTENT_BOOK_FLIGHT;
import static com.github.salilvnair.convflow.support.TestConstants.INTENT_CANCEL_BOOKING;
import static com.github.salilvnair.convflow.support.TestConstants.INTENT_CHECK_BALANCE;
import static com.github.salilvnair.convflow.support.TestConstants.INTENT_WEATHER;
import static com.github.salilvnair.convflow.support.TestConstants.REASON;
import static com.github.salilvnair.convflow.support.TestConstants.SESSION_ID;
import static com.github.salilvnair.convflow.support.TestConstants.USER_ID;
import static com.github.salilvnair.convflow.support.TestConstants.USER_TEXT_BALANCE;
import static com.github.salilvnair.convflow.support.TestConstants.USER_TEXT_BOOK;
import static com.github.salilvnair.convflow.support.TestConstants.USER_TEXT_CANCEL;
import static com.github.salilvnair.convflow.support.TestConstants.USER_TEXT_EXIT;
import static com.github.salilvnair.convflow.support.TestConstants.USER_TEXT_GO_BACK;
import static com.github.salilvnair.convflow.support.TestConstants.USER_TEXT_HELLO;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IntentTransferServiceTest {

    @Mock
    private IntentClassifier classifier;

    private ConvFlowFixture fixture;
    private TransferRuleRegistry registry;
    private IntentStackService stackService;
    private TransferHistoryService historyService;
    private SessionActivityTracker activityTracker;
    private IntentTransferService service;

    @BeforeEach
    void setUp() {
        fixture = new ConvFlowFixture();
        registry = new TransferRuleRegistry(fixture.properties);
        registry.init();
        stackService = fixture.stackService();
        historyService = fixture.historyService();
        activityTracker = fixture.activityTracker();
        service = newService(registry, Providers.of(IntentClassifier.class, classifier));
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private IntentTransferService newService(TransferRuleRegistry rules, ObjectProvider<IntentClassifier> classifiers) {
        return new IntentTransferService(
                rules,
                fixture.conditionResolverFactory(),
                new SpecialTransferDetector(activityTracker, fixture.properties),
                historyService,
                stackService,
                fixture.callGuard,
                classifiers,
                fixture.properties,
                fixture.clock
        );
    }

    private void classifyAs(String userText, String intent, double confidence) {
        when(classifier.classify(eq(userText), anyMap())).thenReturn(new ClassifiedIntent(intent, confidence));
    }

    private void bookFlightInterruptedByBalance() {
        stackService.push(SESSION_ID, USER_ID, INTENT_BOOK_FLIGHT, Map.of());
        stackService.push(SESSION_ID, USER_ID, INTENT_CHECK_BALANCE, Map.of(), InterruptionKind.USER_INITIATED, REASON);
    }

    @Test
    void cancelReturnsToPreviousIntent() {
        bookFlightInterruptedByBalance();
        classifyAs(USER_TEXT_CANCEL, INTENT_CANCEL_BOOKING, 0.9d);

        TransferDecision decision = service.evaluate(SESSION_ID, USER_ID, INTENT_CHECK_BALANCE, USER_TEXT_CANCEL, Map.of());

        assertTrue(decision.shouldTransfer());
        assertEquals("cancel_return", decision.ruleId());
        assertEquals(TransferTrigger.USER_CLARIFICATION, decision.trigger());
        assertEquals(TransferType.POP_ONLY, decision.transferType());
        assertEquals(INTENT_BOOK_FLIGHT, decision.targetIntent());

        assertTrue(service.executeTransfer(SESSION_ID, USER_ID, decision, Map.of()));

        assertEquals(1, stackService.depth(SESSION_ID));
        IntentFrame active = stackService.getActive(SESSION_ID).orElseThrow();
        assertEquals(INTENT_BOOK_FLIGHT, active.getIntentName());
        TransferRecord recorded = historyService.latest(SESSION_ID).orElseThrow();
        assertEquals(INTENT_CHECK_BALANCE, recorded.fromIntent());
        assertEquals(INTENT_BOOK_FLIGHT, recorded.toIntent());
        assertEquals(TransferType.POP_ONLY, recorded.transferType());
    }

    @Test
    void previousFallsBackToUnknownWithoutStackOrHistory() {
        classifyAs(USER_TEXT_CANCEL, INTENT_CANCEL_BOOKING, 0.9d);

        TransferDecision decision = service.evaluate(SESSION_ID, USER_ID, INTENT_CHECK_BALANCE, USER_TEXT_CANCEL, Map.of());

        assertTrue(decision.shouldTransfer());
        assertEquals(ConvFlowValue.UNKNOWN, decision.targetIntent());
    }

    @Test
    void previousFallsBackToLatestRecordedSource() {
        stackService.push(SESSION_ID, USER_ID, INTENT_CHECK_BALANCE, Map.of());
        historyService.record(new TransferRecord(SESSION_ID, USER_ID, INTENT_WEATHER, INTENT_CHECK_BALANCE,
                TransferTrigger.EXPLICIT_CHANGE, TransferType.POP_THEN_PUSH, 0.9d, "explicit_change_all",
                REASON, fixture.clock.instant()));
        classifyAs(USER_TEXT_CANCEL, INTENT_CANCEL_BOOKING, 0.9d);

        TransferDecision decision = service.evaluate(SESSION_ID, USER_ID, INTENT_CHECK_BALANCE, USER_TEXT_CANCEL, Map.of());

        assertEquals(INTENT_WEATHER, decision.targetIntent());
    }

    @Test
    void confidentRequestReplacesCurrentIntent() {
        stackService.push(SESSION_ID, USER_ID, INTENT_BOOK_FLIGHT, Map.of());
        classifyAs(USER_TEXT_BALANCE, INTENT_CHECK_BALANCE, 0.95d);

        TransferDecision decision = service.evaluate(SESSION_ID, USER_ID, INTENT_BOOK_FLIGHT, USER_TEXT_BALANCE, Map.of());

        assertEquals("explicit_change_all", decision.ruleId());
        assertEquals(TransferType.POP_THEN_PUSH, decision.transferType());
        assertEquals(INTENT_CHECK_BALANCE, decision.targetIntent());
        assertEquals(INTENT_CHECK_BALANCE, decision.candidateIntent());

        service.executeTransfer(SESSION_ID, USER_ID, decision, Map.of());

        assertEquals(1, stackService.depth(SESSION_ID));
        assertEquals(INTENT_CHECK_BALANCE, stackService.peek(SESSION_ID).orElseThrow().getIntentName());
    }

    @Test
    void lessConfidentBalanceQueryInterruptsAndKeepsContext() {
        stackService.push(SESSION_ID, USER_ID, INTENT_BOOK_FLIGHT, Map.of());
        classifyAs(USER_TEXT_BALANCE, INTENT_CHECK_BALANCE, 0.75d);
        Map<String, Object> context = Map.of("channel", "app");

        TransferDecision decision = service.evaluate(SESSION_ID, USER_ID, INTENT_BOOK_FLIGHT, USER_TEXT_BALANCE, context);

        assertEquals("query_interruption", decision.ruleId());
        assertEquals(TransferType.PUSH_ONLY, decision.transferType());
        assertTrue(decision.saveContext());

        service.executeTransfer(SESSION_ID, USER_ID, decision, context);

        List<IntentFrame> frames = stackService.getStack(SESSION_ID);
        assertEquals(2, frames.size());
        assertEquals(FrameStatus.INTERRUPTED, frames.get(0).getStatus());
        assertEquals(InterruptionKind.USER_INITIATED, frames.get(0).getInterruptionKind());
        assertEquals(context, frames.get(0).getSavedContext());
        assertEquals(context, frames.get(1).getSavedContext());
    }

    @Test
    void errorRecoveryFrameStartsFromTurnContext() {
        stackService.push(SESSION_ID, USER_ID, INTENT_BOOK_FLIGHT, Map.of());
        Map<String, Object> context = Map.of(ConvFlowContextKey.ERROR_COUNT, 3, "channel", "app");
        TransferDecision decision = service.evaluate(SESSION_ID, USER_ID, INTENT_BOOK_FLIGHT, USER_TEXT_BOOK, context);

        assertFalse(decision.saveContext());
        assertTrue(service.executeTransfer(SESSION_ID, USER_ID, decision, context));

        List<IntentFrame> frames = stackService.getStack(SESSION_ID);
        assertEquals(ConvFlowValue.ERROR_RECOVERY, frames.get(1).getIntentName());
        assertEquals(context, frames.get(1).getSavedContext());
        assertTrue(frames.get(0).getSavedContext().isEmpty());
    }

    @Test
    void equalPriorityRulesRunInRegistrationOrder() {
        TransferRuleRegistry rules = new TransferRuleRegistry(fixture.properties);
        rules.addRule(anyToAny("first", 5));
        rules.addRule(anyToAny("second", 5));
        IntentTransferService custom = newService(rules, Providers.of(IntentClassifier.class, classifier));
        classifyAs(USER_TEXT_HELLO, INTENT_WEATHER, 0.5d);

        TransferDecision decision = custom.evaluate(SESSION_ID, USER_ID, INTENT_BOOK_FLIGHT, USER_TEXT_HELLO, Map.of());

        assertEquals("first", decision.ruleId());
    }

    @Test
    void failingConditionSkipsRuleAndIsReported() {
        TransferRuleRegistry custom = new TransferRuleRegistry(fixture.properties);
        custom.addRule(TransferRule.builder()
                .ruleId("semantic")
                .fromIntent(IntentPattern.ANY)
                .toIntent(IntentPattern.ANY)
                .trigger(TransferTrigger.EXPLICIT_CHANGE)
                .conditions(List.of(TransferCondition.SEMANTIC_SIMILARITY))
                .priority(1)
                .build());
        custom.addRule(anyToAny("fallback", 2));
        IntentTransferService withCustomRules = newService(custom, Providers.of(IntentClassifier.class, classifier));
        classifyAs(USER_TEXT_HELLO, INTENT_WEATHER, 0.9d);
        Map<String, Object> context = Map.of(ConvFlowContextKey.SEMANTIC_SIMILARITY, "high");

        TransferDecision decision = withCustomRules.evaluate(SESSION_ID, USER_ID, INTENT_BOOK_FLIGHT, USER_TEXT_HELLO, context);

        assertEquals("fallback", decision.ruleId());
        assertEquals(1, decision.skippedRules().size());
        assertTrue(decision.skippedRules().get(0).startsWith("semantic: "));
    }

    @Test
    void noRuleMatchingYieldsNegativeDecisionWithCandidate() {
        classifyAs(USER_TEXT_HELLO, INTENT_WEATHER, 0.5d);

        TransferDecision decision = service.evaluate(SESSION_ID, USER_ID, INTENT_BOOK_FLIGHT, USER_TEXT_HELLO, Map.of());

        assertFalse(decision.shouldTransfer());
        assertEquals(TransferType.NONE, decision.transferType());
        assertEquals(INTENT_WEATHER, decision.candidateIntent());
        assertEquals("no transfer rule matched", decision.reason());
    }

    @Test
    void candidateEqualToCurrentIntentDoesNotTransfer() {
        classifyAs(USER_TEXT_BOOK, INTENT_BOOK_FLIGHT, 0.99d);

        TransferDecision decision = service.evaluate(SESSION_ID, USER_ID, INTENT_BOOK_FLIGHT, USER_TEXT_BOOK, Map.of());

        assertFalse(decision.shouldTransfer());
        assertEquals(INTENT_BOOK_FLIGHT, decision.candidateIntent());
    }

    @Test
    void classifierFailureYieldsNegativeDecision() {
        when(classifier.classify(eq(USER_TEXT_BOOK), anyMap())).thenThrow(new IllegalStateException(BOOM));

        TransferDecision decision = service.evaluate(SESSION_ID, USER_ID, INTENT_WEATHER, USER_TEXT_BOOK, Map.of());

        assertFalse(decision.shouldTransfer());
        assertTrue(decision.reason().startsWith("classification failed"));
        assertNull(decision.candidateIntent());
    }

    @Test
    void missingClassifierYieldsNegativeDecision() {
        IntentTransferService withoutClassifier = newService(registry, Providers.empty(IntentClassifier.class));

        TransferDecision decision = withoutClassifier.evaluate(SESSION_ID, USER_ID, INTENT_WEATHER, USER_TEXT_BOOK, Map.of());

        assertFalse(decision.shouldTransfer());
        assertEquals("no intent recognised", decision.reason());
    }

    @Test
    void inactiveSessionTransfersToTimeoutBeforeClassifying() {
        activityTracker.touch(SESSION_ID);
        fixture.clock.advance(Duration.ofMinutes(31));

        TransferDecision decision = service.evaluate(SESSION_ID, USER_ID, INTENT_BOOK_FLIGHT, USER_TEXT_BOOK, Map.of());

        assertEquals(ConvFlowValue.TIMEOUT, decision.targetIntent());
        assertEquals(TransferTrigger.TIMEOUT, decision.trigger());
        assertEquals("special:timeout", decision.ruleId());
    }

    @Test
    void repeatedErrorsTransferToErrorRecovery() {
        Map<String, Object> context = Map.of(ConvFlowContextKey.ERROR_COUNT, 3);

        TransferDecision decision = service.evaluate(SESSION_ID, USER_ID, INTENT_BOOK_FLIGHT, USER_TEXT_BOOK, context);

        assertEquals(ConvFlowValue.ERROR_RECOVERY, decision.targetIntent());
        assertEquals(TransferTrigger.ERROR_RECOVERY, decision.trigger());
        assertEquals(TransferType.PUSH_ONLY, decision.transferType());
    }

    @Test
    void exitPhraseEndsSession() {
        TransferDecision decision = service.evaluate(SESSION_ID, USER_ID, INTENT_BOOK_FLIGHT, USER_TEXT_EXIT, Map.of());

        assertEquals(ConvFlowValue.SESSION_END, decision.targetIntent());
        assertEquals("special:exit", decision.ruleId());
    }

    @Test
    void goBackPhrasePopsToPreviousIntent() {
        bookFlightInterruptedByBalance();

        TransferDecision decision = service.evaluate(SESSION_ID, USER_ID, INTENT_CHECK_BALANCE, USER_TEXT_GO_BACK, Map.of());

        assertEquals("special:back", decision.ruleId());
        assertEquals(INTENT_BOOK_FLIGHT, decision.targetIntent());
        assertEquals(TransferType.POP_ONLY, decision.transferType());
    }

    @Test
    void negativeDecisionIsNotExecuted() {
        stackService.push(SESSION_ID, USER_ID, INTENT_BOOK_FLIGHT, Map.of());

        assertFalse(service.executeTransfer(SESSION_ID, USER_ID, TransferDecision.noTransfer(REASON), Map.of()));
        assertFalse(service.executeTransfer(SESSION_ID, USER_ID, null, Map.of()));

        assertEquals(1, stackService.depth(SESSION_ID));
        assertTrue(historyService.latest(SESSION_ID).isEmpty());
    }

    private TransferRule anyToAny(String ruleId, int priority) {
        return TransferRule.builder()
                .ruleId(ruleId)
                .fromIntent(IntentPattern.ANY)
                .toIntent(IntentPattern.ANY)
                .trigger(TransferTrigger.CONTEXT_DRIVEN)
                .priority(priority)
                .build();
    }
}
