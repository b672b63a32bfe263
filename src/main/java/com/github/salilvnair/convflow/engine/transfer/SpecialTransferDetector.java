package com.github.salilvnair.convflow.engine.transfer;

import com.github.salilvnair.convflow.config.ConvFlowProperties;
import com.github.salilvnair.convflow.engine.constants.ConvFlowValue;
import com.github.salilvnair.convflow.engine.transfer.model.TransferDecision;
import com.github.salilvnair.convflow.engine.transfer.model.TransferTrigger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Transfers decided before any rule or classifier runs, checked in order:
 * session timeout, too many errors, exit phrases, go-back phrases.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class SpecialTransferDetector {

    private static final String RULE_TIMEOUT = "special:timeout";
    private static final String RULE_ERROR_RECOVERY = "special:error_recovery";
    private static final String RULE_EXIT = "special:exit";
    private static final String RULE_BACK = "special:back";

    private final SessionActivityTracker activityTracker;
    private final ConvFlowProperties properties;

    public Optional<TransferDecision> detect(String sessionId, String userInput, Map<String, Object> context) {
        ConvFlowProperties.Transfer config = properties.getTransfer();

        if (activityTracker.isTimedOut(sessionId)) {
            return Optional.of(TransferDecision.transfer(
                    ConvFlowValue.TIMEOUT, TransferTrigger.TIMEOUT, 1.0d, RULE_TIMEOUT,
                    "session inactive longer than " + config.getSessionTimeout(), null, List.of()));
        }

        int errors = errorCount(context, config.getErrorCountKey());
        if (errors >= config.getErrorThreshold()) {
            return Optional.of(TransferDecision.transfer(
                    ConvFlowValue.ERROR_RECOVERY, TransferTrigger.ERROR_RECOVERY, 1.0d, RULE_ERROR_RECOVERY,
                    "error count " + errors + " reached threshold " + config.getErrorThreshold(), null, List.of()));
        }

        if (matchesAny(userInput, config.getExitPatterns())) {
            return Optional.of(TransferDecision.transfer(
                    ConvFlowValue.SESSION_END, TransferTrigger.USER_CLARIFICATION, 0.9d, RULE_EXIT,
                    "user asked to leave", null, List.of()));
        }

        if (matchesAny(userInput, config.getBackPatterns())) {
            return Optional.of(TransferDecision.transfer(
                    ConvFlowValue.PREVIOUS, TransferTrigger.USER_CLARIFICATION, 0.9d, RULE_BACK,
                    "user asked to go back", null, List.of()));
        }
        return Optional.empty();
    }

    private int errorCount(Map<String, Object> context, String key) {
        Object raw = context == null ? null : context.get(key);
        if (raw instanceof Number n) {
            return n.intValue();
        }
        if (raw instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring non-numeric error count key={} value={}", key, s);
            }
        }
        return 0;
    }

    private boolean matchesAny(String input, List<String> patterns) {
        if (input == null || input.isBlank() || patterns == null) {
            return false;
        }
        for (String raw : patterns) {
            Pattern pattern;
            try {
                pattern = Pattern.compile(raw, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            } catch (PatternSyntaxException e) {
                log.warn("Invalid special transfer pattern, matching literally pattern={}", raw);
                pattern = Pattern.compile(Pattern.quote(raw), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            }
            if (pattern.matcher(input).find()) {
                return true;
            }
        }
        return false;
    }
}
