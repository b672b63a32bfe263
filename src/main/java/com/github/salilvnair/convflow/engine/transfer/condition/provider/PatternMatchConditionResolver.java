package com.github.salilvnair.convflow.engine.transfer.condition.provider;

import com.github.salilvnair.convflow.engine.transfer.condition.core.TransferConditionResolver;
import com.github.salilvnair.convflow.engine.transfer.condition.core.TransferEvaluation;
import com.github.salilvnair.convflow.engine.transfer.model.TransferCondition;
import com.github.salilvnair.convflow.engine.transfer.model.TransferRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Holds when any rule pattern is found in the user input, ignoring case.
 * A rule without patterns always holds.
 */
@Slf4j
@Component
public class PatternMatchConditionResolver implements TransferConditionResolver {

    @Override
    public TransferCondition condition() {
        return TransferCondition.PATTERN_MATCH;
    }

    @Override
    public boolean resolve(TransferEvaluation evaluation, TransferRule rule) {
        List<String> patterns = rule.getPatterns();
        if (patterns == null || patterns.isEmpty()) {
            return true;
        }
        String input = evaluation.userInput();
        if (input == null || input.isBlank()) {
            return false;
        }
        return patterns.stream().anyMatch(p -> compile(p, rule.getRuleId()).matcher(input).find());
    }

    static Pattern compile(String raw, String ruleId) {
        try {
            return Pattern.compile(raw, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        } catch (PatternSyntaxException e) {
            log.warn("Invalid transfer pattern, matching literally ruleId={} pattern={}", ruleId, raw);
            return Pattern.compile(Pattern.quote(raw), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        }
    }
}
