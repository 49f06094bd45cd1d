package com.vidnyan.misra.application.port.out;

import com.vidnyan.misra.domain.rule.RuleId;
import com.vidnyan.misra.domain.rule.RuleText;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Port for rule headline texts and severities.
 */
public interface RuleTextRepository {

    Optional<RuleText> findByRule(RuleId rule);

    /**
     * Number of loaded rule texts.
     */
    int size();

    /**
     * Rules among {@code rules} that have no text, sorted by rule number.
     */
    default List<RuleId> missingRuleTexts(Collection<RuleId> rules) {
        return rules.stream()
                .filter(rule -> findByRule(rule).isEmpty())
                .sorted()
                .toList();
    }
}
