package com.vidnyan.misra.domain.rule;

/**
 * Headline text and classification of a rule.
 */
public record RuleText(
    RuleId rule,
    String text,
    DomainSeverity severity
) {
}
