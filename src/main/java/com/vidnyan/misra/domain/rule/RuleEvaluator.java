package com.vidnyan.misra.domain.rule;

/**
 * Interface for rule evaluators.
 * Each evaluator checks exactly one MISRA rule and reports through the sink.
 */
public interface RuleEvaluator {

    /**
     * Rule this evaluator reports.
     */
    RuleId ruleId();

    /**
     * Whether the evaluator runs per configuration or once per file.
     */
    default RuleScope scope() {
        return RuleScope.CONFIGURATION;
    }

    /**
     * Evaluate the rule. Must not modify the model.
     */
    void evaluate(EvaluationContext context, DiagnosticsSink sink);

    /**
     * Get the evaluator name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
