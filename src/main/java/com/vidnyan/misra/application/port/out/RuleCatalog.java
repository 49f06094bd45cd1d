package com.vidnyan.misra.application.port.out;

import com.vidnyan.misra.domain.rule.RuleEvaluator;
import com.vidnyan.misra.domain.rule.RuleId;

import java.util.List;
import java.util.Set;

/**
 * Port for the set of rules the engine can evaluate.
 */
public interface RuleCatalog {

    /**
     * All evaluators in a fixed order.
     */
    List<RuleEvaluator> evaluators();

    /**
     * Rules with at least one evaluator.
     */
    Set<RuleId> engineRules();

    /**
     * Rules the external analyzer checks itself.
     */
    Set<RuleId> analyzerRules();

    /**
     * One line per MISRA C:2012 rule, e.g. {@code "15.1    X (Engine)"}.
     */
    List<String> coverageTable();
}
