package com.vidnyan.misra.domain.rule;

import com.vidnyan.misra.domain.model.Locatable;

/**
 * Base class holding the rule id.
 */
public abstract class AbstractRule implements RuleEvaluator {

    private final RuleId ruleId;

    protected AbstractRule(int major, int minor) {
        this.ruleId = RuleId.of(major, minor);
    }

    @Override
    public RuleId ruleId() {
        return ruleId;
    }

    protected void report(DiagnosticsSink sink, Locatable location) {
        sink.report(location, ruleId);
    }

    @Override
    public String toString() {
        return getName() + "[" + ruleId + "]";
    }
}
