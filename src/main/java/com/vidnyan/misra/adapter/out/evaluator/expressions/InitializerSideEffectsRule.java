package com.vidnyan.misra.adapter.out.evaluator.expressions;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.pattern.TokenPatterns;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

/**
 * Rule 13.1: initializer lists shall not contain persistent side effects.
 */
public class InitializerSideEffectsRule extends AbstractRule {

    public InitializerSideEffectsRule() {
        super(13, 1);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        for (Token token : context.configuration().tokens()) {
            if (!TokenPatterns.simpleMatch(token, "= {")) {
                continue;
            }
            Token init = token.next();
            if (Expressions.hasSideEffects(init)) {
                report(sink, init);
            }
        }
    }
}
