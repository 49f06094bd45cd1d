package com.vidnyan.misra.adapter.out.evaluator.expressions;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

/**
 * Rule 13.3: a full expression containing an increment or decrement operator
 * should have no other potential side effects. Reported at the top of the expression.
 */
public class IncrementSideEffectsRule extends AbstractRule {

    public IncrementSideEffectsRule() {
        super(13, 3);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        for (Token token : context.configuration().tokens()) {
            if (!token.is("++") && !token.is("--")) {
                continue;
            }
            Token top = Expressions.expressionTop(token);
            if (Expressions.countSideEffects(top) >= 2) {
                report(sink, top);
            }
        }
    }
}
