package com.vidnyan.misra.adapter.out.evaluator.controlflow;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

/**
 * Rule 14.1: a loop counter shall not have essentially floating type.
 */
public class FloatLoopCounterRule extends AbstractRule {

    public FloatLoopCounterRule() {
        super(14, 1);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        for (Token token : context.configuration().tokens()) {
            if (token.is("for")) {
                Loops.ForClauses clauses = Loops.forClauses(token);
                if (clauses == null) {
                    continue;
                }
                for (Token counter : Loops.counterTokens(clauses.condition())) {
                    if (Loops.isFloat(counter)) {
                        report(sink, token);
                    }
                }
            } else if (token.is("while") && Loops.hasFloatCounterInWhileLoop(token)) {
                report(sink, token);
            }
        }
    }
}
