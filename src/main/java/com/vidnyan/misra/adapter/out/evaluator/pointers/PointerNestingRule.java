package com.vidnyan.misra.adapter.out.evaluator.pointers;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.Variable;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

/**
 * Rule 18.5: declarations should contain no more than two levels of pointer nesting.
 */
public class PointerNestingRule extends AbstractRule {

    private static final int MAX_LEVELS = 2;

    public PointerNestingRule() {
        super(18, 5);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        for (Variable variable : context.configuration().variables()) {
            if (!variable.isPointer() || variable.nameToken() == null) {
                continue;
            }
            int stars = 0;
            for (Token tok = variable.nameToken(); tok != null; tok = tok.previous()) {
                if (tok.is("*")) {
                    stars++;
                } else if (!tok.isName()) {
                    break;
                }
            }
            if (stars > MAX_LEVELS) {
                report(sink, variable.nameToken());
            }
        }
    }
}
