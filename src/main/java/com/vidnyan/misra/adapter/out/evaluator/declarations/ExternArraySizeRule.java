package com.vidnyan.misra.adapter.out.evaluator.declarations;

import com.vidnyan.misra.domain.model.ScopeType;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.Variable;
import com.vidnyan.misra.domain.pattern.TokenPatterns;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

/**
 * Rule 8.11: when an array with external linkage is declared, its size
 * should be explicitly specified.
 */
public class ExternArraySizeRule extends AbstractRule {

    public ExternArraySizeRule() {
        super(8, 11);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        for (Variable variable : context.configuration().variables()) {
            Token name = variable.nameToken();
            if (!variable.isExtern() || name == null) {
                continue;
            }
            if (TokenPatterns.simpleMatch(name.next(), "[ ]")
                    && name.scope() != null && name.scope().is(ScopeType.GLOBAL)) {
                report(sink, name);
            }
        }
    }
}
