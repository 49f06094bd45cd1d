package com.vidnyan.misra.adapter.out.evaluator.preprocessor;

import com.vidnyan.misra.domain.model.Directive;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

/**
 * Rule 20.5: {@code #undef} should not be used.
 */
public class UndefRule extends AbstractRule {

    public UndefRule() {
        super(20, 5);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        for (Directive directive : context.configuration().directives()) {
            if (directive.str().startsWith("#undef ")) {
                report(sink, directive);
            }
        }
    }
}
