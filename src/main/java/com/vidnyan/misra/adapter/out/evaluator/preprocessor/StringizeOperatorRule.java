package com.vidnyan.misra.adapter.out.evaluator.preprocessor;

import com.vidnyan.misra.domain.model.Directive;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

/**
 * Rule 20.10: the {@code #} and {@code ##} preprocessor operators should not be used.
 */
public class StringizeOperatorRule extends AbstractRule {

    public StringizeOperatorRule() {
        super(20, 10);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        for (Directive directive : context.configuration().directives()) {
            if (MacroDefinition.parse(directive).expansion().contains("#")) {
                report(sink, directive);
            }
        }
    }
}
