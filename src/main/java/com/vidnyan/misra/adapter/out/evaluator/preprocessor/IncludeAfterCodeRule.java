package com.vidnyan.misra.adapter.out.evaluator.preprocessor;

import com.vidnyan.misra.domain.model.Directive;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

import java.util.HashMap;
import java.util.Map;

/**
 * Rule 20.1: {@code #include} directives should only be preceded by
 * preprocessor directives or comments.
 */
public class IncludeAfterCodeRule extends AbstractRule {

    public IncludeAfterCodeRule() {
        super(20, 1);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        Map<String, Integer> firstCodeLine = new HashMap<>();
        for (Token token : context.configuration().tokens()) {
            firstCodeLine.merge(token.file(), token.line(), Math::min);
        }
        for (Directive directive : context.configuration().directives()) {
            if (!directive.str().startsWith("#include")) {
                continue;
            }
            Integer codeLine = firstCodeLine.get(directive.file());
            if (codeLine != null && codeLine < directive.line()) {
                report(sink, directive);
            }
        }
    }
}
