package com.vidnyan.misra.adapter.out.evaluator.preprocessor;

import com.vidnyan.misra.domain.model.Directive;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

import java.util.List;

/**
 * Rule 20.2: the {@code '}, {@code "} or {@code \} characters and the
 * {@code /*} or {@code //} character sequences shall not occur in a header file name.
 */
public class HeaderNameCharactersRule extends AbstractRule {

    private static final List<String> FORBIDDEN = List.of("\\", "//", "/*", "'");

    public HeaderNameCharactersRule() {
        super(20, 2);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        for (Directive directive : context.configuration().directives()) {
            if (directive.str().startsWith("#include ") && FORBIDDEN.stream().anyMatch(directive.str()::contains)) {
                report(sink, directive);
            }
        }
    }
}
