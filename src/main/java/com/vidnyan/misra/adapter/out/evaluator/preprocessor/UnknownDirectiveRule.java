package com.vidnyan.misra.adapter.out.evaluator.preprocessor;

import com.vidnyan.misra.domain.model.Directive;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule 20.13: a line whose first token is {@code #} shall be a valid
 * preprocessing directive.
 */
public class UnknownDirectiveRule extends AbstractRule {

    private static final Pattern DIRECTIVE_NAME = Pattern.compile("#[ ]*([^ (<]*)");
    private static final Set<String> KNOWN = Set.of(
            "define", "elif", "else", "endif", "error", "if", "ifdef", "ifndef", "include",
            "pragma", "undef", "warning");

    public UnknownDirectiveRule() {
        super(20, 13);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        for (Directive directive : context.configuration().directives()) {
            String name = directive.str();
            Matcher m = DIRECTIVE_NAME.matcher(name);
            if (m.lookingAt()) {
                name = m.group(1);
            }
            if (!KNOWN.contains(name)) {
                report(sink, directive);
            }
        }
    }
}
