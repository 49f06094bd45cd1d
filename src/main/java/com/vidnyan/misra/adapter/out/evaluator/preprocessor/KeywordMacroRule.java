package com.vidnyan.misra.adapter.out.evaluator.preprocessor;

import com.vidnyan.misra.domain.model.Directive;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule 20.4: a macro shall not be defined with the same name as a keyword.
 */
public class KeywordMacroRule extends AbstractRule {

    private static final Pattern LOWERCASE_DEFINE = Pattern.compile("#define ([a-z][a-z0-9_]+)");

    public KeywordMacroRule() {
        super(20, 4);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        for (Directive directive : context.configuration().directives()) {
            Matcher m = LOWERCASE_DEFINE.matcher(directive.str());
            if (m.find() && Expressions.KEYWORDS.contains(m.group(1))) {
                report(sink, directive);
            }
        }
    }
}
