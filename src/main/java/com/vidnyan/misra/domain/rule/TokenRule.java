package com.vidnyan.misra.domain.rule;

import com.vidnyan.misra.domain.model.Token;

/**
 * A rule that is a predicate over single decorated tokens. Each matching
 * token is reported at its own location.
 */
public abstract class TokenRule extends AbstractRule {

    protected TokenRule(int major, int minor) {
        super(major, minor);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        for (Token token : context.configuration().tokens()) {
            if (matches(token, context)) {
                report(sink, token);
            }
        }
    }

    protected abstract boolean matches(Token token, EvaluationContext context);
}
