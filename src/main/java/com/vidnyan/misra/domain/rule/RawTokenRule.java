package com.vidnyan.misra.domain.rule;

import com.vidnyan.misra.domain.model.Token;

import java.util.List;

/**
 * A rule over the raw lexical stream, run once per file.
 */
public abstract class RawTokenRule extends AbstractRule {

    protected RawTokenRule(int major, int minor) {
        super(major, minor);
    }

    @Override
    public RuleScope scope() {
        return RuleScope.RAW_TOKENS;
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        evaluate(context.rawTokens().tokens(), sink);
    }

    protected abstract void evaluate(List<Token> rawTokens, DiagnosticsSink sink);
}
