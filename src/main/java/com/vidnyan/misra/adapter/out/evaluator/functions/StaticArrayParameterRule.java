package com.vidnyan.misra.adapter.out.evaluator.functions;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.TokenPatterns;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.RawTokenRule;

import java.util.List;

/**
 * Rule 17.6: the declaration of an array parameter shall not contain the
 * {@code static} keyword between the {@code [ ]}.
 */
public class StaticArrayParameterRule extends RawTokenRule {

    public StaticArrayParameterRule() {
        super(17, 6);
    }

    @Override
    protected void evaluate(List<Token> rawTokens, DiagnosticsSink sink) {
        for (Token token : rawTokens) {
            if (TokenPatterns.simpleMatch(token, "[ static")) {
                report(sink, token);
            }
        }
    }
}
