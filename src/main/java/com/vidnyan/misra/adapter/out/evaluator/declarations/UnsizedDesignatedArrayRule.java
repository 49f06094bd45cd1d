package com.vidnyan.misra.adapter.out.evaluator.declarations;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.TokenPatterns;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.RawTokenRule;

import java.util.List;

/**
 * Rule 9.5: where designated initializers are used to initialize an array
 * object, the size of the array shall be specified explicitly.
 */
public class UnsizedDesignatedArrayRule extends RawTokenRule {

    public UnsizedDesignatedArrayRule() {
        super(9, 5);
    }

    @Override
    protected void evaluate(List<Token> rawTokens, DiagnosticsSink sink) {
        for (Token token : rawTokens) {
            if (TokenPatterns.simpleMatch(token, "[ ] = { [")) {
                report(sink, token);
            }
        }
    }
}
