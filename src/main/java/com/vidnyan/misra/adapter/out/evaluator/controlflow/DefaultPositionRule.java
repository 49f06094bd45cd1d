package com.vidnyan.misra.adapter.out.evaluator.controlflow;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.TokenPatterns;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 16.5: a default label shall appear as either the first or the last
 * switch label of a switch statement.
 */
public class DefaultPositionRule extends TokenRule {

    public DefaultPositionRule() {
        super(16, 5);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        if (!token.is("default")) {
            return false;
        }
        if (token.previous() != null && token.previous().is("{")) {
            return false;
        }
        Token tok = token;
        while (tok != null) {
            if (tok.is("}") || tok.is("case")) {
                break;
            }
            if (tok.is("{")) {
                tok = TokenPatterns.link(tok);
                if (tok == null) {
                    return false;
                }
            }
            tok = tok.next();
        }
        return tok != null && tok.is("case");
    }
}
