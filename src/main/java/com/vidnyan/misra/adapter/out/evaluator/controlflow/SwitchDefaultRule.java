package com.vidnyan.misra.adapter.out.evaluator.controlflow;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.TokenPatterns;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 16.4: every switch statement shall have a default label.
 */
public class SwitchDefaultRule extends TokenRule {

    public SwitchDefaultRule() {
        super(16, 4);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        Token body = Switches.body(token);
        if (body == null) {
            return false;
        }
        Token tok = body.next();
        while (tok != null && !tok.is("}")) {
            if (tok.is("{")) {
                tok = TokenPatterns.link(tok);
                if (tok == null) {
                    return false;
                }
            } else if (tok.is("default")) {
                break;
            }
            tok = tok.next();
        }
        return tok != null && !tok.is("default");
    }
}
