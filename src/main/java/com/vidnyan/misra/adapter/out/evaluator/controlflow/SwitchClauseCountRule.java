package com.vidnyan.misra.adapter.out.evaluator.controlflow;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.TokenPatterns;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 16.6: every switch statement shall have at least two switch-clauses.
 * Clauses are counted by their terminating jump statements.
 */
public class SwitchClauseCountRule extends TokenRule {

    public SwitchClauseCountRule() {
        super(16, 6);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        Token body = Switches.body(token);
        if (body == null) {
            return false;
        }
        int clauses = 0;
        Token tok = body.next();
        while (tok != null) {
            if (tok.is("break") || tok.is("return") || tok.is("throw")) {
                clauses++;
            } else if (tok.is("{")) {
                tok = TokenPatterns.link(tok);
                if (tok == null) {
                    break;
                }
                if (Switches.isNoReturnScope(tok)) {
                    clauses++;
                }
            } else if (tok.is("}")) {
                break;
            }
            tok = tok.next();
        }
        return clauses < 2;
    }
}
