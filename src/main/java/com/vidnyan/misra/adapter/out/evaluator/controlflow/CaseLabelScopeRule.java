package com.vidnyan.misra.adapter.out.evaluator.controlflow;

import com.vidnyan.misra.domain.model.ScopeType;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 16.2: a switch label shall only be used when the most closely-enclosing
 * compound statement is the body of a switch statement.
 */
public class CaseLabelScopeRule extends TokenRule {

    public CaseLabelScopeRule() {
        super(16, 2);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        return token.is("case") && token.scope() != null && !token.scope().is(ScopeType.SWITCH);
    }
}
