package com.vidnyan.misra.adapter.out.evaluator.controlflow;

import com.vidnyan.misra.domain.model.ScopeType;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 15.5: a function should have a single point of exit at the end.
 * Any {@code return} nested in a block below the function scope is reported.
 */
public class SingleExitRule extends TokenRule {

    public SingleExitRule() {
        super(15, 5);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        return token.is("return") && token.scope() != null && !token.scope().is(ScopeType.FUNCTION);
    }
}
