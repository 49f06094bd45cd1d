package com.vidnyan.misra.adapter.out.evaluator.controlflow;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.pattern.TokenPatterns;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 16.7: a switch-expression shall not have essentially Boolean type.
 */
public class BooleanSwitchRule extends TokenRule {

    public BooleanSwitchRule() {
        super(16, 7);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        return TokenPatterns.simpleMatch(token, "switch (") && Expressions.isBoolExpression(token.next().astOperand2());
    }
}
