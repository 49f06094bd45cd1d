package com.vidnyan.misra.adapter.out.evaluator.controlflow;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 14.4: the controlling expression of an if statement and the
 * controlling expression of an iteration-statement shall have essentially Boolean type.
 */
public class NonBooleanConditionRule extends TokenRule {

    public NonBooleanConditionRule() {
        super(14, 4);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        if (!token.is("(") || token.astOperand1() == null) {
            return false;
        }
        Token keyword = token.astOperand1();
        if (!keyword.is("if") && !keyword.is("while")) {
            return false;
        }
        return !Expressions.isBoolExpression(token.astOperand2());
    }
}
