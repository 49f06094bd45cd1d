package com.vidnyan.misra.adapter.out.evaluator.expressions;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 13.4: the result of an assignment operator should not be used.
 */
public class AssignmentResultUsedRule extends TokenRule {

    public AssignmentResultUsedRule() {
        super(13, 4);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        if (!token.is("=") || token.astParent() == null) {
            return false;
        }
        Token lhs = token.astOperand1();
        if (lhs != null && lhs.is("[") && lhs.previous() != null
                && (lhs.previous().is("{") || lhs.previous().is(","))) {
            // designated initializer
            return false;
        }
        Token parent = token.astParent();
        return !(parent.is(",") || parent.is(";") || parent.is("{"));
    }
}
