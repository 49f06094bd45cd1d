package com.vidnyan.misra.adapter.out.evaluator.expressions;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 13.5: the right hand operand of a logical {@code &&} or {@code ||}
 * operator shall not contain persistent side effects.
 */
public class LogicalOperandSideEffectsRule extends TokenRule {

    public LogicalOperandSideEffectsRule() {
        super(13, 5);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        return token.isLogicalOp() && Expressions.hasSideEffects(token.astOperand2());
    }
}
