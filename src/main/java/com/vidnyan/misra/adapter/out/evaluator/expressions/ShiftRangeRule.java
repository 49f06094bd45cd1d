package com.vidnyan.misra.adapter.out.evaluator.expressions;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.Value;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 12.2: the right hand operand of a shift operator shall lie in the range
 * zero to one less than the width in bits of the essential type of the left
 * hand operand.
 */
public class ShiftRangeRule extends TokenRule {

    public ShiftRangeRule() {
        super(12, 2);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        if (!token.is("<<") && !token.is(">>")) {
            return false;
        }
        Token amount = token.astOperand2();
        if (amount == null || !amount.hasValues()) {
            return false;
        }
        long max = 0;
        for (Value value : amount.values()) {
            if (value.intValue() != null && value.intValue() > max) {
                max = value.intValue();
            }
        }
        if (max == 0) {
            return false;
        }
        int width = context.essentialTypes().bitsOf(token.astOperand1());
        return width > 0 && max >= width;
    }
}
