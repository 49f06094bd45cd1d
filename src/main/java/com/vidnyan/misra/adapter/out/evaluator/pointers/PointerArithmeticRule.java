package com.vidnyan.misra.adapter.out.evaluator.pointers;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.ValueType;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

import java.util.Set;

/**
 * Rule 18.4: the {@code +}, {@code -}, {@code +=} and {@code -=} operators
 * should not be applied to an expression of pointer type.
 */
public class PointerArithmeticRule extends TokenRule {

    private static final Set<String> OPERATORS = Set.of("+", "-", "+=", "-=");

    public PointerArithmeticRule() {
        super(18, 4);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        if (!OPERATORS.contains(token.str()) || token.astOperand1() == null || token.astOperand2() == null) {
            return false;
        }
        return isPointer(token.astOperand1().valueType()) || isPointer(token.astOperand2().valueType());
    }

    private static boolean isPointer(ValueType vt) {
        return vt != null && vt.isPointer();
    }
}
