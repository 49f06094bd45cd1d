package com.vidnyan.misra.adapter.out.evaluator.pointers;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.ValueType;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 11.6: a cast shall not be performed between pointer to void and an
 * arithmetic type. A literal {@code 0} cast to {@code void *} is allowed.
 */
public class VoidPointerArithmeticCastRule extends TokenRule {

    public VoidPointerArithmeticCastRule() {
        super(11, 6);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        if (!Expressions.isCast(token) || token.astOperand1().astOperand1() != null) {
            return false;
        }
        CastOperands cast = CastOperands.of(token);
        if (cast == null) {
            return false;
        }
        ValueType vt1 = cast.target();
        ValueType vt2 = cast.source();
        if (vt1.pointer() == 1 && "void".equals(vt1.type()) && vt2.pointer() == 0 && !cast.operand().is("0")) {
            return true;
        }
        return vt1.pointer() == 0 && !"void".equals(vt1.type()) && vt2.pointer() == 1 && "void".equals(vt2.type());
    }
}
