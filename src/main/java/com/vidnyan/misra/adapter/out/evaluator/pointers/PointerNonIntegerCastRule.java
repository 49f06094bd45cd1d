package com.vidnyan.misra.adapter.out.evaluator.pointers;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.ValueType;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 11.7: a cast shall not be performed between pointer to object and a
 * non-integer arithmetic type.
 */
public class PointerNonIntegerCastRule extends TokenRule {

    public PointerNonIntegerCastRule() {
        super(11, 7);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        if (!Expressions.isCast(token)) {
            return false;
        }
        CastOperands cast = CastOperands.of(token);
        if (cast == null || cast.operand().astOperand1() != null) {
            return false;
        }
        ValueType vt1 = cast.target();
        ValueType vt2 = cast.source();
        if (vt2.isPointer() && !vt1.isPointer() && !cast.targetIsIntegerLike() && !"void".equals(vt1.type())) {
            return true;
        }
        return vt1.isPointer() && !vt2.isPointer() && !cast.sourceIsIntegerLike() && !"void".equals(vt1.type());
    }
}
