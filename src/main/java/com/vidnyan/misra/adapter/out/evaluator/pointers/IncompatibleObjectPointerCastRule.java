package com.vidnyan.misra.adapter.out.evaluator.pointers;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.ValueType;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 11.3: a cast shall not be performed between a pointer to object type
 * and a pointer to a different object type. Casts to a character pointer are allowed.
 */
public class IncompatibleObjectPointerCastRule extends TokenRule {

    public IncompatibleObjectPointerCastRule() {
        super(11, 3);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        if (!Expressions.isCast(token)) {
            return false;
        }
        CastOperands cast = CastOperands.of(token);
        if (cast == null) {
            return false;
        }
        ValueType vt1 = cast.target();
        ValueType vt2 = cast.source();
        if ("void".equals(vt1.type()) || "void".equals(vt2.type())) {
            return false;
        }
        if (vt1.isPointer() && "record".equals(vt1.type()) && vt2.isPointer() && "record".equals(vt2.type())) {
            return vt1.typeScope() != vt2.typeScope();
        }
        return vt1.pointer() == vt2.pointer() && vt1.isPointer()
                && !vt1.type().equals(vt2.type()) && !"char".equals(vt1.type());
    }
}
