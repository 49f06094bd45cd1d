package com.vidnyan.misra.adapter.out.evaluator.pointers;

import com.vidnyan.misra.domain.model.Scope;
import com.vidnyan.misra.domain.model.ScopeType;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.ValueType;

/**
 * Value types on both sides of a C-style cast.
 *
 * @param target type cast to
 * @param source type of the cast operand
 */
record CastOperands(Token cast, ValueType target, ValueType source) {

    /**
     * Types of a cast token, null when either side has no value type.
     */
    static CastOperands of(Token cast) {
        ValueType target = cast.valueType();
        ValueType source = cast.astOperand1().valueType();
        if (target == null || source == null) {
            return null;
        }
        return new CastOperands(cast, target, source);
    }

    Token operand() {
        return cast.astOperand1();
    }

    boolean targetIsIntegerLike() {
        return target.isIntegral() || isEnum(cast);
    }

    boolean sourceIsIntegerLike() {
        return source.isIntegral() || isEnum(operand());
    }

    static boolean isEnum(Token token) {
        Scope scope = token.valueTypeScope();
        return scope != null && scope.is(ScopeType.ENUM);
    }
}
