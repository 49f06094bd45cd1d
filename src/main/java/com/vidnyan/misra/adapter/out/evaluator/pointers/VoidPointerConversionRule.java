package com.vidnyan.misra.adapter.out.evaluator.pointers;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.ValueType;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

import java.util.Set;

/**
 * Rule 11.5: a conversion should not be performed from pointer to void into
 * pointer to object. Covers casts and plain assignments; casting the result
 * of the allocation functions is tolerated.
 */
public class VoidPointerConversionRule extends TokenRule {

    private static final Set<String> ALLOCATORS = Set.of("malloc", "calloc", "realloc", "free");

    public VoidPointerConversionRule() {
        super(11, 5);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        if (!Expressions.isCast(token)) {
            return isAssignmentFromVoidPointer(token);
        }
        Token callee = token.astOperand1().astOperand1();
        if (callee != null && ALLOCATORS.contains(callee.str())) {
            return false;
        }
        return fromVoidPointer(token.valueType(), token.astOperand1().valueType());
    }

    private static boolean isAssignmentFromVoidPointer(Token token) {
        if (!token.is("=") || token.astOperand1() == null || token.astOperand2() == null) {
            return false;
        }
        if (token.next() != null && token.next().is("(")) {
            return false;
        }
        return fromVoidPointer(token.astOperand1().valueType(), token.astOperand2().valueType());
    }

    private static boolean fromVoidPointer(ValueType target, ValueType source) {
        if (target == null || source == null) {
            return false;
        }
        return target.isPointer() && !"void".equals(target.type())
                && source.pointer() == target.pointer() && "void".equals(source.type());
    }
}
