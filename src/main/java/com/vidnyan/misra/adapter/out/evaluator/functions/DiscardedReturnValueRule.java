package com.vidnyan.misra.adapter.out.evaluator.functions;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.ValueType;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 17.7: the value returned by a function having non-void return type shall be used.
 * A call whose parenthesis has no AST parent is an expression statement.
 */
public class DiscardedReturnValueRule extends TokenRule {

    public DiscardedReturnValueRule() {
        super(17, 7);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        if (token.scope() == null || !token.scope().isExecutable()) {
            return false;
        }
        if (!token.is("(") || token.astParent() != null) {
            return false;
        }
        Token callee = token.previous();
        if (callee == null || !callee.isName() || callee.varId() != 0) {
            return false;
        }
        ValueType vt = token.valueType();
        if (vt == null) {
            return false;
        }
        return !("void".equals(vt.type()) && vt.pointer() == 0);
    }
}
