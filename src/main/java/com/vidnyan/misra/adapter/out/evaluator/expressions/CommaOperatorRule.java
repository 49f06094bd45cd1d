package com.vidnyan.misra.adapter.out.evaluator.expressions;

import com.vidnyan.misra.domain.model.Scope;
import com.vidnyan.misra.domain.model.ScopeType;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 12.3: the comma operator should not be used.
 * Commas separating arguments, initializers and declarations are not operators.
 */
public class CommaOperatorRule extends TokenRule {

    public CommaOperatorRule() {
        super(12, 3);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        if (!token.is(",")) {
            return false;
        }
        Scope scope = token.scope();
        if (scope == null || scope.is(ScopeType.ENUM) || scope.is(ScopeType.CLASS) || scope.is(ScopeType.GLOBAL)) {
            return false;
        }
        Token parent = token.astParent();
        return parent == null || !(parent.is("(") || parent.is(",") || parent.is("{"));
    }
}
