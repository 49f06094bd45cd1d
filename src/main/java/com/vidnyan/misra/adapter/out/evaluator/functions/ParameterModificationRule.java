package com.vidnyan.misra.adapter.out.evaluator.functions;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.Variable;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 17.8: a function parameter should not be modified.
 */
public class ParameterModificationRule extends TokenRule {

    public ParameterModificationRule() {
        super(17, 8);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        if (!token.isAssignmentOp() && !token.is("++") && !token.is("--")) {
            return false;
        }
        if (token.astOperand1() == null) {
            return false;
        }
        Variable variable = token.astOperand1().variable();
        return variable != null && variable.isArgument();
    }
}
