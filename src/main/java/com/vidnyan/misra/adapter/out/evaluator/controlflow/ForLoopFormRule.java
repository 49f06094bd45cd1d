package com.vidnyan.misra.adapter.out.evaluator.controlflow;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 14.2: a for loop shall be well-formed. The first clause must be an
 * assignment and the condition must be free of side effects.
 */
public class ForLoopFormRule extends TokenRule {

    public ForLoopFormRule() {
        super(14, 2);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        Loops.ForClauses clauses = Loops.forClauses(token);
        if (clauses == null) {
            return false;
        }
        if (clauses.init() != null && !clauses.init().isAssignmentOp()) {
            return true;
        }
        return Expressions.hasSideEffects(clauses.condition());
    }
}
