package com.vidnyan.misra.adapter.out.evaluator.expressions;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 13.6: the operand of the {@code sizeof} operator shall not contain any
 * expression which has potential side effects.
 */
public class SizeofSideEffectsRule extends TokenRule {

    public SizeofSideEffectsRule() {
        super(13, 6);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        return token.is("sizeof") && Expressions.hasSideEffects(token.next());
    }
}
