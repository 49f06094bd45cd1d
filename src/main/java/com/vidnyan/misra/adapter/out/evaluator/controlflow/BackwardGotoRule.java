package com.vidnyan.misra.adapter.out.evaluator.controlflow;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 15.2: the goto statement shall jump to a label declared later in the same function.
 */
public class BackwardGotoRule extends TokenRule {

    public BackwardGotoRule() {
        super(15, 2);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        return GotoLabels.hasLabelName(token) && GotoLabels.findLabelAfter(token) == null;
    }
}
