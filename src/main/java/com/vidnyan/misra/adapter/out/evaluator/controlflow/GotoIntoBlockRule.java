package com.vidnyan.misra.adapter.out.evaluator.controlflow;

import com.vidnyan.misra.domain.model.Scope;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Rule 15.3: any label referenced by a goto statement shall be declared in
 * the same block, or in any block enclosing the goto statement.
 */
public class GotoIntoBlockRule extends TokenRule {

    public GotoIntoBlockRule() {
        super(15, 3);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        if (!GotoLabels.hasLabelName(token)) {
            return false;
        }
        Token label = GotoLabels.findLabelAfter(token);
        if (label == null || label.scope() == null) {
            return false;
        }
        Set<Scope> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Scope scope = token.scope();
        while (scope != null && scope.index() != label.scope().index()) {
            if (!visited.add(scope)) {
                return false;
            }
            scope = scope.nestedIn();
        }
        return scope == null;
    }
}
