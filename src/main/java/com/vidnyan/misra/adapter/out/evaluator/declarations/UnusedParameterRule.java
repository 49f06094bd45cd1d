package com.vidnyan.misra.adapter.out.evaluator.declarations;

import com.vidnyan.misra.domain.model.Function;
import com.vidnyan.misra.domain.model.Scope;
import com.vidnyan.misra.domain.model.ScopeType;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.Variable;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

import java.util.HashSet;
import java.util.Set;

/**
 * Rule 2.7: there should be no unused parameters in functions.
 * Reported at the function definition.
 */
public class UnusedParameterRule extends AbstractRule {

    public UnusedParameterRule() {
        super(2, 7);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        for (Function function : context.configuration().functions()) {
            if (function.arguments().isEmpty() || function.tokenDef() == null) {
                continue;
            }
            for (Scope scope : context.configuration().scopes()) {
                if (!scope.is(ScopeType.FUNCTION) || scope.function() == null
                        || scope.function().index() != function.index()) {
                    continue;
                }
                Set<Integer> unused = new HashSet<>();
                function.arguments().values().forEach(v -> unused.add(v.index()));
                for (Token tok = scope.bodyStart(); tok != null && tok.next() != null && tok != scope.bodyEnd()
                        && !unused.isEmpty(); tok = tok.next()) {
                    Variable variable = tok.variable();
                    if (variable != null) {
                        unused.remove(variable.index());
                    }
                }
                if (!unused.isEmpty()) {
                    report(sink, function.tokenDef());
                }
            }
        }
    }
}
