package com.vidnyan.misra.adapter.out.evaluator.functions;

import com.vidnyan.misra.domain.model.Function;
import com.vidnyan.misra.domain.model.Scope;
import com.vidnyan.misra.domain.model.ScopeType;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rule 17.2: functions shall not call themselves, either directly or indirectly.
 *
 * <p>Builds a call map from function bodies, then reports every call site
 * inside a function whose callee can reach the caller again.
 */
public class RecursionRule extends AbstractRule {

    public RecursionRule() {
        super(17, 2);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        List<Scope> functionScopes = context.configuration().scopes().stream()
                .filter(s -> s.is(ScopeType.FUNCTION) && s.function() != null && s.bodyStart() != null)
                .toList();

        Map<Integer, Set<Integer>> calls = new LinkedHashMap<>();
        for (Scope scope : functionScopes) {
            Set<Integer> callees = calls.computeIfAbsent(scope.function().index(), k -> new LinkedHashSet<>());
            for (Token tok = scope.bodyStart(); tok != null && tok != scope.bodyEnd(); tok = tok.next()) {
                if (Expressions.isFunctionCall(tok) && tok.astOperand1().function() != null) {
                    callees.add(tok.astOperand1().function().index());
                }
            }
        }

        for (Map.Entry<Integer, Set<Integer>> entry : calls.entrySet()) {
            int caller = entry.getKey();
            for (int callee : entry.getValue()) {
                if (!reaches(callee, caller, calls, new HashSet<>())) {
                    continue;
                }
                for (Scope scope : functionScopes) {
                    if (scope.function().index() != caller) {
                        continue;
                    }
                    for (Token tok = scope.bodyStart(); tok != null && tok != scope.bodyEnd(); tok = tok.next()) {
                        Function f = tok.function();
                        if (f != null && f.index() == callee) {
                            report(sink, tok);
                        }
                    }
                }
            }
        }
    }

    private static boolean reaches(int from, int target, Map<Integer, Set<Integer>> calls, Set<Integer> visited) {
        if (from == target) {
            return true;
        }
        for (int next : new ArrayList<>(calls.getOrDefault(from, Set.of()))) {
            if (next == target) {
                return true;
            }
            if (!visited.add(next)) {
                continue;
            }
            if (reaches(next, target, calls, visited)) {
                return true;
            }
        }
        return false;
    }
}
