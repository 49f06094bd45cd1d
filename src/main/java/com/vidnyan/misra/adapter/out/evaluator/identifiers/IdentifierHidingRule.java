package com.vidnyan.misra.adapter.out.evaluator.identifiers;

import com.vidnyan.misra.domain.model.Locatable;
import com.vidnyan.misra.domain.model.Scope;
import com.vidnyan.misra.domain.model.ScopeType;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.Variable;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rule 5.3: an identifier declared in an inner scope shall not hide an
 * identifier declared in an outer scope.
 *
 * <p>Inner variables are compared against variables of every enclosing scope,
 * against tag names and against enumerator names.
 */
public class IdentifierHidingRule extends AbstractRule {

    public IdentifierHidingRule() {
        super(5, 3);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        int length = context.standard().significantNameLength();

        Map<Integer, List<Variable>> scopeVariables = new HashMap<>();
        for (Variable variable : context.configuration().variables()) {
            Token name = variable.nameToken();
            if (name != null && name.scope() != null) {
                scopeVariables.computeIfAbsent(name.scope().index(), k -> new ArrayList<>()).add(variable);
            }
        }

        Map<String, List<Scope>> tags = new HashMap<>();
        for (Scope scope : context.configuration().scopes()) {
            if (scope.hasClassName()) {
                tags.computeIfAbsent(SignificantNames.prefix(scope.className(), length), k -> new ArrayList<>())
                        .add(scope);
            }
        }

        Set<String> enumerators = new HashSet<>();
        for (Scope inner : context.configuration().scopes()) {
            if (inner.is(ScopeType.ENUM)) {
                collectEnumerators(inner, length, enumerators);
                continue;
            }
            List<Variable> innerVariables = scopeVariables.get(inner.index());
            if (innerVariables == null || inner.is(ScopeType.GLOBAL)) {
                continue;
            }
            for (Variable innerVar : innerVariables) {
                Token innerName = innerVar.nameToken();
                String name = SignificantNames.prefix(innerName.str(), length);
                Set<Scope> visited = Collections.newSetFromMap(new IdentityHashMap<>());
                visited.add(inner);
                for (Scope outer = inner.nestedIn(); outer != null && visited.add(outer); outer = outer.nestedIn()) {
                    for (Variable outerVar : scopeVariables.getOrDefault(outer.index(), List.of())) {
                        if (!name.equals(SignificantNames.prefix(outerVar.name(), length))) {
                            continue;
                        }
                        if (outerVar.isArgument() && outer.is(ScopeType.GLOBAL) && !innerVar.isArgument()) {
                            continue;
                        }
                        reportLater(sink, innerName, outerVar.nameToken());
                    }
                }
                for (Scope tag : tags.getOrDefault(name, List.of())) {
                    if (tag.bodyStart() != null) {
                        reportLater(sink, innerName, tag.bodyStart());
                    }
                }
                if (enumerators.contains(name) && inner.bodyStart() != null) {
                    reportLater(sink, innerName, inner.bodyStart());
                }
            }
        }

        for (Scope scope : context.configuration().scopes()) {
            if (scope.hasClassName() && scope.bodyStart() != null
                    && enumerators.contains(SignificantNames.prefix(scope.className(), length))) {
                report(sink, scope.bodyStart());
            }
        }
    }

    private static void collectEnumerators(Scope enumScope, int length, Set<String> enumerators) {
        Token start = enumScope.bodyStart();
        Token end = enumScope.bodyEnd();
        if (start == null || end == null) {
            return;
        }
        for (Token tok = start.next(); tok != null && tok != end; tok = tok.next()) {
            if (tok.hasValues() && tok.isName()) {
                enumerators.add(SignificantNames.prefix(tok.str(), length));
            }
        }
    }

    private void reportLater(DiagnosticsSink sink, Token innerName, Locatable outer) {
        report(sink, innerName.line() > outer.line() ? innerName : outer);
    }
}
