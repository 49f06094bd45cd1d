package com.vidnyan.misra.adapter.out.evaluator.identifiers;

import com.vidnyan.misra.domain.model.Locatable;
import com.vidnyan.misra.domain.model.Scope;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.Variable;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule 5.2: identifiers declared in the same scope and name space shall be distinct.
 *
 * <p>Long variable names are compared with each other and with the tag names of
 * scopes nested directly in the same scope. The later declaration is reported.
 */
public class SameScopeIdentifierDistinctRule extends AbstractRule {

    private static final int LENGTH = SignificantNames.C90_LENGTH;

    public SameScopeIdentifierDistinctRule() {
        super(5, 2);
    }

    private static final class ScopeMembers {
        final List<Variable> variables = new ArrayList<>();
        final List<Scope> scopes = new ArrayList<>();
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        Map<Integer, ScopeMembers> members = new LinkedHashMap<>();
        for (Variable variable : context.configuration().variables()) {
            Token name = variable.nameToken();
            if (name == null || name.str().length() <= LENGTH || name.scope() == null) {
                continue;
            }
            members.computeIfAbsent(name.scope().index(), k -> new ScopeMembers()).variables.add(variable);
        }
        for (Scope scope : context.configuration().scopes()) {
            if (scope.nestedIn() != null && scope.hasClassName() && scope.bodyStart() != null) {
                members.computeIfAbsent(scope.nestedIn().index(), k -> new ScopeMembers()).scopes.add(scope);
            }
        }

        for (ScopeMembers scope : members.values()) {
            if (scope.variables.size() > 1) {
                compareVariables(scope, sink);
            }
            compareTags(scope.scopes, sink);
        }
    }

    private void compareVariables(ScopeMembers scope, DiagnosticsSink sink) {
        List<Variable> variables = scope.variables;
        for (int i = 0; i < variables.size(); i++) {
            Variable v1 = variables.get(i);
            Token name1 = v1.nameToken();
            for (Variable v2 : variables.subList(i + 1, variables.size())) {
                if (v1.isArgument() && v2.isArgument()) {
                    continue;
                }
                if (v1.hasExternalLinkage() || v2.hasExternalLinkage()) {
                    continue;
                }
                Token name2 = v2.nameToken();
                if (same(name1.str(), name2.str()) && v1.index() != v2.index()) {
                    report(sink, name1.line() > name2.line() ? name1 : name2);
                }
            }
            for (Scope inner : scope.scopes) {
                if (same(name1.str(), inner.className())) {
                    reportLater(sink, name1, inner.bodyStart());
                }
            }
        }
    }

    private void compareTags(List<Scope> scopes, DiagnosticsSink sink) {
        for (int i = 0; i < scopes.size(); i++) {
            Scope s1 = scopes.get(i);
            for (Scope s2 : scopes.subList(i + 1, scopes.size())) {
                if (same(s1.className(), s2.className())) {
                    report(sink, s1.bodyStart().line() > s2.bodyStart().line() ? s1.bodyStart() : s2.bodyStart());
                }
            }
        }
    }

    private void reportLater(DiagnosticsSink sink, Locatable first, Locatable second) {
        report(sink, first.line() > second.line() ? first : second);
    }

    private static boolean same(String a, String b) {
        return SignificantNames.prefix(a, LENGTH).equals(SignificantNames.prefix(b, LENGTH));
    }
}
