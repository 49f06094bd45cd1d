package com.vidnyan.misra.adapter.out.evaluator.identifiers;

import com.vidnyan.misra.domain.model.Directive;
import com.vidnyan.misra.domain.model.Scope;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.Variable;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

import java.util.HashSet;
import java.util.Set;

/**
 * Rule 5.5: identifiers shall be distinct from macro names.
 */
public class MacroNameCollisionRule extends AbstractRule {

    public MacroNameCollisionRule() {
        super(5, 5);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        int length = context.standard().significantNameLength();
        Set<String> macroNames = new HashSet<>();
        for (Directive directive : context.configuration().directives()) {
            String name = SignificantNames.macroName(directive);
            if (name != null) {
                macroNames.add(SignificantNames.prefix(name, length));
            }
        }
        if (macroNames.isEmpty()) {
            return;
        }
        for (Variable variable : context.configuration().variables()) {
            Token name = variable.nameToken();
            if (name != null && macroNames.contains(SignificantNames.prefix(name.str(), length))) {
                report(sink, name);
            }
        }
        for (Scope scope : context.configuration().scopes()) {
            if (scope.hasClassName() && scope.bodyStart() != null
                    && macroNames.contains(SignificantNames.prefix(scope.className(), length))) {
                report(sink, scope.bodyStart());
            }
        }
    }
}
