package com.vidnyan.misra.adapter.out.evaluator.declarations;

import com.vidnyan.misra.domain.model.Scope;
import com.vidnyan.misra.domain.model.ScopeType;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.Value;
import com.vidnyan.misra.domain.pattern.TokenPatterns;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rule 8.12: within an enumerator list, the value of an implicitly-specified
 * enumeration constant shall be unique. Reported at the enum body once per
 * clashing implicit value.
 */
public class EnumeratorValueUniqueRule extends AbstractRule {

    public EnumeratorValueUniqueRule() {
        super(8, 12);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        for (Scope scope : context.configuration().scopes()) {
            if (!scope.is(ScopeType.ENUM) || scope.bodyStart() == null || scope.bodyEnd() == null) {
                continue;
            }
            List<Long> values = new ArrayList<>();
            List<Long> implicitValues = new ArrayList<>();
            Token tok = scope.bodyStart().next();
            while (tok != null && tok != scope.bodyEnd()) {
                if (tok.is("(")) {
                    Token close = TokenPatterns.link(tok);
                    if (close == null) {
                        break;
                    }
                    tok = close;
                    continue;
                }
                Token prev = tok.previous();
                if (prev != null && !prev.is(",") && !prev.is("{")) {
                    tok = tok.next();
                    continue;
                }
                if (isEnumerator(tok, scope)) {
                    List<Long> tokenValues = tok.values().stream().map(Value::intValue).toList();
                    values.addAll(tokenValues);
                    if (tok.next() == null || !tok.next().is("=")) {
                        implicitValues.addAll(tokenValues);
                    }
                }
                tok = tok.next();
            }
            for (Long implicit : implicitValues) {
                if (Collections.frequency(values, implicit) != 1) {
                    report(sink, scope.bodyStart());
                }
            }
        }
    }

    private static boolean isEnumerator(Token tok, Scope scope) {
        return tok.isName() && tok.hasValues() && tok.valueType() != null
                && tok.valueType().typeScope() == scope.index();
    }
}
