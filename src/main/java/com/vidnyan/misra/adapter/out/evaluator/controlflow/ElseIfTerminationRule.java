package com.vidnyan.misra.adapter.out.evaluator.controlflow;

import com.vidnyan.misra.domain.model.Scope;
import com.vidnyan.misra.domain.model.ScopeType;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.TokenPatterns;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

/**
 * Rule 15.7: all {@code if ... else if} constructs shall be terminated with an
 * {@code else} statement.
 *
 * <p>The analyzer wraps an {@code else if} in a synthetic else-block whose
 * opening brace has column 0; only those blocks are inspected.
 */
public class ElseIfTerminationRule extends AbstractRule {

    public ElseIfTerminationRule() {
        super(15, 7);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        for (Scope scope : context.configuration().scopes()) {
            if (!scope.is(ScopeType.ELSE)) {
                continue;
            }
            Token start = scope.bodyStart();
            if (!TokenPatterns.simpleMatch(start, "{ if (") || start.column() > 0) {
                continue;
            }
            Token tok = TokenPatterns.link(start.next().next());
            if (!TokenPatterns.simpleMatch(tok, ") {")) {
                continue;
            }
            tok = TokenPatterns.link(tok.next());
            if (tok != null && !TokenPatterns.simpleMatch(tok, "} else")) {
                report(sink, tok);
            }
        }
    }
}
