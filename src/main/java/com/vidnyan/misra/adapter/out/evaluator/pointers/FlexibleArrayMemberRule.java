package com.vidnyan.misra.adapter.out.evaluator.pointers;

import com.vidnyan.misra.domain.model.Scope;
import com.vidnyan.misra.domain.model.ScopeType;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.TokenPatterns;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

/**
 * Rule 18.7: flexible array members shall not be declared.
 * At most one report per struct; nested struct bodies are skipped.
 */
public class FlexibleArrayMemberRule extends AbstractRule {

    public FlexibleArrayMemberRule() {
        super(18, 7);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        for (Scope scope : context.configuration().scopes()) {
            if (!scope.is(ScopeType.STRUCT) || scope.bodyStart() == null) {
                continue;
            }
            Token tok = scope.bodyStart().next();
            while (tok != null && tok != scope.bodyEnd()) {
                if (tok.is("{")) {
                    tok = TokenPatterns.link(tok);
                    if (tok == null) {
                        break;
                    }
                }
                if (TokenPatterns.simpleMatch(tok, "[ ]")) {
                    report(sink, tok);
                    break;
                }
                tok = tok.next();
            }
        }
    }
}
