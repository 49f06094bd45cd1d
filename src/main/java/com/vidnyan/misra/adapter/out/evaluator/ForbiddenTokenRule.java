package com.vidnyan.misra.adapter.out.evaluator;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.RuleScope;

import java.util.List;

/**
 * Reports every occurrence of a keyword the rule bans outright,
 * such as {@code goto}, {@code union} or {@code restrict}.
 */
public class ForbiddenTokenRule extends AbstractRule {

    private final String keyword;
    private final RuleScope scope;

    public ForbiddenTokenRule(int major, int minor, String keyword, RuleScope scope) {
        super(major, minor);
        this.keyword = keyword;
        this.scope = scope;
    }

    @Override
    public RuleScope scope() {
        return scope;
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        List<Token> tokens = scope == RuleScope.RAW_TOKENS
                ? context.rawTokens().tokens()
                : context.configuration().tokens();
        for (Token token : tokens) {
            if (token.is(keyword)) {
                report(sink, token);
            }
        }
    }

    @Override
    public String getName() {
        return "ForbiddenTokenRule(" + keyword + ")";
    }
}
