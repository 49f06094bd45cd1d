package com.vidnyan.misra.adapter.out.evaluator.stdlib;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

import java.util.Set;
import java.util.TreeSet;

/**
 * Reports calls to library functions a rule bans, e.g. the dynamic memory
 * functions of {@code <stdlib.h>} (21.3). The call parenthesis is reported.
 */
public class ForbiddenFunctionCallRule extends TokenRule {

    private final Set<String> functions;

    public ForbiddenFunctionCallRule(int major, int minor, String... functions) {
        super(major, minor);
        this.functions = Set.of(functions);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        return Expressions.isCallTo(token, functions);
    }

    @Override
    public String getName() {
        return "ForbiddenFunctionCallRule" + new TreeSet<>(functions);
    }
}
