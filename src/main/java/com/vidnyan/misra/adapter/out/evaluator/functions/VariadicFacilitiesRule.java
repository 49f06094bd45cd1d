package com.vidnyan.misra.adapter.out.evaluator.functions;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

import java.util.Set;

/**
 * Rule 17.1: the features of {@code <stdarg.h>} shall not be used.
 */
public class VariadicFacilitiesRule extends TokenRule {

    private static final Set<String> STDARG = Set.of("va_list", "va_arg", "va_start", "va_end", "va_copy");

    public VariadicFacilitiesRule() {
        super(17, 1);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        return Expressions.isCallTo(token, STDARG) || token.is("va_list");
    }
}
