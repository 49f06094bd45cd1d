package com.vidnyan.misra.adapter.out.evaluator.stdlib;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

import java.util.Set;

/**
 * Rule 21.12: the exception handling features of {@code <fenv.h>} should not be used.
 * Only checked in configurations that include the header.
 */
public class FloatingPointExceptionRule extends AbstractRule {

    private static final Set<String> EXCEPTION_FUNCTIONS = Set.of(
            "feclearexcept", "fegetexceptflag", "feraiseexcept", "fesetexceptflag", "fetestexcept");

    public FloatingPointExceptionRule() {
        super(21, 12);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        if (Includes.find(context.configuration(), "<fenv.h>").isEmpty()) {
            return;
        }
        for (Token token : context.configuration().tokens()) {
            if (token.is("fexcept_t") || Expressions.isCallTo(token, EXCEPTION_FUNCTIONS)) {
                report(sink, token);
            }
        }
    }
}
