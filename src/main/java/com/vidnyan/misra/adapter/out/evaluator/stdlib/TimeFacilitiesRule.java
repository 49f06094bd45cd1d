package com.vidnyan.misra.adapter.out.evaluator.stdlib;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.TokenPatterns;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

/**
 * Rule 21.10: the standard library time and date functions shall not be used.
 * Flags the {@code <time.h>} include and calls to {@code wcsftime}.
 */
public class TimeFacilitiesRule extends AbstractRule {

    public TimeFacilitiesRule() {
        super(21, 10);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        Includes.find(context.configuration(), "<time.h>").ifPresent(d -> report(sink, d));
        for (Token token : context.configuration().tokens()) {
            if (TokenPatterns.simpleMatch(token, "wcsftime (")) {
                report(sink, token);
            }
        }
    }
}
