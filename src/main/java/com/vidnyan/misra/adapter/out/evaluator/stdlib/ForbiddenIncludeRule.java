package com.vidnyan.misra.adapter.out.evaluator.stdlib;

import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

import java.util.List;

/**
 * Reports the inclusion of standard headers a rule bans, such as
 * {@code <setjmp.h>} (21.4) or {@code <stdio.h>} (21.6).
 */
public class ForbiddenIncludeRule extends AbstractRule {

    private final List<String> headers;

    public ForbiddenIncludeRule(int major, int minor, String... headers) {
        super(major, minor);
        this.headers = List.of(headers);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        for (String header : headers) {
            Includes.find(context.configuration(), header).ifPresent(d -> report(sink, d));
        }
    }

    @Override
    public String getName() {
        return "ForbiddenIncludeRule" + headers;
    }
}
