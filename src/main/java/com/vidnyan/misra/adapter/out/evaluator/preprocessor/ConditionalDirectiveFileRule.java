package com.vidnyan.misra.adapter.out.evaluator.preprocessor;

import com.vidnyan.misra.domain.model.Directive;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Rule 20.14: all {@code #else}, {@code #elif} and {@code #endif} directives
 * shall reside in the same file as the {@code #if}, {@code #ifdef} or
 * {@code #ifndef} directive to which they are related.
 */
public class ConditionalDirectiveFileRule extends AbstractRule {

    public ConditionalDirectiveFileRule() {
        super(20, 14);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        Deque<Directive> open = new ArrayDeque<>();
        for (Directive directive : context.configuration().directives()) {
            String str = directive.str();
            if (str.startsWith("#if ") || str.startsWith("#ifdef ") || str.startsWith("#ifndef ")) {
                open.push(directive);
            } else if (str.equals("#else") || str.startsWith("#elif ")) {
                if (open.isEmpty()) {
                    report(sink, directive);
                    open.push(directive);
                } else if (!sameFile(directive, open.peek())) {
                    report(sink, directive);
                }
            } else if (str.equals("#endif")) {
                if (open.isEmpty()) {
                    report(sink, directive);
                    continue;
                }
                if (!sameFile(directive, open.peek())) {
                    report(sink, directive);
                }
                open.pop();
            }
        }
    }

    private static boolean sameFile(Directive a, Directive b) {
        return Objects.equals(a.file(), b.file());
    }
}
