package com.vidnyan.misra.adapter.out.evaluator.identifiers;

import com.vidnyan.misra.domain.model.Directive;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule 5.4: macro identifiers shall be distinct.
 *
 * <p>Covers distinct macro names, distinct parameter names within one macro and
 * parameters that clash with a macro name.
 */
public class MacroIdentifierDistinctRule extends AbstractRule {

    public MacroIdentifierDistinctRule() {
        super(5, 4);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        int length = context.standard().significantNameLength();
        Map<String, Directive> firstByPrefix = new HashMap<>();
        Map<Directive, String> fullNames = new HashMap<>();
        List<Directive> functionLike = new ArrayList<>();

        for (Directive directive : context.configuration().directives()) {
            String name = SignificantNames.macroName(directive);
            if (name == null) {
                continue;
            }
            fullNames.put(directive, name);
            String prefix = SignificantNames.prefix(name, length);
            Directive first = firstByPrefix.get(prefix);
            if (first == null) {
                firstByPrefix.put(prefix, directive);
            } else if (!name.equals(fullNames.get(first))) {
                report(sink, directive);
            }
            if (!SignificantNames.macroParameters(directive).isEmpty()) {
                functionLike.add(directive);
            }
        }

        for (Directive macro : functionLike) {
            List<String> params = SignificantNames.macroParameters(macro);
            for (int i = 0; i < params.size(); i++) {
                String param = SignificantNames.prefix(params.get(i), length);
                for (int j = i + 1; j < params.size(); j++) {
                    if (param.equals(SignificantNames.prefix(params.get(j), length))) {
                        report(sink, macro);
                    }
                }
                Directive clash = firstByPrefix.get(param);
                if (clash != null) {
                    report(sink, clash.line() > macro.line() ? clash : macro);
                }
            }
        }
    }
}
