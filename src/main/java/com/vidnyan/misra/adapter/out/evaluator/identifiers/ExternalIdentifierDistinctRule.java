package com.vidnyan.misra.adapter.out.evaluator.identifiers;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.Variable;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rule 5.1: external identifiers shall be distinct.
 * Every declaration after the first one sharing a 31-character prefix is reported.
 */
public class ExternalIdentifierDistinctRule extends AbstractRule {

    public ExternalIdentifierDistinctRule() {
        super(5, 1);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        Map<String, List<Token>> byPrefix = new LinkedHashMap<>();
        for (Variable variable : context.configuration().variables()) {
            Token name = variable.nameToken();
            if (name == null || name.str().length() <= SignificantNames.C90_LENGTH) {
                continue;
            }
            if (!variable.hasExternalLinkage()) {
                continue;
            }
            byPrefix.computeIfAbsent(SignificantNames.prefix(name.str(), SignificantNames.C90_LENGTH),
                    k -> new ArrayList<>()).add(name);
        }
        for (List<Token> names : byPrefix.values()) {
            if (names.size() < 2) {
                continue;
            }
            names.stream()
                    .sorted(Comparator.comparingInt(Token::line).thenComparingInt(Token::column))
                    .skip(1)
                    .forEach(name -> report(sink, name));
        }
    }
}
