package com.vidnyan.misra.adapter.out.evaluator.lexical;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.RawTokenRule;

import java.util.List;

/**
 * Rule 4.2: trigraphs should not be used.
 */
public class TrigraphRule extends RawTokenRule {

    private static final List<String> TRIGRAPHS =
            List.of("??=", "??(", "??/", "??)", "??'", "??<", "??!", "??>", "??-");

    public TrigraphRule() {
        super(4, 2);
    }

    @Override
    protected void evaluate(List<Token> rawTokens, DiagnosticsSink sink) {
        for (Token token : rawTokens) {
            String str = token.str();
            if (str.length() < 2 || !str.startsWith("\"") || !str.endsWith("\"")) {
                continue;
            }
            String body = str.substring(1, str.length() - 1);
            if (TRIGRAPHS.stream().anyMatch(body::contains)) {
                report(sink, token);
            }
        }
    }
}
