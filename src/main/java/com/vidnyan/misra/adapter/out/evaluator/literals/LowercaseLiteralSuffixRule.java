package com.vidnyan.misra.adapter.out.evaluator.literals;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.RawTokenRule;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Rule 7.3: the lowercase character {@code l} shall not be used in a literal suffix.
 */
public class LowercaseLiteralSuffixRule extends RawTokenRule {

    private static final Pattern LOWERCASE_L = Pattern.compile("^[0-9.uU]+l");

    public LowercaseLiteralSuffixRule() {
        super(7, 3);
    }

    @Override
    protected void evaluate(List<Token> rawTokens, DiagnosticsSink sink) {
        for (Token token : rawTokens) {
            if (LOWERCASE_L.matcher(token.str()).lookingAt()) {
                report(sink, token);
            }
        }
    }
}
