package com.vidnyan.misra.adapter.out.evaluator.literals;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.RawTokenRule;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Rule 7.1: octal constants shall not be used.
 */
public class OctalConstantRule extends RawTokenRule {

    private static final Pattern OCTAL = Pattern.compile("^0[0-7]+$");

    public OctalConstantRule() {
        super(7, 1);
    }

    @Override
    protected void evaluate(List<Token> rawTokens, DiagnosticsSink sink) {
        for (Token token : rawTokens) {
            if (OCTAL.matcher(token.str()).matches()) {
                report(sink, token);
            }
        }
    }
}
