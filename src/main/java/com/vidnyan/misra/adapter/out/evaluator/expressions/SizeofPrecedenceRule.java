package com.vidnyan.misra.adapter.out.evaluator.expressions;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.RawTokenRule;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rule 12.1 for {@code sizeof x + y}: an unparenthesized sizeof operand
 * followed by an arithmetic operator.
 */
public class SizeofPrecedenceRule extends RawTokenRule {

    private static final Pattern IDENTIFIER_START = Pattern.compile("^[a-zA-Z_]");
    private static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/", "%");

    private enum State {
        IDLE,
        AFTER_SIZEOF,
        AFTER_OPERAND
    }

    public SizeofPrecedenceRule() {
        super(12, 1);
    }

    @Override
    protected void evaluate(List<Token> rawTokens, DiagnosticsSink sink) {
        State state = State.IDLE;
        for (Token tok : rawTokens) {
            if (tok.isComment()) {
                continue;
            }
            if (tok.is("sizeof")) {
                state = State.AFTER_SIZEOF;
            } else if (state == State.AFTER_SIZEOF) {
                state = IDENTIFIER_START.matcher(tok.str()).lookingAt() ? State.AFTER_OPERAND : State.IDLE;
            } else if (state == State.AFTER_OPERAND) {
                if (ARITHMETIC.contains(tok.str())) {
                    report(sink, tok);
                } else {
                    state = State.IDLE;
                }
            }
        }
    }
}
