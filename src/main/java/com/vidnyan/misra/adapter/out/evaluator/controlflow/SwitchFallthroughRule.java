package com.vidnyan.misra.adapter.out.evaluator.controlflow;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.TokenPatterns;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.RawTokenRule;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Rule 16.3: an unconditional {@code break} statement shall terminate every switch-clause.
 *
 * <p>A {@code case} or {@code default} label is accepted only after a
 * terminated {@code break}/{@code return}/{@code throw}, a fallthrough
 * comment or attribute, or an opening brace. The closing brace of an
 * unconditional block keeps that state; any other closing brace resets it.
 * A last clause ending in a plain statement is reported at the switch's
 * closing brace.
 */
public class SwitchFallthroughRule extends RawTokenRule {

    private static final Set<String> STATEMENT_TERMINATORS = Set.of(":", ";", "{", "}");

    private enum State {
        /** Inside a clause that has not been terminated. */
        NONE,
        /** Saw a jump statement, waiting for its {@code ;}. */
        BREAK_SEEN,
        /** A label may follow. */
        OK,
        /** Between {@code switch} and its opening brace. */
        IN_SWITCH
    }

    public SwitchFallthroughRule() {
        super(16, 3);
    }

    @Override
    protected void evaluate(List<Token> rawTokens, DiagnosticsSink sink) {
        State state = State.NONE;
        Token switchEnd = null;
        for (Token token : rawTokens) {
            if (token.is("switch")) {
                state = State.IN_SWITCH;
            }
            if (state == State.IN_SWITCH) {
                if (!token.is("{")) {
                    continue;
                }
                switchEnd = TokenPatterns.findRawLink(token);
            }

            if (token.is("break") || token.is("return") || token.is("throw")) {
                state = State.BREAK_SEEN;
            } else if (token.is(";")) {
                if (state == State.BREAK_SEEN) {
                    state = State.OK;
                } else if (token.next() != null && token.next() == switchEnd) {
                    report(sink, token.next());
                } else {
                    state = State.NONE;
                }
            } else if (token.isComment()) {
                if (token.str().toLowerCase(Locale.ROOT).contains("fallthrough")) {
                    state = State.OK;
                }
            } else if (TokenPatterns.simpleMatch(token, "[ [ fallthrough ] ] ;")) {
                state = State.BREAK_SEEN;
            } else if (token.is("{")) {
                state = State.OK;
            } else if (token.is("}") && state == State.OK) {
                if (!closesUnconditionalBlock(token)) {
                    state = State.NONE;
                }
            } else if (token.is("case") || token.is("default")) {
                if (state != State.OK) {
                    report(sink, token);
                }
                state = State.OK;
            }
        }
    }

    /**
     * True when the block opened right after a statement or label, i.e. it is
     * not the body of an {@code if}, loop or similar.
     */
    private static boolean closesUnconditionalBlock(Token closingBrace) {
        Token open = TokenPatterns.findRawLink(closingBrace);
        if (open == null) {
            return false;
        }
        Token prev = TokenPatterns.previousCode(open);
        return prev != null && STATEMENT_TERMINATORS.contains(prev.str());
    }
}
