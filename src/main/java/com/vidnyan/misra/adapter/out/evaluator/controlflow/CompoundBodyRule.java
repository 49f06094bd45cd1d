package com.vidnyan.misra.adapter.out.evaluator.controlflow;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.TokenPatterns;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.RawTokenRule;

import java.util.List;

/**
 * Rule 15.6: the body of an iteration-statement or a selection-statement
 * shall be a compound-statement.
 *
 * <p>After {@code if}, {@code for} or {@code while} the scanner tracks the
 * parenthesized header; the first code token after it, or after {@code else},
 * must be an opening brace. Preprocessor {@code # if}/{@code # else} and the
 * {@code while} of a do-loop are ignored.
 */
public class CompoundBodyRule extends RawTokenRule {

    private enum State {
        IDLE,
        IN_HEADER,
        EXPECT_BODY
    }

    public CompoundBodyRule() {
        super(15, 6);
    }

    @Override
    protected void evaluate(List<Token> rawTokens, DiagnosticsSink sink) {
        State state = State.IDLE;
        int depth = 0;
        Token statement = null;
        for (Token token : rawTokens) {
            if (token.is("if") || token.is("for") || token.is("while")) {
                if (TokenPatterns.simpleMatch(token.previous(), "# if")) {
                    continue;
                }
                if (isDoWhile(token)) {
                    continue;
                }
                if (state == State.EXPECT_BODY) {
                    report(sink, statement);
                }
                state = State.IN_HEADER;
                depth = 0;
                statement = token;
            } else if (token.is("else")) {
                if (TokenPatterns.simpleMatch(token.previous(), "# else") || TokenPatterns.simpleMatch(token, "else if")) {
                    continue;
                }
                if (state == State.EXPECT_BODY) {
                    report(sink, statement);
                }
                state = State.EXPECT_BODY;
                depth = 0;
                statement = token;
            } else if (state == State.IN_HEADER) {
                if (depth == 0 && !token.is("(")) {
                    state = State.IDLE;
                    continue;
                }
                if (token.is("(")) {
                    depth++;
                } else if (token.is(")")) {
                    if (depth == 0) {
                        state = State.IDLE;
                    } else if (depth == 1) {
                        state = State.EXPECT_BODY;
                    }
                    depth--;
                }
            } else if (state == State.EXPECT_BODY) {
                if (token.isComment()) {
                    continue;
                }
                state = State.IDLE;
                if (!token.is("{")) {
                    report(sink, statement);
                }
            }
        }
    }

    private static boolean isDoWhile(Token whileToken) {
        if (!whileToken.is("while") || !TokenPatterns.simpleMatch(whileToken.previous(), "} while")) {
            return false;
        }
        Token start = TokenPatterns.findRawLink(whileToken.previous());
        return start != null && TokenPatterns.simpleMatch(start.previous(), "do {");
    }
}
