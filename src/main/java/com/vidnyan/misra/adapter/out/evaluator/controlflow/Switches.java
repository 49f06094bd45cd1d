package com.vidnyan.misra.adapter.out.evaluator.controlflow;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.TokenPatterns;

/**
 * Switch statement navigation.
 */
final class Switches {

    private Switches() {
    }

    /**
     * Opening brace of the body of {@code switch ( ... ) {}}, null for any other token.
     */
    static Token body(Token switchToken) {
        if (!TokenPatterns.simpleMatch(switchToken, "switch (")) {
            return null;
        }
        Token rpar = TokenPatterns.link(switchToken.next());
        if (!TokenPatterns.simpleMatch(rpar, ") {")) {
            return null;
        }
        return rpar.next();
    }

    /**
     * True for a block ending in {@code break ;}, or in a {@code return} or
     * {@code throw} statement.
     */
    static boolean isNoReturnScope(Token closingBrace) {
        if (closingBrace == null || !closingBrace.is("}")) {
            return false;
        }
        Token semicolon = closingBrace.previous();
        if (semicolon == null || !semicolon.is(";")) {
            return false;
        }
        if (TokenPatterns.simpleMatch(semicolon.previous(), "break ;")) {
            return true;
        }
        Token prev = semicolon.previous();
        while (prev != null && !prev.is(";") && !prev.is("{") && !prev.is("}")) {
            if (prev.is("]") || prev.is(")")) {
                prev = TokenPatterns.link(prev);
                if (prev == null) {
                    return false;
                }
            }
            prev = prev.previous();
        }
        if (prev == null || prev.next() == null) {
            return false;
        }
        Token first = prev.next();
        return first.is("throw") || first.is("return");
    }
}
