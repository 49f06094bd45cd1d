package com.vidnyan.misra.domain.pattern;

import com.vidnyan.misra.domain.model.Token;

/**
 * Structural matching over token streams.
 */
public final class TokenPatterns {

    private static final String OPENING = "{([";
    private static final String CLOSING = "})]";

    private TokenPatterns() {
    }

    /**
     * Match a run of tokens against a space-delimited list of literal token texts.
     * Stops at the first mismatch; a stream that ends early does not match.
     */
    public static boolean simpleMatch(Token token, String pattern) {
        Token current = token;
        for (String expected : pattern.split(" ")) {
            if (current == null || !current.is(expected)) {
                return false;
            }
            current = current.next();
        }
        return true;
    }

    /**
     * Matching bracket of {@code token}. Uses the analyzer's link when present,
     * otherwise counts nesting depth in the flat stream.
     */
    public static Token link(Token token) {
        if (token == null) {
            return null;
        }
        Token link = token.link();
        return link != null ? link : findRawLink(token);
    }

    /**
     * Matching bracket found by counting nesting depth of the same bracket kind,
     * forward from an opening bracket or backward from a closing one.
     * Returns null when {@code token} is not a bracket or is unbalanced.
     */
    public static Token findRawLink(Token token) {
        if (token == null || token.str().length() != 1) {
            return null;
        }
        char c = token.str().charAt(0);
        int open = OPENING.indexOf(c);
        int close = CLOSING.indexOf(c);
        String same;
        String matching;
        boolean forward;
        if (open >= 0) {
            same = token.str();
            matching = String.valueOf(CLOSING.charAt(open));
            forward = true;
        } else if (close >= 0) {
            same = token.str();
            matching = String.valueOf(OPENING.charAt(close));
            forward = false;
        } else {
            return null;
        }

        int depth = 0;
        Token current = token;
        while (current != null) {
            if (current.is(same)) {
                depth++;
            } else if (current.is(matching)) {
                if (depth <= 1) {
                    return current;
                }
                depth--;
            }
            current = forward ? current.next() : current.previous();
        }
        return null;
    }

    /**
     * True when walking forward from {@code from} reaches {@code to} without
     * passing a parenthesis. Used to tell an implicit grouping from an explicit one.
     */
    public static boolean hasNoParenthesesBetween(Token from, Token to) {
        Token current = from;
        while (current != null && current != to) {
            if (current.is("(") || current.is(")")) {
                return false;
            }
            current = current.next();
        }
        return current != null && current == to;
    }

    /**
     * First non-comment token before {@code token}.
     */
    public static Token previousCode(Token token) {
        Token current = token == null ? null : token.previous();
        while (current != null && current.isComment()) {
            current = current.previous();
        }
        return current;
    }
}
