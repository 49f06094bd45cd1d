package com.vidnyan.misra.adapter.out.evaluator.controlflow;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.TokenPatterns;

import java.util.ArrayList;
import java.util.List;

/**
 * Loop shapes shared by the iteration rules.
 */
final class Loops {

    private Loops() {
    }

    /**
     * The three clauses of a {@code for} header, or null when the header is not
     * the canonical {@code ( ; ; )} AST. Individual clauses may be null.
     */
    record ForClauses(Token init, Token condition, Token step) {
    }

    static ForClauses forClauses(Token forToken) {
        if (forToken == null || !forToken.is("for")) {
            return null;
        }
        Token lpar = forToken.next();
        if (lpar == null || !lpar.is("(")) {
            return null;
        }
        Token first = lpar.astOperand2();
        if (first == null || !first.is(";")) {
            return null;
        }
        Token second = first.astOperand2();
        if (second == null || !second.is(";")) {
            return null;
        }
        return new ForClauses(first.astOperand1(), second.astOperand1(), second.astOperand2());
    }

    /**
     * Name operands of the arithmetic and comparison operators of a loop condition.
     */
    static List<Token> counterTokens(Token condition) {
        List<Token> counters = new ArrayList<>();
        collectCounters(condition, counters);
        return counters;
    }

    private static void collectCounters(Token cond, List<Token> counters) {
        if (cond == null) {
            return;
        }
        if (cond.is("&&") || cond.is("||")) {
            collectCounters(cond.astOperand1(), counters);
            collectCounters(cond.astOperand2(), counters);
            return;
        }
        Token op1 = cond.astOperand1();
        Token op2 = cond.astOperand2();
        if ((!cond.isArithmeticalOp() && !cond.isComparisonOp()) || op1 == null || op2 == null) {
            return;
        }
        if (op1.isName()) {
            counters.add(op1);
        }
        if (op2.isName()) {
            counters.add(op2);
        }
        if (op1.isOp()) {
            collectCounters(op1, counters);
        }
        if (op2.isOp()) {
            collectCounters(op2, counters);
        }
    }

    static boolean isFloat(Token token) {
        return token.valueType() != null && token.valueType().isFloat();
    }

    /**
     * True when a floating-point counter of a {@code while} or
     * {@code do ... while} condition is assigned or stepped in the loop body.
     */
    static boolean hasFloatCounterInWhileLoop(Token whileToken) {
        if (!TokenPatterns.simpleMatch(whileToken, "while (")) {
            return false;
        }
        Token lpar = whileToken.next();
        Token rpar = TokenPatterns.link(lpar);
        List<Token> counters = counterTokens(lpar.astOperand2()).stream().filter(Loops::isFloat).toList();
        if (counters.isEmpty()) {
            return false;
        }

        Token bodyStart;
        if (TokenPatterns.simpleMatch(rpar, ") {")) {
            bodyStart = rpar.next();
        } else if (TokenPatterns.simpleMatch(whileToken.previous(), "} while")
                && TokenPatterns.simpleMatch(previousOfLink(whileToken.previous()), "do {")) {
            bodyStart = TokenPatterns.link(whileToken.previous());
        } else {
            return false;
        }

        Token bodyEnd = TokenPatterns.link(bodyStart);
        Token tok = bodyStart;
        while (tok != null && tok != bodyEnd) {
            tok = tok.next();
            if (tok == null) {
                break;
            }
            for (Token counter : counters) {
                if (tok.isAssignmentOp() && tok.astOperand1() != null && tok.astOperand1().is(counter.str())) {
                    return true;
                }
                Token parent = tok.astParent();
                if (tok.is(counter.str()) && parent != null && (parent.is("++") || parent.is("--"))) {
                    return true;
                }
            }
        }
        return false;
    }

    private static Token previousOfLink(Token closing) {
        Token open = TokenPatterns.link(closing);
        return open == null ? null : open.previous();
    }
}
