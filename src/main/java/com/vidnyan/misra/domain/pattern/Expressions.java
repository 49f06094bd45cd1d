package com.vidnyan.misra.domain.pattern;

import com.vidnyan.misra.domain.model.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Recurring AST shapes shared by the rules.
 */
public final class Expressions {

    public static final Set<String> KEYWORDS = Set.of(
            "auto", "break", "case", "char", "const", "continue", "default", "do", "double",
            "else", "enum", "extern", "float", "for", "goto", "if", "int", "long", "register",
            "return", "short", "signed", "sizeof", "static", "struct", "switch", "typedef",
            "union", "unsigned", "void", "volatile", "while");

    /** Operators whose result is a composite expression. */
    public static final Set<String> COMPOSITE_OPERATORS =
            Set.of("+", "-", "*", "/", "%", "&", "|", "^", ">>", "<<", "?", ":", "~");

    private static final Set<String> BOOL_TOKENS =
            Set.of("!", "==", "!=", "<", "<=", ">", ">=", "&&", "||", "0", "1", "true", "false");

    private Expressions() {
    }

    /**
     * C-style cast: a {@code (} with only a first operand that is not an empty call.
     */
    public static boolean isCast(Token expr) {
        if (expr == null || !expr.is("(") || expr.astOperand1() == null || expr.astOperand2() != null) {
            return false;
        }
        return !TokenPatterns.simpleMatch(expr, "( )");
    }

    /**
     * Call whose callee name directly precedes the parenthesis and is not a keyword.
     */
    public static boolean isFunctionCall(Token expr) {
        if (expr == null || !expr.is("(") || expr.astOperand1() == null) {
            return false;
        }
        if (expr.astOperand1() != expr.previous()) {
            return false;
        }
        return !KEYWORDS.contains(expr.astOperand1().str());
    }

    public static boolean isCallTo(Token expr, Set<String> names) {
        return isFunctionCall(expr) && names.contains(expr.astOperand1().str());
    }

    /**
     * Arguments of a call, flattening the comma tree under the second operand.
     */
    public static List<Token> arguments(Token call) {
        List<Token> arguments = new ArrayList<>();
        collectArguments(call.astOperand2(), arguments);
        return arguments;
    }

    private static void collectArguments(Token tok, List<Token> arguments) {
        if (tok == null) {
            return;
        }
        if (tok.is(",")) {
            collectArguments(tok.astOperand1(), arguments);
            collectArguments(tok.astOperand2(), arguments);
        } else {
            arguments.add(tok);
        }
    }

    /**
     * True when the subtree assigns or increments. Designated initializers
     * and member-only chains are not counted. Function calls are not inspected.
     */
    public static boolean hasSideEffects(Token expr) {
        if (expr == null) {
            return false;
        }
        Token lhs = expr.astOperand1();
        if (expr.is("=") && lhs != null && lhs.is("[")) {
            Token prev = lhs.previous();
            if (prev != null && prev.is("{")) {
                return hasSideEffects(expr.astOperand2());
            }
        }
        if (expr.is("=") && lhs != null && lhs.is(".")) {
            Token e = lhs;
            while (e != null && e.is(".") && e.astOperand2() != null) {
                e = e.astOperand1();
            }
            if (e != null && e.is(".")) {
                return false;
            }
        }
        if (expr.is("++") || expr.is("--") || expr.is("=")) {
            return true;
        }
        return hasSideEffects(expr.astOperand1()) || hasSideEffects(expr.astOperand2());
    }

    /**
     * Number of {@code ++ -- =} in the subtree, not descending into {@code ,} or {@code ;}.
     */
    public static int countSideEffects(Token expr) {
        if (expr == null || expr.is(",") || expr.is(";")) {
            return 0;
        }
        int count = expr.is("++") || expr.is("--") || expr.is("=") ? 1 : 0;
        return count + countSideEffects(expr.astOperand1()) + countSideEffects(expr.astOperand2());
    }

    public static boolean isBoolExpression(Token expr) {
        if (expr == null) {
            return false;
        }
        if (expr.valueType() != null && ("bool".equals(expr.valueType().type()) || expr.valueType().bits() == 1)) {
            return true;
        }
        return BOOL_TOKENS.contains(expr.str());
    }

    public static boolean isConstantExpression(Token expr) {
        if (expr.isNumber()) {
            return true;
        }
        if (expr.isName()) {
            return false;
        }
        if (TokenPatterns.simpleMatch(expr.previous(), "sizeof (")) {
            return true;
        }
        if (expr.astOperand1() != null && !isConstantExpression(expr.astOperand1())) {
            return false;
        }
        return expr.astOperand2() == null || isConstantExpression(expr.astOperand2());
    }

    /**
     * Literal with a {@code u}/{@code U} suffix, or arithmetic involving one.
     */
    public static boolean isUnsignedInt(Token expr) {
        if (expr == null) {
            return false;
        }
        if (expr.isNumber()) {
            return expr.str().contains("u") || expr.str().contains("U");
        }
        if (Set.of("+", "-", "*", "/", "%").contains(expr.str())) {
            return isUnsignedInt(expr.astOperand1()) || isUnsignedInt(expr.astOperand2());
        }
        return false;
    }

    /**
     * Topmost ancestor of {@code token} below a {@code ,} or {@code ;}.
     */
    public static Token expressionTop(Token token) {
        Set<Token> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Token top = token;
        while (seen.add(top) && top.astParent() != null && !top.astParent().is(",") && !top.astParent().is(";")) {
            top = top.astParent();
        }
        return top;
    }
}
