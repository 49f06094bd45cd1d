package com.vidnyan.misra.domain.pattern;

import com.vidnyan.misra.domain.model.Token;

/**
 * C operator precedence buckets for binary, ternary and assignment operators.
 * Higher binds tighter.
 */
public final class OperatorPrecedence {

    public static final int ATOM = 16;
    public static final int MULTIPLICATIVE = 12;
    public static final int ADDITIVE = 11;
    public static final int SHIFT = 10;
    public static final int RELATIONAL = 9;
    public static final int EQUALITY = 8;
    public static final int BITWISE_AND = 7;
    public static final int BITWISE_XOR = 6;
    public static final int BITWISE_OR = 5;
    public static final int LOGICAL_AND = 4;
    public static final int LOGICAL_OR = 3;
    public static final int CONDITIONAL = 2;
    public static final int ASSIGNMENT = 1;
    public static final int COMMA = 0;
    public static final int UNKNOWN = -1;

    private OperatorPrecedence() {
    }

    /**
     * Precedence of the operator at {@code expr}. Anything without two operands
     * is an atom.
     */
    public static int of(Token expr) {
        if (expr == null || expr.astOperand1() == null || expr.astOperand2() == null) {
            return ATOM;
        }
        return switch (expr.str()) {
            case "*", "/", "%" -> MULTIPLICATIVE;
            case "+", "-" -> ADDITIVE;
            case "<<", ">>" -> SHIFT;
            case "<", ">", "<=", ">=" -> RELATIONAL;
            case "==", "!=" -> EQUALITY;
            case "&" -> BITWISE_AND;
            case "^" -> BITWISE_XOR;
            case "|" -> BITWISE_OR;
            case "&&" -> LOGICAL_AND;
            case "||" -> LOGICAL_OR;
            case "?", ":" -> CONDITIONAL;
            case "," -> COMMA;
            default -> expr.isAssignmentOp() ? ASSIGNMENT : UNKNOWN;
        };
    }

    public static boolean isArithmetic(int precedence) {
        return precedence == MULTIPLICATIVE || precedence == ADDITIVE;
    }
}
