package com.vidnyan.misra.domain.essential;

import com.vidnyan.misra.domain.model.Platform;
import com.vidnyan.misra.domain.model.Scope;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.ValueType;
import com.vidnyan.misra.domain.model.Variable;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Optional;
import java.util.Set;

/**
 * Essential type inference over AST expressions.
 *
 * <p>The inference is deliberately partial. Shifts take the category of the
 * left operand only, and mixed binary operands fall back to the computed sign
 * of the whole expression. Rules are calibrated against this behaviour.
 */
public final class EssentialTypes {

    private static final Set<String> BOOL_OPERATORS = Set.of("<", "<=", "==", "!=", ">=", ">", "&&", "||", "!");
    private static final Set<String> RANKED_OPERATORS =
            Set.of("+", "-", "*", "/", "%", "&", "|", "^", ">>", "<<", "?", ":");
    private static final Set<String> LEAF_TYPE_NAMES = Set.of("char", "short", "int", "long", "float", "double");
    private static final String SINGLE_CHAR_OPERATORS = "+-*/%&|^";

    private final Platform platform;

    public EssentialTypes(Platform platform) {
        this.platform = platform;
    }

    /**
     * Essential category of {@code expr}, empty when unknown.
     */
    public Optional<EssentialCategory> category(Token expr) {
        return Optional.ofNullable(categoryOf(expr, newPath()));
    }

    /**
     * Categories of two operands. Both are unknown when either operand is
     * missing, is an increment/decrement, or has pointer type.
     */
    public CategoryPair categories(Token operand1, Token operand2) {
        if (operand1 == null || operand2 == null) {
            return CategoryPair.UNKNOWN;
        }
        if (isIncDec(operand1) || isIncDec(operand2)) {
            return CategoryPair.UNKNOWN;
        }
        if (isPointer(operand1) || isPointer(operand2)) {
            return CategoryPair.UNKNOWN;
        }
        return new CategoryPair(categoryOf(operand1, newPath()), categoryOf(operand2, newPath()));
    }

    /**
     * Smallest standard rank able to hold the value of {@code expr}.
     */
    public Optional<EssentialRank> rank(Token expr) {
        return Optional.ofNullable(rankOf(expr, newPath()));
    }

    /**
     * Platform bit width of the essential rank of {@code expr}, 0 when unknown.
     */
    public int bitsOf(Token expr) {
        return rank(expr).map(this::bitsOfRank).orElse(0);
    }

    public int bitsOfRank(EssentialRank rank) {
        return switch (rank) {
            case CHAR -> platform.charBit();
            case SHORT -> platform.shortBit();
            case INT -> platform.intBit();
            case LONG -> platform.longBit();
            case LONG_LONG -> platform.longLongBit();
            default -> 0;
        };
    }

    private EssentialCategory categoryOf(Token expr, Set<Token> path) {
        if (expr == null || !path.add(expr)) {
            return null;
        }
        try {
            return categoryOnPath(expr, path);
        } finally {
            path.remove(expr);
        }
    }

    private EssentialCategory categoryOnPath(Token expr, Set<Token> path) {
        if (expr.is(",")) {
            return categoryOf(expr.astOperand2(), path);
        }
        if (BOOL_OPERATORS.contains(expr.str())) {
            return EssentialCategory.BOOL;
        }
        if (expr.is("<<") || expr.is(">>")) {
            return categoryOf(expr.astOperand1(), path);
        }
        ValueType vt = expr.valueType();
        if (expr.str().length() == 1 && SINGLE_CHAR_OPERATORS.contains(expr.str())) {
            EssentialCategory e1 = categoryOf(expr.astOperand1(), path);
            EssentialCategory e2 = categoryOf(expr.astOperand2(), path);
            if (e1 != null && e1.equals(e2)) {
                return e1;
            }
            if (vt != null) {
                return EssentialCategory.fromSign(vt.sign());
            }
        }
        Scope typeScope = expr.valueTypeScope();
        if (typeScope != null) {
            return EssentialCategory.enumOf(typeScope.className());
        }
        Variable variable = expr.variable();
        if (variable != null) {
            EssentialCategory declared = declaredCategory(variable);
            if (declared != null) {
                return declared;
            }
        }
        return vt == null ? null : EssentialCategory.fromSign(vt.sign());
    }

    private EssentialCategory declaredCategory(Variable variable) {
        Token end = variable.typeEndToken();
        for (Token tok = variable.typeStartToken(); tok != null; tok = tok.next()) {
            ValueType vt = tok.valueType();
            if (vt != null) {
                if ("bool".equals(vt.type())) {
                    return EssentialCategory.BOOL;
                }
                if (vt.isFloat()) {
                    return EssentialCategory.FLOAT;
                }
                if (vt.sign() != null) {
                    return EssentialCategory.fromSign(vt.sign());
                }
            }
            if (tok == end) {
                break;
            }
        }
        return null;
    }

    private EssentialRank rankOf(Token expr, Set<Token> path) {
        if (expr == null || !path.add(expr)) {
            return null;
        }
        try {
            return rankOnPath(expr, path);
        } finally {
            path.remove(expr);
        }
    }

    private EssentialRank rankOnPath(Token expr, Set<Token> path) {
        Variable variable = expr.variable();
        if (variable != null) {
            for (Token tok = variable.typeStartToken(); tok != null && tok.isName(); tok = tok.next()) {
                if (LEAF_TYPE_NAMES.contains(tok.str())) {
                    return EssentialRank.fromTypeName(tok.str()).orElse(null);
                }
            }
            return null;
        }
        if (expr.astOperand1() != null && expr.astOperand2() != null && RANKED_OPERATORS.contains(expr.str())) {
            if (isPointer(expr.astOperand1()) || isPointer(expr.astOperand2())) {
                return null;
            }
            EssentialRank r1 = rankOf(expr.astOperand1(), path);
            EssentialRank r2 = rankOf(expr.astOperand2(), path);
            if (r1 == null || r2 == null || !r1.isInteger() || !r2.isInteger()) {
                return null;
            }
            return r1.max(r2);
        }
        if (expr.is("~")) {
            return rankOf(expr.astOperand1(), path);
        }
        return null;
    }

    // Operands already on the path form an AST cycle and are treated as unknown.
    private static Set<Token> newPath() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }

    private static boolean isIncDec(Token tok) {
        return tok.is("++") || tok.is("--");
    }

    private static boolean isPointer(Token tok) {
        return tok.valueType() != null && tok.valueType().isPointer();
    }

    /**
     * Categories of a pair of operands; either side may be null when unknown.
     */
    public record CategoryPair(EssentialCategory left, EssentialCategory right) {

        static final CategoryPair UNKNOWN = new CategoryPair(null, null);

        public boolean isKnown() {
            return left != null && right != null;
        }

        public boolean differ() {
            return isKnown() && !left.equals(right);
        }
    }
}
