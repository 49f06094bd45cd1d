package com.vidnyan.misra.domain.model;

import java.util.List;
import java.util.Set;

/**
 * A token of either the raw lexical stream or a decorated configuration.
 * Navigation methods resolve indices through the owning arena and return
 * {@code null} when the relation is absent.
 */
public final class Token implements Locatable {

    private static final Set<String> ARITHMETICAL = Set.of("+", "-", "*", "/", "%", "<<", ">>");
    private static final Set<String> ASSIGNMENT =
            Set.of("=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=");
    private static final Set<String> COMPARISON = Set.of("==", "!=", "<", "<=", ">", ">=");
    private static final Set<String> LOGICAL = Set.of("&&", "||");

    private final NodeArena arena;
    private final int index;
    private final TokenData data;

    public Token(NodeArena arena, int index, TokenData data) {
        this.arena = arena;
        this.index = index;
        this.data = data;
    }

    public int index() {
        return index;
    }

    public String str() {
        return data.str();
    }

    public boolean is(String text) {
        return data.str().equals(text);
    }

    public TokenType type() {
        return data.type();
    }

    public boolean isName() {
        return data.type() == TokenType.NAME;
    }

    public boolean isNumber() {
        return data.type() == TokenType.NUMBER;
    }

    public boolean isString() {
        return data.type() == TokenType.STRING;
    }

    public boolean isChar() {
        return data.type() == TokenType.CHAR;
    }

    public boolean isOp() {
        return data.type() == TokenType.OP;
    }

    public boolean isArithmeticalOp() {
        return isOp() && ARITHMETICAL.contains(data.str());
    }

    public boolean isAssignmentOp() {
        return isOp() && ASSIGNMENT.contains(data.str());
    }

    public boolean isComparisonOp() {
        return isOp() && COMPARISON.contains(data.str());
    }

    public boolean isLogicalOp() {
        return isOp() && LOGICAL.contains(data.str());
    }

    public boolean isComment() {
        return data.str().startsWith("//") || data.str().startsWith("/*");
    }

    public Token next() {
        return arena.token(index + 1);
    }

    public Token previous() {
        return arena.token(index - 1);
    }

    /**
     * Matching bracket as computed by the analyzer.
     */
    public Token link() {
        return arena.token(data.link());
    }

    public Token astParent() {
        return arena.token(data.astParent());
    }

    public Token astOperand1() {
        return arena.token(data.astOperand1());
    }

    public Token astOperand2() {
        return arena.token(data.astOperand2());
    }

    public Scope scope() {
        return arena.scope(data.scope());
    }

    public Variable variable() {
        return arena.variable(data.variable());
    }

    public Function function() {
        return arena.function(data.function());
    }

    public int varId() {
        return data.varId();
    }

    /**
     * Scope declared by this token when it names a type (struct or enum tag).
     */
    public Scope typeScope() {
        return arena.scope(data.typeScope());
    }

    public ValueType valueType() {
        return data.valueType();
    }

    /**
     * Declaring scope of this token's value type, for enum and record types.
     */
    public Scope valueTypeScope() {
        ValueType vt = data.valueType();
        return vt == null ? null : arena.scope(vt.typeScope());
    }

    public List<Value> values() {
        return data.values();
    }

    public boolean hasValues() {
        return !data.values().isEmpty();
    }

    public int column() {
        return data.column();
    }

    @Override
    public String file() {
        return data.file();
    }

    @Override
    public int line() {
        return data.line();
    }

    @Override
    public Location location() {
        return new Location(data.file(), data.line(), data.column());
    }

    @Override
    public String toString() {
        return data.str() + "@" + data.line() + ":" + data.column();
    }
}
