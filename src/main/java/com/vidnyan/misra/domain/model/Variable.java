package com.vidnyan.misra.domain.model;

/**
 * A declared variable or function parameter.
 */
public final class Variable {

    private final NodeArena arena;
    private final int index;
    private final VariableData data;

    public Variable(NodeArena arena, int index, VariableData data) {
        this.arena = arena;
        this.index = index;
        this.data = data;
    }

    public int index() {
        return index;
    }

    public Token nameToken() {
        return arena.token(data.nameToken());
    }

    /**
     * Name as declared, or null for unnamed parameters.
     */
    public String name() {
        Token name = nameToken();
        return name == null ? null : name.str();
    }

    public Token typeStartToken() {
        return arena.token(data.typeStartToken());
    }

    public Token typeEndToken() {
        return arena.token(data.typeEndToken());
    }

    public Scope scope() {
        return arena.scope(data.scope());
    }

    public int constness() {
        return data.constness();
    }

    public boolean isArgument() { return has(VariableFlag.ARGUMENT); }
    public boolean isArray() { return has(VariableFlag.ARRAY); }
    public boolean isClass() { return has(VariableFlag.CLASS); }
    public boolean isConst() { return has(VariableFlag.CONST); }
    public boolean isExtern() { return has(VariableFlag.EXTERN); }
    public boolean isGlobal() { return has(VariableFlag.GLOBAL); }
    public boolean isLocal() { return has(VariableFlag.LOCAL); }
    public boolean isPointer() { return has(VariableFlag.POINTER); }
    public boolean isStatic() { return has(VariableFlag.STATIC); }

    public boolean hasExternalLinkage() {
        return isGlobal() && !isStatic();
    }

    private boolean has(VariableFlag flag) {
        return data.flags().contains(flag);
    }

    @Override
    public String toString() {
        return "Variable " + name();
    }
}
