package com.vidnyan.misra.domain.model;

/**
 * A node of the scope tree.
 */
public final class Scope {

    private final NodeArena arena;
    private final int index;
    private final ScopeData data;

    public Scope(NodeArena arena, int index, ScopeData data) {
        this.arena = arena;
        this.index = index;
        this.data = data;
    }

    public int index() {
        return index;
    }

    public ScopeType type() {
        return data.type();
    }

    public boolean is(ScopeType type) {
        return data.type() == type;
    }

    /**
     * Tag or function name; null for anonymous and block scopes.
     */
    public String className() {
        return data.className();
    }

    public boolean hasClassName() {
        return data.className() != null && !data.className().isEmpty();
    }

    public Token bodyStart() {
        return arena.token(data.bodyStart());
    }

    public Token bodyEnd() {
        return arena.token(data.bodyEnd());
    }

    public Scope nestedIn() {
        return arena.scope(data.nestedIn());
    }

    public Function function() {
        return arena.function(data.function());
    }

    public boolean isExecutable() {
        return data.type().isExecutable();
    }

    @Override
    public String toString() {
        return data.type() + (hasClassName() ? " " + data.className() : "");
    }
}
