package com.vidnyan.misra.domain.model;

/**
 * Index-based description of a scope as supplied by the analyzer.
 */
public record ScopeData(
    ScopeType type,
    String className,
    int bodyStart,
    int bodyEnd,
    int nestedIn,
    int function
) {

    public static ScopeData global() {
        return new ScopeData(ScopeType.GLOBAL, null, NodeArena.NONE, NodeArena.NONE, NodeArena.NONE, NodeArena.NONE);
    }
}
