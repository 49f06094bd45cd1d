package com.vidnyan.misra.domain.model;

/**
 * Index-based storage for model nodes.
 * Every relation between nodes is an index into an arena; {@code -1} or an
 * out-of-range index resolves to {@code null}.
 */
public interface NodeArena {

    int NONE = -1;

    Token token(int index);

    Scope scope(int index);

    Variable variable(int index);

    Function function(int index);
}
