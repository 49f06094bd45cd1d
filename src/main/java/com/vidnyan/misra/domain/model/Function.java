package com.vidnyan.misra.domain.model;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A declared or defined function.
 */
public final class Function {

    private final NodeArena arena;
    private final int index;
    private final FunctionData data;

    public Function(NodeArena arena, int index, FunctionData data) {
        this.arena = arena;
        this.index = index;
        this.data = data;
    }

    public int index() {
        return index;
    }

    public String name() {
        return data.name();
    }

    public Token tokenDef() {
        return arena.token(data.tokenDef());
    }

    public boolean isStatic() {
        return data.isStatic();
    }

    /**
     * Parameters keyed by 1-based position; unresolved parameters are skipped.
     */
    public SortedMap<Integer, Variable> arguments() {
        SortedMap<Integer, Variable> arguments = new TreeMap<>();
        for (Map.Entry<Integer, Integer> entry : data.arguments().entrySet()) {
            Variable variable = arena.variable(entry.getValue());
            if (variable != null) {
                arguments.put(entry.getKey(), variable);
            }
        }
        return arguments;
    }

    public int argumentCount() {
        return data.arguments().size();
    }

    @Override
    public String toString() {
        return "Function " + data.name();
    }
}
