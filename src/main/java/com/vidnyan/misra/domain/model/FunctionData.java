package com.vidnyan.misra.domain.model;

import java.util.Map;

/**
 * Index-based description of a function.
 *
 * @param arguments 1-based argument position to variable index
 */
public record FunctionData(
    String name,
    int tokenDef,
    boolean isStatic,
    Map<Integer, Integer> arguments
) {
}
