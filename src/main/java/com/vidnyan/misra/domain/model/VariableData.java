package com.vidnyan.misra.domain.model;

import java.util.Set;

/**
 * Index-based description of a variable as supplied by the analyzer.
 */
public record VariableData(
    int nameToken,
    int typeStartToken,
    int typeEndToken,
    int scope,
    Set<VariableFlag> flags,
    int constness
) {
}
