package com.vidnyan.misra.domain.model;

public enum VariableFlag {
    ARGUMENT,
    ARRAY,
    CLASS,
    CONST,
    EXTERN,
    GLOBAL,
    LOCAL,
    POINTER,
    STATIC
}
