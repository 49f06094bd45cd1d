package com.vidnyan.misra.domain.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Kind of a scope in the scope tree.
 */
public enum ScopeType {
    GLOBAL,
    NAMESPACE,
    CLASS,
    STRUCT,
    UNION,
    ENUM,
    FUNCTION,
    IF,
    ELSE,
    FOR,
    WHILE,
    DO,
    SWITCH,
    UNCONDITIONAL,
    TRY,
    CATCH,
    LAMBDA,
    UNKNOWN;

    private static final Set<ScopeType> DECLARATIVE =
            EnumSet.of(GLOBAL, NAMESPACE, CLASS, STRUCT, UNION, ENUM);

    public static ScopeType fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(code.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    public boolean isExecutable() {
        return !DECLARATIVE.contains(this);
    }
}
