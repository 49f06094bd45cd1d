package com.vidnyan.misra.domain.model;

import java.util.Locale;

/**
 * Lexical kind of a token as classified by the analyzer.
 */
public enum TokenType {
    NAME,
    NUMBER,
    STRING,
    CHAR,
    OP,
    OTHER;

    public static TokenType fromCode(String code) {
        if (code == null) {
            return OTHER;
        }
        return switch (code.toLowerCase(Locale.ROOT)) {
            case "name" -> NAME;
            case "number" -> NUMBER;
            case "string" -> STRING;
            case "char" -> CHAR;
            case "op" -> OP;
            default -> OTHER;
        };
    }
}
