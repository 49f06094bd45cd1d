package com.vidnyan.misra.domain.model;

import java.util.Locale;

/**
 * C language standard level of a translation unit.
 */
public enum LanguageStandard {
    C89,
    C99,
    C11;

    public static LanguageStandard fromCode(String code) {
        if (code == null) {
            return C89;
        }
        return switch (code.toLowerCase(Locale.ROOT)) {
            case "c99" -> C99;
            case "c11", "c17", "c18" -> C11;
            default -> C89;
        };
    }

    /**
     * Number of significant initial characters in an identifier.
     */
    public int significantNameLength() {
        return this == C89 ? 31 : 63;
    }
}
