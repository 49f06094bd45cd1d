package com.vidnyan.misra.domain.essential;

import java.util.Locale;

/**
 * MISRA essential type category of an expression.
 *
 * @param kind     category
 * @param enumName declaring scope name for {@link Kind#ENUM}, otherwise null
 */
public record EssentialCategory(Kind kind, String enumName) {

    public enum Kind {
        BOOL,
        SIGNED,
        UNSIGNED,
        FLOAT,
        ENUM
    }

    public static final EssentialCategory BOOL = new EssentialCategory(Kind.BOOL, null);
    public static final EssentialCategory SIGNED = new EssentialCategory(Kind.SIGNED, null);
    public static final EssentialCategory UNSIGNED = new EssentialCategory(Kind.UNSIGNED, null);
    public static final EssentialCategory FLOAT = new EssentialCategory(Kind.FLOAT, null);

    public static EssentialCategory enumOf(String name) {
        return new EssentialCategory(Kind.ENUM, name);
    }

    /**
     * Category for a value type sign, null when the sign is unknown.
     */
    public static EssentialCategory fromSign(String sign) {
        if ("signed".equals(sign)) {
            return SIGNED;
        }
        if ("unsigned".equals(sign)) {
            return UNSIGNED;
        }
        return null;
    }

    public boolean is(Kind other) {
        return kind == other;
    }

    public boolean isSignedOrUnsigned() {
        return kind == Kind.SIGNED || kind == Kind.UNSIGNED;
    }

    /**
     * Enumerations without a tag get a generated "Anonymous" scope name.
     */
    public boolean isAnonymousEnum() {
        return kind == Kind.ENUM && enumName != null && enumName.contains("Anonymous");
    }

    @Override
    public String toString() {
        return kind == Kind.ENUM ? "enum<" + enumName + ">" : kind.name().toLowerCase(Locale.ROOT);
    }
}
