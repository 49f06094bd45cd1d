package com.vidnyan.misra.domain.essential;

import java.util.Optional;

/**
 * Standard type ranks used when comparing expression widths.
 * Only BOOL through LONG_LONG are integer ranks.
 */
public enum EssentialRank {
    BOOL("bool"),
    CHAR("char"),
    SHORT("short"),
    INT("int"),
    LONG("long"),
    LONG_LONG("long long"),
    FLOAT("float"),
    DOUBLE("double");

    private final String typeName;

    EssentialRank(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }

    public boolean isInteger() {
        return ordinal() <= LONG_LONG.ordinal();
    }

    public static Optional<EssentialRank> fromTypeName(String name) {
        for (EssentialRank rank : values()) {
            if (rank.typeName.equals(name)) {
                return Optional.of(rank);
            }
        }
        return Optional.empty();
    }

    /**
     * Rank of a declared integer type excluding bool ({@code char} through {@code long long}).
     */
    public static Optional<EssentialRank> integerTypeRank(String name) {
        return fromTypeName(name).filter(r -> r.isInteger() && r != BOOL);
    }

    public EssentialRank max(EssentialRank other) {
        return other.ordinal() >= ordinal() ? other : this;
    }
}
