package com.vidnyan.misra.domain.model;

import java.util.Set;

/**
 * Type information computed by the analyzer for an expression.
 *
 * @param type           base type name ("int", "long long", "record", ...)
 * @param sign           "signed", "unsigned" or null
 * @param bits           bit-field width, 0 when not a bit field
 * @param pointer        pointer depth
 * @param constness      bitmask, bit n set when indirection level n is const
 * @param typeScope      arena index of the declaring enum/struct scope
 * @param originalTypeName typedef name as written, may be null
 */
public record ValueType(
    String type,
    String sign,
    int bits,
    int pointer,
    int constness,
    int typeScope,
    String originalTypeName
) {

    private static final Set<String> INTEGRAL = Set.of("bool", "char", "short", "int", "long", "long long");
    private static final Set<String> FLOATING = Set.of("float", "double", "long double");

    public static ValueType of(String type, String sign) {
        return new ValueType(type, sign, 0, 0, 0, NodeArena.NONE, null);
    }

    public static ValueType pointerTo(String type, int depth) {
        return new ValueType(type, null, 0, depth, 0, NodeArena.NONE, null);
    }

    public boolean isIntegral() {
        return INTEGRAL.contains(type);
    }

    public boolean isFloat() {
        return FLOATING.contains(type);
    }

    public boolean isPointer() {
        return pointer > 0;
    }

    public boolean hasTypeScope() {
        return typeScope >= 0;
    }

    public ValueType withTypeScope(int scopeIndex) {
        return new ValueType(type, sign, bits, pointer, constness, scopeIndex, originalTypeName);
    }

    public ValueType withConstness(int value) {
        return new ValueType(type, sign, bits, pointer, value, typeScope, originalTypeName);
    }
}
