package com.vidnyan.misra.domain.model;

/**
 * A statically known possible value of a token.
 * {@code intValue} is null when the value is not an integer.
 */
public record Value(Long intValue) {

    public static Value of(long value) {
        return new Value(value);
    }
}
