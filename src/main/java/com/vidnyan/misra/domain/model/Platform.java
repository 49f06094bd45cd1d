package com.vidnyan.misra.domain.model;

/**
 * Integer bit widths of the target platform.
 * A width of 0 means unknown.
 */
public record Platform(
    int charBit,
    int shortBit,
    int intBit,
    int longBit,
    int longLongBit,
    int pointerBit
) {

    public static Platform unknown() {
        return new Platform(0, 0, 0, 0, 0, 0);
    }

    public static Platform unix64() {
        return new Platform(8, 16, 32, 64, 64, 64);
    }
}
