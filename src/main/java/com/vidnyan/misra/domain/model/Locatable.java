package com.vidnyan.misra.domain.model;

/**
 * A model node that violations can be attributed to.
 */
public interface Locatable {

    Location location();

    default String file() {
        return location().file();
    }

    default int line() {
        return location().line();
    }
}
