package com.vidnyan.misra.domain.model;

/**
 * A preprocessor directive line as written, e.g. {@code #include <stdio.h>}.
 */
public record Directive(
    String str,
    String file,
    int line
) implements Locatable {

    @Override
    public Location location() {
        return Location.at(file, line);
    }
}
