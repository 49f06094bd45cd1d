package com.vidnyan.misra.domain.model;

/**
 * Source code location of a reported node.
 */
public record Location(
    String file,
    int line,
    int column
) {

    /**
     * Create a location with just line information.
     */
    public static Location at(String file, int line) {
        return new Location(file, line, 0);
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return file + ":" + line + ":" + column;
    }
}
