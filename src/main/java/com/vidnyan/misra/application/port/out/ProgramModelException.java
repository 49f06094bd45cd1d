package com.vidnyan.misra.application.port.out;

/**
 * Thrown when a program model document cannot be read or parsed.
 */
public class ProgramModelException extends RuntimeException {

    public ProgramModelException(String message) {
        super(message);
    }

    public ProgramModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
