/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.errors;

/**
 * Argument of the wrong kind passed to a constructor or operation.
 */
public class InvalidTypeException extends TabulaException {

    public InvalidTypeException() {
        super("Invalid argument type");
    }

    public InvalidTypeException(String message) {
        super(message);
    }

    public InvalidTypeException(String message, Throwable cause) {
        super(message, cause);
    }
}
