/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.errors;

/**
 * Base class for all failures raised by Series and DataFrame operations.
 */
public class TabulaException extends RuntimeException {

    public TabulaException(String message) {
        super(message);
    }

    public TabulaException(String message, Throwable cause) {
        super(message, cause);
    }
}
