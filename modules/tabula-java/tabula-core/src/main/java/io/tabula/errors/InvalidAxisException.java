/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.errors;

/**
 * Axis argument outside of {0, 1}.
 */
public class InvalidAxisException extends TabulaException {

    public InvalidAxisException() {
        super("Invalid axis for method");
    }

    public InvalidAxisException(String message) {
        super(message);
    }
}
