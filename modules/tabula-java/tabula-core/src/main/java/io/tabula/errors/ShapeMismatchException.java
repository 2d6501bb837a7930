/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.errors;

/**
 * Operand length or shape does not match.
 */
public class ShapeMismatchException extends TabulaException {

    public ShapeMismatchException() {
        super("Shapes do not match");
    }

    public ShapeMismatchException(String message) {
        super(message);
    }
}
