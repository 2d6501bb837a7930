/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.errors;

/**
 * Index length does not match the length of the values it labels.
 */
public class IndexMismatchException extends TabulaException {

    public IndexMismatchException() {
        super("Index does not match data");
    }

    public IndexMismatchException(String message) {
        super(message);
    }
}
