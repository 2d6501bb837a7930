/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.errors;

/**
 * Feature is declared but not implemented.
 */
public class NotImplementedException extends TabulaException {

    public NotImplementedException() {
        super("Not implemented");
    }

    public NotImplementedException(String message) {
        super(message);
    }
}
