/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.errors;

/**
 * Referenced column does not exist.
 */
public class KeyException extends TabulaException {

    public KeyException() {
        super("Key not found");
    }

    public KeyException(String message) {
        super(message);
    }
}
