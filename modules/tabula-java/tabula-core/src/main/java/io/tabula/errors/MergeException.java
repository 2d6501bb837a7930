/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.errors;

/**
 * Unsupported merge type or merge keys.
 */
public class MergeException extends TabulaException {

    public MergeException() {
        super("Merge failed");
    }

    public MergeException(String message) {
        super(message);
    }
}
