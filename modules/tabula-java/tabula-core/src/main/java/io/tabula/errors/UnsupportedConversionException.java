/*
 * © Copyright Databand.ai, an IBM Company 2022
 */

package io.tabula.errors;

/**
 * Conversion between dtypes that is not supported, e.g. object to int.
 */
public class UnsupportedConversionException extends TabulaException {

    public UnsupportedConversionException() {
        super("Unsupported conversion");
    }

    public UnsupportedConversionException(String message) {
        super(message);
    }

    public UnsupportedConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
