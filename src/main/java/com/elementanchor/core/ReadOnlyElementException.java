package com.elementanchor.core;

/**
 * Thrown when a value is set on an element that reports itself read-only.
 */
public class ReadOnlyElementException extends AnchorException {

    public ReadOnlyElementException(String value) {
        super("Attempt to set readonly element with value: " + value);
    }
}
