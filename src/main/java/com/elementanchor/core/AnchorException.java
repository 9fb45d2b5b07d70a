package com.elementanchor.core;

/**
 * Base class of every exception raised by ElementAnchor.
 *
 * All library exceptions are unchecked. Callers that want to treat library failures
 * uniformly can catch this type; everything outside it (programmer errors such as
 * {@link IllegalArgumentException}, or unrecognised driver errors) is never wrapped.
 */
public class AnchorException extends RuntimeException {

    public AnchorException(String message) {
        super(message);
    }

    public AnchorException(String message, Throwable cause) {
        super(message, cause);
    }
}
