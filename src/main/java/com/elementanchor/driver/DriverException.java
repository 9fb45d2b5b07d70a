package com.elementanchor.driver;

import com.elementanchor.core.AnchorException;

/**
 * A failure reported by a driver backend, tagged with its {@link DriverErrorKind}.
 *
 * Retry and recovery decisions are made by checking {@link #getKind()} against an
 * allow-list, never by catching broad exception types.
 */
public class DriverException extends AnchorException {

    private final DriverErrorKind kind;

    public DriverException(DriverErrorKind kind, String message) {
        this(kind, message, null);
    }

    public DriverException(DriverErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static DriverException notSupported(String operation) {
        return new DriverException(DriverErrorKind.NOT_SUPPORTED,
            "The current driver does not support " + operation);
    }

    public DriverErrorKind getKind() {
        return kind;
    }

    public boolean is(DriverErrorKind other) {
        return kind == other;
    }
}
