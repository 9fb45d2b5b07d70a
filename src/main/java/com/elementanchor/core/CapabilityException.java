package com.elementanchor.core;

import com.elementanchor.model.Operation;

/**
 * Thrown when extended arguments were passed to an operation whose active driver
 * binding only supports the minimal form. Never retried.
 */
public class CapabilityException extends AnchorException {

    private final Operation operation;

    public CapabilityException(Operation operation) {
        super("The current driver does not support " + operation.getDisplayName() + " options");
        this.operation = operation;
    }

    public Operation getOperation() {
        return operation;
    }
}
