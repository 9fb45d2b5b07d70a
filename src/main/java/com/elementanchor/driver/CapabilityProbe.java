package com.elementanchor.driver;

import com.elementanchor.core.CapabilityException;
import com.elementanchor.model.Operation;

/**
 * Decides, before dispatch, whether a binding accepts the extended form of an operation.
 *
 * Stateless; consults only the binding's declared {@link DriverCapabilities}.
 */
public final class CapabilityProbe {

    private CapabilityProbe() {}

    public static boolean supportsExtended(Operation operation, NodeBinding binding) {
        return binding.capabilities().supportsExtended(operation);
    }

    /**
     * @throws CapabilityException when the binding only supports the minimal form
     */
    public static void requireExtended(Operation operation, NodeBinding binding) {
        if (!supportsExtended(operation, binding)) {
            throw new CapabilityException(operation);
        }
    }
}
