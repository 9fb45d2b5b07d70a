package com.elementanchor.core;

import com.elementanchor.model.Locator;

/**
 * Thrown by a finder when a locator matches nothing in its scope.
 *
 * Treated as transient by {@link Synchronizer}: the element may simply not have
 * been rendered yet.
 */
public class ElementNotFoundException extends AnchorException {

    private final Locator locator;

    public ElementNotFoundException(Locator locator) {
        super("Unable to find " + locator);
        this.locator = locator;
    }

    public Locator getLocator() {
        return locator;
    }
}
