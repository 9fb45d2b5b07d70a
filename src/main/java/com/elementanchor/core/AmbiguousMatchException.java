package com.elementanchor.core;

import com.elementanchor.model.Locator;

/**
 * Thrown by a finder when a locator expected to identify one element matches several.
 */
public class AmbiguousMatchException extends AnchorException {

    public AmbiguousMatchException(Locator locator, int matches) {
        super("Ambiguous match, found " + matches + " elements matching " + locator);
    }
}
