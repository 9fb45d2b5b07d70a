package com.elementanchor.driver;

/**
 * Backend-independent classification of driver failures.
 *
 * Driver backends translate their native exceptions into one of these kinds. Which
 * kinds count as "the element reference is no longer usable" is decided per driver
 * by {@link Driver#invalidElementErrors()}.
 *
 *   STALE_REFERENCE    -- the node was detached from the document
 *   ELEMENT_NOT_FOUND  -- a lookup matched nothing
 *   NOT_INTERACTABLE   -- the node exists but cannot receive input yet
 *   CLICK_INTERCEPTED  -- another node would receive the click
 *   INVALID_SELECTOR   -- the locator itself is malformed or unsupported
 *   NOT_SUPPORTED      -- the backend does not implement the operation at all
 */
public enum DriverErrorKind {
    STALE_REFERENCE,
    ELEMENT_NOT_FOUND,
    NOT_INTERACTABLE,
    CLICK_INTERCEPTED,
    INVALID_SELECTOR,
    NOT_SUPPORTED
}
