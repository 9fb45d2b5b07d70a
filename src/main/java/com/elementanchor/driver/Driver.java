package com.elementanchor.driver;

import com.elementanchor.model.Locator;

import java.util.List;
import java.util.Set;

/**
 * A driver backend: the document-level half of the driver boundary.
 *
 * Node-level behaviour lives in {@link NodeBinding}; a Driver provides document-root
 * lookup and the policy facts the synchronization layer needs.
 */
public interface Driver {

    /** Short backend name used in log output, e.g. {@code "selenium"}. */
    String name();

    /** All nodes in the document matching the locator, in document order. */
    List<NodeBinding> findAll(Locator locator);

    /**
     * Error kinds meaning "this element reference is no longer usable". Operations
     * failing with one of these are retried, and reload treats them as expected.
     */
    Set<DriverErrorKind> invalidElementErrors();

    /**
     * Whether the remote document changes asynchronously, so that a failing operation
     * is worth waiting on. Backends that mutate only when told to (in-memory documents)
     * return {@code false}; retries then happen only when a reload changed the binding.
     */
    boolean needsWaiting();
}
