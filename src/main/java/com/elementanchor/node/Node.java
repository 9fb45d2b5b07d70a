package com.elementanchor.node;

import com.elementanchor.core.AmbiguousMatchException;
import com.elementanchor.core.ElementNotFoundException;
import com.elementanchor.core.Session;
import com.elementanchor.driver.NodeBinding;
import com.elementanchor.model.Locator;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Common base of the document root and element handles: something a locator can be
 * resolved against, and whose operations run through the session's
 * {@link com.elementanchor.core.Synchronizer}.
 */
public abstract class Node {

    protected final Session session;

    Node(Session session) {
        this.session = Objects.requireNonNull(session, "session must not be null");
    }

    /**
     * Finds the single element inside this node matching the locator, waiting for it
     * to appear. The returned handle remembers this node as its scope and is reloadable.
     */
    public ElementHandle find(Locator locator) {
        Objects.requireNonNull(locator, "locator must not be null");
        return synchronize(() -> {
            List<NodeBinding> matches = findBindings(locator);
            if (matches.isEmpty()) throw new ElementNotFoundException(locator);
            if (matches.size() > 1) throw new AmbiguousMatchException(locator, matches.size());
            ElementHandle handle = new ElementHandle(session, matches.get(0), this, locator);
            handle.allowReload();
            return handle;
        });
    }

    public Session getSession() {
        return session;
    }

    // ── Scope contract ────────────────────────────────────────────────────────

    /** Raw driver matches for the locator within this node, in document order. */
    abstract List<NodeBinding> findBindings(Locator locator);

    /** Brings this node up to date before a child locator is replayed against it. */
    abstract Node reloadScope();

    /** Re-resolves this node's own binding; true when it was replaced. */
    boolean refreshBinding() {
        return false;
    }

    // ── Synchronization ───────────────────────────────────────────────────────

    <T> T synchronize(Supplier<T> action) {
        return session.synchronizer().synchronize(this::refreshBinding, action);
    }

    void run(Runnable action) {
        synchronize(() -> {
            action.run();
            return null;
        });
    }
}
