package com.elementanchor.driver.simulated;

import com.elementanchor.model.Locator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;

/**
 * An in-memory document tree that only changes when told to.
 *
 * Fixtures are JSON trees of {@link SimulatedNodeSpec} loaded with Jackson:
 * <pre>
 *   SimulatedDocument doc = SimulatedDocument.fromResource("/pages/form.json");
 *   doc.rerender(Locator.id("name"));   // existing bindings to #name are now stale
 * </pre>
 *
 * Mutations detach the affected nodes, so bindings that still point at them start
 * failing with a stale reference, the way a re-rendering page behaves in a browser.
 */
public class SimulatedDocument {

    private static final Logger log = LoggerFactory.getLogger(SimulatedDocument.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SimulatedNode root;

    public SimulatedDocument(SimulatedNodeSpec rootSpec) {
        this.root = new SimulatedNode(Objects.requireNonNull(rootSpec, "rootSpec must not be null"));
    }

    // ── Loading ───────────────────────────────────────────────────────────────

    public static SimulatedDocument load(InputStream json) {
        try {
            return new SimulatedDocument(MAPPER.readValue(json, SimulatedNodeSpec.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not parse simulated document", e);
        }
    }

    /** Loads a fixture from the classpath, e.g. {@code "/pages/form.json"}. */
    public static SimulatedDocument fromResource(String resource) {
        try (InputStream in = SimulatedDocument.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("No simulated document on classpath at " + resource);
            }
            SimulatedDocument doc = load(in);
            log.debug("SimulatedDocument: loaded {}", resource);
            return doc;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + resource, e);
        }
    }

    // ── Queries ───────────────────────────────────────────────────────────────

    public SimulatedNode getRoot() {
        return root;
    }

    /** Every node, root included, matching the locator. */
    public List<SimulatedNode> findAll(Locator locator) {
        return root.findSelfOrDescendants(locator);
    }

    public SimulatedNode first(Locator locator) {
        List<SimulatedNode> found = findAll(locator);
        if (found.isEmpty()) throw new IllegalArgumentException("Nothing in the document matches " + locator);
        return found.get(0);
    }

    // ── Mutations ─────────────────────────────────────────────────────────────

    /** Removes the first node matching the locator, detaching its subtree. */
    public void remove(Locator locator) {
        SimulatedNode target = nonRoot(locator);
        target.getParent().removeChild(target);
        log.debug("SimulatedDocument: removed {}", target);
    }

    /**
     * Replaces the first node matching the locator with an identical copy. The copy
     * still matches the locator; bindings to the original become stale.
     */
    public SimulatedNode rerender(Locator locator) {
        SimulatedNode target = nonRoot(locator);
        SimulatedNode replacement = target.copy();
        target.getParent().replaceChild(target, replacement);
        log.debug("SimulatedDocument: re-rendered {}", target);
        return replacement;
    }

    /** Appends a new subtree under the first node matching the parent locator. */
    public SimulatedNode append(Locator parent, SimulatedNodeSpec childSpec) {
        SimulatedNode node = new SimulatedNode(childSpec);
        first(parent).appendChild(node);
        return node;
    }

    /** Enables or disables the first node matching the locator. */
    public void setDisabled(Locator locator, boolean disabled) {
        first(locator).setDisabled(disabled);
    }

    private SimulatedNode nonRoot(Locator locator) {
        SimulatedNode target = first(locator);
        if (target.getParent() == null) {
            throw new IllegalArgumentException("The document root cannot be replaced or removed");
        }
        return target;
    }
}
