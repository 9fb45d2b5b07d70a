package com.elementanchor.driver.simulated;

import com.elementanchor.driver.Driver;
import com.elementanchor.driver.DriverErrorKind;
import com.elementanchor.driver.DriverException;
import com.elementanchor.driver.NodeBinding;
import com.elementanchor.model.Locator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A driver backend over a {@link SimulatedDocument}.
 *
 * Intended for exercising element handles without a browser:
 *   - every binding call is appended to a call log ({@link #calls()})
 *   - faults can be queued per operation ({@link #failNext})
 *   - the backend can claim to be asynchronous ({@code waiting(true)}) so that retry
 *     timing can be exercised
 *   - extended click/set forms are available only when built with
 *     {@code extendedForms(true)}; the binding class then declares them
 *
 * <pre>
 *   SimulatedDriver driver = SimulatedDriver.builder()
 *       .document(SimulatedDocument.fromResource("/pages/form.json"))
 *       .extendedForms(true)
 *       .build();
 * </pre>
 */
public class SimulatedDriver implements Driver {

    /** One recorded binding call. {@code detail} is null for calls without arguments. */
    public record Call(String operation, String path, String detail) {}

    private final SimulatedDocument document;
    private final boolean waiting;
    private final boolean extendedForms;
    private final boolean pathSupported;
    private final Set<DriverErrorKind> invalidElementErrors;

    private final List<Call> calls = new ArrayList<>();
    private final Map<String, Deque<DriverErrorKind>> faults = new HashMap<>();

    private SimulatedDriver(Builder b) {
        this.document             = Objects.requireNonNull(b.document, "document is required");
        this.waiting              = b.waiting;
        this.extendedForms        = b.extendedForms;
        this.pathSupported        = b.pathSupported;
        this.invalidElementErrors = Collections.unmodifiableSet(EnumSet.copyOf(b.invalidElementErrors));
    }

    // ── Driver ────────────────────────────────────────────────────────────────

    @Override
    public String name() {
        return "simulated";
    }

    @Override
    public List<NodeBinding> findAll(Locator locator) {
        return bindAll(document.findAll(locator));
    }

    @Override
    public Set<DriverErrorKind> invalidElementErrors() {
        return invalidElementErrors;
    }

    @Override
    public boolean needsWaiting() {
        return waiting;
    }

    // ── Test controls ─────────────────────────────────────────────────────────

    public SimulatedDocument getDocument() {
        return document;
    }

    /** Makes the next {@code times} calls of the named operation fail with the given kind. */
    public SimulatedDriver failNext(String operation, int times, DriverErrorKind kind) {
        Deque<DriverErrorKind> queue = faults.computeIfAbsent(operation, k -> new ArrayDeque<>());
        for (int i = 0; i < times; i++) {
            queue.add(kind);
        }
        return this;
    }

    public List<Call> calls() {
        return Collections.unmodifiableList(calls);
    }

    public long callCount(String operation) {
        return calls.stream().filter(c -> c.operation().equals(operation)).count();
    }

    public void clearCalls() {
        calls.clear();
    }

    // ── Binding support ───────────────────────────────────────────────────────

    boolean isPathSupported() {
        return pathSupported;
    }

    List<NodeBinding> bindAll(List<SimulatedNode> nodes) {
        List<NodeBinding> bindings = new ArrayList<>(nodes.size());
        for (SimulatedNode node : nodes) {
            bindings.add(extendedForms
                ? new ExtendedSimulatedNodeBinding(this, node)
                : new SimulatedNodeBinding(this, node));
        }
        return bindings;
    }

    /**
     * Records a call against a node, then raises any fault queued for the operation,
     * then the stale-reference failure if the node has been detached.
     */
    void record(String operation, SimulatedNode node, String detail) {
        calls.add(new Call(operation, node.isAttached() ? node.path() : null, detail));

        Deque<DriverErrorKind> queue = faults.get(operation);
        if (queue != null && !queue.isEmpty()) {
            DriverErrorKind kind = queue.poll();
            throw new DriverException(kind, "Injected " + kind + " for " + operation);
        }
        if (!node.isAttached()) {
            throw new DriverException(DriverErrorKind.STALE_REFERENCE,
                "Stale element reference: " + node + " is no longer attached to the document");
        }
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private SimulatedDocument document;
        private boolean waiting = false;
        private boolean extendedForms = false;
        private boolean pathSupported = true;
        private Set<DriverErrorKind> invalidElementErrors = EnumSet.of(DriverErrorKind.STALE_REFERENCE);

        public Builder document(SimulatedDocument d)               { this.document = d; return this; }
        public Builder waiting(boolean b)                          { this.waiting = b; return this; }
        public Builder extendedForms(boolean b)                    { this.extendedForms = b; return this; }
        public Builder pathSupported(boolean b)                    { this.pathSupported = b; return this; }
        public Builder invalidElementErrors(Set<DriverErrorKind> k) { this.invalidElementErrors = k; return this; }

        public SimulatedDriver build() {
            if (invalidElementErrors == null || invalidElementErrors.isEmpty()) {
                throw new IllegalStateException("invalidElementErrors must name at least one kind");
            }
            return new SimulatedDriver(this);
        }
    }
}
