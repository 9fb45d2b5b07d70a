package com.elementanchor.node;

import com.elementanchor.core.ReadOnlyElementException;
import com.elementanchor.core.Session;
import com.elementanchor.driver.CapabilityProbe;
import com.elementanchor.driver.DriverErrorKind;
import com.elementanchor.driver.DriverException;
import com.elementanchor.driver.NodeBinding;
import com.elementanchor.model.ClickOptions;
import com.elementanchor.model.Locator;
import com.elementanchor.model.Operation;
import com.elementanchor.model.TextType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A stable local handle onto one remote element.
 *
 * ## What the handle guarantees
 *
 *   - Every read and action runs through the session's
 *     {@link com.elementanchor.core.Synchronizer}, so transient driver failures
 *     (stale reference, not yet rendered, not yet interactable) are retried until the
 *     configured wait time elapses.
 *   - Operations taking extended arguments (click modifiers and offsets, set options)
 *     check the binding's declared capabilities first and fail fast with a
 *     {@link com.elementanchor.core.CapabilityException} instead of guessing.
 *     Without extended arguments the minimal driver form is always used.
 *   - A reloadable handle re-resolves its original {@link Locator} against its scope
 *     when its binding has gone stale. Only "not found" and invalid-reference failures
 *     are absorbed during that lookup.
 *
 * Action methods return the handle so calls can be chained:
 * <pre>
 *   session.find(Locator.id("name")).set("Ada").sendKeys(Keys.TAB);
 * </pre>
 *
 * Not thread-safe. The binding is replaced in place on reload, so a handle must be
 * used by one flow of control at a time.
 */
public class ElementHandle extends Node {

    private static final Logger log = LoggerFactory.getLogger(ElementHandle.class);

    private final Node scope;
    private final Locator locator;
    private NodeBinding binding;
    private boolean reloadable = false;

    public ElementHandle(Session session, NodeBinding binding, Node scope, Locator locator) {
        super(session);
        this.binding = Objects.requireNonNull(binding, "binding must not be null");
        this.scope   = Objects.requireNonNull(scope, "scope must not be null");
        this.locator = Objects.requireNonNull(locator, "locator must not be null");
    }

    /** Lets this handle swap in a fresh binding when its current one goes stale. */
    public ElementHandle allowReload() {
        this.reloadable = true;
        return this;
    }

    public boolean isReloadable()  { return reloadable; }
    public Locator getLocator()    { return locator; }

    // ── Reads ─────────────────────────────────────────────────────────────────

    /**
     * The element's text. Returns visible text when the session ignores hidden
     * elements or is configured for visible text only, otherwise all text.
     */
    public String text() {
        return text(session.getConfig().isVisibleTextByDefault() ? TextType.VISIBLE : TextType.ALL);
    }

    public String text(TextType type) {
        Objects.requireNonNull(type, "type must not be null");
        return synchronize(() -> type == TextType.ALL ? binding.allText() : binding.visibleText());
    }

    /** The named attribute, or {@code null} when the element does not carry it. */
    public String attribute(String name) {
        return synchronize(() -> binding.attribute(name));
    }

    public String value() {
        return synchronize(() -> binding.value());
    }

    public String tagName() {
        return synchronize(() -> binding.tagName());
    }

    /** An XPath describing where on the page the element can be found. */
    public String path() {
        return synchronize(() -> binding.path());
    }

    public boolean isVisible()  { return synchronize(() -> binding.isVisible()); }
    public boolean isChecked()  { return synchronize(() -> binding.isChecked()); }
    public boolean isSelected() { return synchronize(() -> binding.isSelected()); }
    public boolean isDisabled() { return synchronize(() -> binding.isDisabled()); }
    public boolean isReadonly() { return synchronize(() -> binding.isReadonly()); }
    public boolean isMultiple() { return synchronize(() -> binding.isMultiple()); }

    // ── Value mutation ────────────────────────────────────────────────────────

    public ElementHandle set(String value) {
        return set(value, Collections.emptyMap());
    }

    /**
     * Sets the element's value.
     *
     * @param options driver-specific options; when non-empty the binding must declare
     *                support for extended {@link Operation#SET}
     * @throws ReadOnlyElementException when the element is read-only; no set is attempted
     */
    public ElementHandle set(String value, Map<String, Object> options) {
        if (isReadonly()) {
            throw new ReadOnlyElementException(value);
        }
        if (options == null || options.isEmpty()) {
            run(() -> binding.set(value));
        } else {
            CapabilityProbe.requireExtended(Operation.SET, binding);
            run(() -> binding.set(value, options));
        }
        return this;
    }

    /**
     * Selects this option element. Selecting a disabled or already selected option is
     * reported as a warning; the selection is still attempted.
     */
    public ElementHandle selectOption() {
        if (isDisabled()) {
            log.warn("ElementHandle: Attempt to select disabled option: {}", optionLabel());
        } else if (isSelected()) {
            log.warn("ElementHandle: Option is already selected: {}", optionLabel());
        }
        run(() -> binding.selectOption());
        return this;
    }

    public ElementHandle unselectOption() {
        run(() -> binding.unselectOption());
        return this;
    }

    // ── Clicks ────────────────────────────────────────────────────────────────

    public ElementHandle click() {
        return click(ClickOptions.none());
    }

    public ElementHandle click(ClickOptions options) {
        if (isMinimal(options)) {
            run(() -> binding.click());
        } else {
            CapabilityProbe.requireExtended(Operation.CLICK, binding);
            run(() -> binding.click(options));
        }
        return this;
    }

    public ElementHandle rightClick() {
        return rightClick(ClickOptions.none());
    }

    public ElementHandle rightClick(ClickOptions options) {
        if (isMinimal(options)) {
            run(() -> binding.rightClick());
        } else {
            CapabilityProbe.requireExtended(Operation.RIGHT_CLICK, binding);
            run(() -> binding.rightClick(options));
        }
        return this;
    }

    public ElementHandle doubleClick() {
        return doubleClick(ClickOptions.none());
    }

    public ElementHandle doubleClick(ClickOptions options) {
        if (isMinimal(options)) {
            run(() -> binding.doubleClick());
        } else {
            CapabilityProbe.requireExtended(Operation.DOUBLE_CLICK, binding);
            run(() -> binding.doubleClick(options));
        }
        return this;
    }

    // ── Other actions ─────────────────────────────────────────────────────────

    public ElementHandle sendKeys(CharSequence... keys) {
        run(() -> binding.sendKeys(keys));
        return this;
    }

    public ElementHandle hover() {
        run(() -> binding.hover());
        return this;
    }

    /** Fires a DOM event such as {@code focus} or {@code mouseover} on the element. */
    public ElementHandle trigger(String event) {
        run(() -> binding.trigger(event));
        return this;
    }

    public ElementHandle dragTo(ElementHandle target) {
        Objects.requireNonNull(target, "target must not be null");
        run(() -> binding.dragTo(target.binding));
        return this;
    }

    // ── Stale reference recovery ──────────────────────────────────────────────

    /**
     * Re-resolves the original locator against this handle's scope and adopts the first
     * match. Does nothing unless the handle is reloadable.
     *
     * When the element no longer exists the previous binding is kept and no exception is
     * raised. Failures other than "not found" and invalid references, for example a
     * malformed locator, propagate.
     *
     * @return this handle
     */
    public ElementHandle reload() {
        refreshBinding();
        return this;
    }

    @Override
    boolean refreshBinding() {
        if (!reloadable) return false;
        try {
            List<NodeBinding> matches = scope.reloadScope().findBindings(locator);
            if (matches.isEmpty()) {
                log.debug("ElementHandle: reload found no match for {}; keeping previous binding", locator);
                return false;
            }
            NodeBinding fresh = matches.get(0);
            boolean replaced = !fresh.equals(binding);
            binding = fresh;
            return replaced;
        } catch (DriverException e) {
            if (!isExpectedDuringReload(e)) throw e;
            log.debug("ElementHandle: reload of {} hit {}; keeping previous binding", locator, e.getKind());
            return false;
        }
    }

    private boolean isExpectedDuringReload(DriverException e) {
        return e.is(DriverErrorKind.ELEMENT_NOT_FOUND)
            || session.getDriver().invalidElementErrors().contains(e.getKind());
    }

    // ── Scope contract ────────────────────────────────────────────────────────

    @Override
    List<NodeBinding> findBindings(Locator childLocator) {
        return binding.findAll(childLocator);
    }

    @Override
    Node reloadScope() {
        return reload();
    }

    // ── Diagnostics ───────────────────────────────────────────────────────────

    /**
     * A short description for logs: tag name and, when the driver can supply it, the
     * element's path. An element the driver reports as an invalid reference renders as
     * {@code Obsolete #<ElementHandle>}. Does not retry.
     */
    public String inspect() {
        try {
            String tag = binding.tagName();
            try {
                return String.format("#<ElementHandle tag=\"%s\" path=\"%s\">", tag, binding.path());
            } catch (DriverException e) {
                if (!e.is(DriverErrorKind.NOT_SUPPORTED)) throw e;
                return String.format("#<ElementHandle tag=\"%s\">", tag);
            }
        } catch (DriverException e) {
            if (!session.getDriver().invalidElementErrors().contains(e.getKind())) throw e;
            return "Obsolete #<ElementHandle>";
        }
    }

    @Override
    public String toString() {
        return inspect();
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private static boolean isMinimal(ClickOptions options) {
        return options == null || options.isEmpty();
    }

    private String optionLabel() {
        String value = value();
        return value != null && !value.isEmpty() ? value : text();
    }
}
