package com.elementanchor.driver;

import com.elementanchor.model.ClickOptions;
import com.elementanchor.model.Locator;

import java.util.List;
import java.util.Map;

/**
 * Driver-specific representation of one remote node.
 *
 * Implemented once per driver backend. ElementAnchor never exposes a binding to
 * calling code; it is held privately by an {@link com.elementanchor.node.ElementHandle}
 * and replaced wholesale when the handle reloads.
 *
 * <h3>Error contract</h3>
 * Implementations report backend failures as {@link DriverException} tagged with a
 * {@link DriverErrorKind}. Native errors the backend cannot classify are allowed to
 * propagate unchanged.
 *
 * <h3>Extended forms</h3>
 * The extended click and set forms below default to raising {@code NOT_SUPPORTED}.
 * A backend that implements one must override it and list the operation in a
 * {@link SupportsExtended} declaration on the binding class.
 */
public interface NodeBinding {

    // ── Reads ─────────────────────────────────────────────────────────────────

    String attribute(String name);

    String allText();

    String visibleText();

    String value();

    String tagName();

    /** An XPath describing where the node sits in the document. */
    String path();

    boolean isVisible();

    boolean isChecked();

    boolean isSelected();

    boolean isDisabled();

    boolean isReadonly();

    boolean isMultiple();

    // ── Actions, minimal forms ────────────────────────────────────────────────

    void set(String value);

    void selectOption();

    void unselectOption();

    void click();

    void rightClick();

    void doubleClick();

    void hover();

    void sendKeys(CharSequence... keys);

    void dragTo(NodeBinding target);

    default void trigger(String event) {
        throw DriverException.notSupported("trigger");
    }

    // ── Actions, extended forms ───────────────────────────────────────────────

    default void set(String value, Map<String, Object> options) {
        throw DriverException.notSupported("set options");
    }

    default void click(ClickOptions options) {
        throw DriverException.notSupported("click options");
    }

    default void rightClick(ClickOptions options) {
        throw DriverException.notSupported("right_click options");
    }

    default void doubleClick(ClickOptions options) {
        throw DriverException.notSupported("double_click options");
    }

    // ── Scoped lookup ─────────────────────────────────────────────────────────

    /** All descendants of this node matching the locator, in document order. */
    List<NodeBinding> findAll(Locator locator);

    // ── Capabilities ──────────────────────────────────────────────────────────

    /**
     * The extended forms this binding accepts. Defaults to the class's
     * {@link SupportsExtended} declaration.
     */
    default DriverCapabilities capabilities() {
        return DriverCapabilities.declaredBy(getClass());
    }
}
