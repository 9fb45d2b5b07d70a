package com.elementanchor.driver.simulated;

import com.elementanchor.driver.DriverErrorKind;
import com.elementanchor.driver.DriverException;
import com.elementanchor.driver.NodeBinding;
import com.elementanchor.model.Locator;
import org.openqa.selenium.Keys;

import java.util.List;

/**
 * Binding to one {@link SimulatedNode}. Supports the minimal operation forms only.
 *
 * Two bindings are equal when they point at the same node, so a reload that finds
 * the very node it already had is recognised as "nothing changed".
 */
public class SimulatedNodeBinding implements NodeBinding {

    protected final SimulatedDriver driver;
    protected final SimulatedNode node;

    SimulatedNodeBinding(SimulatedDriver driver, SimulatedNode node) {
        this.driver = driver;
        this.node = node;
    }

    // ── Reads ─────────────────────────────────────────────────────────────────

    @Override
    public String attribute(String name) {
        driver.record("attribute", node, name);
        return node.getAttribute(name);
    }

    @Override
    public String allText() {
        driver.record("all_text", node, null);
        return node.allText();
    }

    @Override
    public String visibleText() {
        driver.record("visible_text", node, null);
        return node.visibleText();
    }

    @Override
    public String value() {
        driver.record("value", node, null);
        return node.getValue();
    }

    @Override
    public String tagName() {
        driver.record("tag_name", node, null);
        return node.getTag();
    }

    @Override
    public String path() {
        driver.record("path", node, null);
        if (!driver.isPathSupported()) throw DriverException.notSupported("path");
        return node.path();
    }

    @Override
    public boolean isVisible() {
        driver.record("visible", node, null);
        return node.isVisible();
    }

    @Override
    public boolean isChecked() {
        driver.record("checked", node, null);
        return node.isChecked();
    }

    @Override
    public boolean isSelected() {
        driver.record("selected", node, null);
        return node.isSelected();
    }

    @Override
    public boolean isDisabled() {
        driver.record("disabled", node, null);
        return node.isDisabled();
    }

    @Override
    public boolean isReadonly() {
        driver.record("readonly", node, null);
        return node.isReadonly();
    }

    @Override
    public boolean isMultiple() {
        driver.record("multiple", node, null);
        return node.isMultiple();
    }

    // ── Actions ───────────────────────────────────────────────────────────────

    @Override
    public void set(String value) {
        driver.record("set", node, value);
        applyValue(value);
    }

    protected void applyValue(String value) {
        if (isToggle()) {
            node.setChecked(Boolean.parseBoolean(value));
        } else {
            node.setValue(value);
        }
    }

    @Override
    public void selectOption() {
        driver.record("select_option", node, null);
        select();
    }

    private void select() {
        SimulatedNode select = node.closest("select");
        if (select != null && !select.isMultiple()) {
            for (SimulatedNode option : select.findAll(Locator.of(Locator.TAG, "option"))) {
                option.setSelected(false);
            }
        }
        node.setSelected(true);
    }

    @Override
    public void unselectOption() {
        driver.record("unselect_option", node, null);
        SimulatedNode select = node.closest("select");
        if (select == null || !select.isMultiple()) {
            throw new DriverException(DriverErrorKind.NOT_SUPPORTED,
                "Cannot unselect option from single select box");
        }
        node.setSelected(false);
    }

    @Override
    public void click() {
        driver.record("click", node, null);
        activate();
    }

    protected void activate() {
        if (node.isDisabled()) return;
        String type = node.getAttribute("type");
        if ("checkbox".equals(type)) {
            node.setChecked(!node.isChecked());
        } else if ("radio".equals(type)) {
            node.setChecked(true);
        } else if ("option".equals(node.getTag())) {
            select();
        }
    }

    @Override
    public void rightClick() {
        driver.record("right_click", node, null);
    }

    @Override
    public void doubleClick() {
        driver.record("double_click", node, null);
    }

    @Override
    public void hover() {
        driver.record("hover", node, null);
    }

    @Override
    public void trigger(String event) {
        driver.record("trigger", node, event);
    }

    @Override
    public void sendKeys(CharSequence... keys) {
        StringBuilder typed = new StringBuilder(node.getValue() != null ? node.getValue() : "");
        for (CharSequence key : keys) {
            for (int i = 0; i < key.length(); i++) {
                char c = key.charAt(i);
                if (c == Keys.BACK_SPACE.charAt(0)) {
                    if (typed.length() > 0) typed.setLength(typed.length() - 1);
                } else if (!isKeyCode(c)) {
                    typed.append(c);
                }
            }
        }
        driver.record("send_keys", node, String.join("", keys));
        node.setValue(typed.toString());
    }

    @Override
    public void dragTo(NodeBinding target) {
        if (!(target instanceof SimulatedNodeBinding)) {
            throw new IllegalArgumentException("Cannot drag a simulated node onto " + target.getClass().getName());
        }
        SimulatedNode destination = ((SimulatedNodeBinding) target).node;
        driver.record("drag_to", node, destination.isAttached() ? destination.path() : null);
        if (!destination.isAttached()) {
            throw new DriverException(DriverErrorKind.STALE_REFERENCE, "Drop target is no longer attached");
        }
    }

    // ── Lookup ────────────────────────────────────────────────────────────────

    @Override
    public List<NodeBinding> findAll(Locator locator) {
        driver.record("find_all", node, locator.toString());
        return driver.bindAll(node.findAll(locator));
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private static boolean isKeyCode(char c) {
        return c >= '\uE000' && c <= '\uF8FF';
    }

    private boolean isToggle() {
        String type = node.getAttribute("type");
        return "checkbox".equals(type) || "radio".equals(type);
    }

    // ── Identity ──────────────────────────────────────────────────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        return node == ((SimulatedNodeBinding) o).node;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(node);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + node + "}";
    }
}
