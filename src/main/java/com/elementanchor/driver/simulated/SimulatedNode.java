package com.elementanchor.driver.simulated;

import com.elementanchor.driver.DriverErrorKind;
import com.elementanchor.driver.DriverException;
import com.elementanchor.model.Locator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One mutable node of a {@link SimulatedDocument}.
 *
 * Once detached (removed or re-rendered away) a node stays detached; bindings that
 * still point at it report {@link DriverErrorKind#STALE_REFERENCE}.
 */
public final class SimulatedNode {

    static final Set<String> SUPPORTED_KINDS = Set.of(
        Locator.ID, Locator.NAME, Locator.TAG, Locator.CLASS, Locator.TEXT);

    private final String tag;
    private final Map<String, String> attributes;
    private final String text;
    private final boolean hidden;
    private final boolean multiple;
    private final boolean readonly;
    private final List<SimulatedNode> children = new ArrayList<>();

    private SimulatedNode parent;
    private boolean detached;
    private String value;
    private boolean checked;
    private boolean selected;
    private boolean disabled;

    SimulatedNode(SimulatedNodeSpec spec) {
        this.tag        = Objects.requireNonNull(spec.getTag(), "tag is required").toLowerCase();
        this.attributes = new LinkedHashMap<>(spec.getAttributes());
        this.text       = spec.getText();
        this.hidden     = spec.isHidden();
        this.multiple   = spec.isMultiple();
        this.readonly   = spec.isReadonly();
        this.value      = spec.getValue() != null ? spec.getValue() : spec.getAttributes().get("value");
        this.checked    = spec.isChecked();
        this.selected   = spec.isSelected();
        this.disabled   = spec.isDisabled();
        for (SimulatedNodeSpec childSpec : spec.getChildren()) {
            appendChild(new SimulatedNode(childSpec));
        }
    }

    /** An attached deep copy carrying this node's current state. */
    SimulatedNode copy() {
        SimulatedNode clone = new SimulatedNode(shallowSpec());
        clone.value    = value;
        clone.checked  = checked;
        clone.selected = selected;
        clone.disabled = disabled;
        for (SimulatedNode child : children) {
            clone.appendChild(child.copy());
        }
        return clone;
    }

    private SimulatedNodeSpec shallowSpec() {
        SimulatedNodeSpec spec = new SimulatedNodeSpec(tag);
        spec.setAttributes(new LinkedHashMap<>(attributes));
        spec.setText(text);
        spec.setValue(value);
        spec.setHidden(hidden);
        spec.setMultiple(multiple);
        spec.setReadonly(readonly);
        return spec;
    }

    // ── Tree structure ────────────────────────────────────────────────────────

    void appendChild(SimulatedNode child) {
        child.parent = this;
        children.add(child);
    }

    void replaceChild(SimulatedNode old, SimulatedNode replacement) {
        int index = children.indexOf(old);
        if (index < 0) throw new IllegalArgumentException("Not a child of this node: " + old.tag);
        replacement.parent = this;
        children.set(index, replacement);
        old.detach();
    }

    void removeChild(SimulatedNode child) {
        if (children.remove(child)) {
            child.detach();
        }
    }

    private void detach() {
        detached = true;
        children.forEach(SimulatedNode::detach);
    }

    public boolean isAttached() {
        return !detached;
    }

    SimulatedNode getParent() {
        return parent;
    }

    SimulatedNode closest(String ancestorTag) {
        SimulatedNode current = parent;
        while (current != null && !current.tag.equals(ancestorTag)) {
            current = current.parent;
        }
        return current;
    }

    // ── Lookup ────────────────────────────────────────────────────────────────

    /** Descendants (not including this node) matching the locator, in document order. */
    List<SimulatedNode> findAll(Locator locator) {
        validate(locator);
        List<SimulatedNode> found = new ArrayList<>();
        collect(locator, found);
        return found;
    }

    /** Like {@link #findAll} but also considers this node itself. */
    List<SimulatedNode> findSelfOrDescendants(Locator locator) {
        validate(locator);
        List<SimulatedNode> found = new ArrayList<>();
        if (accepts(locator)) found.add(this);
        collect(locator, found);
        return found;
    }

    private void collect(Locator locator, List<SimulatedNode> found) {
        for (SimulatedNode child : children) {
            if (child.accepts(locator)) found.add(child);
            child.collect(locator, found);
        }
    }

    private boolean accepts(Locator locator) {
        return matches(locator) && (!locator.isVisibleOnly() || isVisible());
    }

    static void validate(Locator locator) {
        if (!SUPPORTED_KINDS.contains(locator.getKind())) {
            throw new DriverException(DriverErrorKind.INVALID_SELECTOR,
                "Simulated driver cannot resolve selector kind '" + locator.getKind() + "'");
        }
        if (locator.getValue().isBlank()) {
            throw new DriverException(DriverErrorKind.INVALID_SELECTOR,
                "Blank " + locator.getKind() + " selector");
        }
    }

    private boolean matches(Locator locator) {
        String expected = locator.getValue();
        switch (locator.getKind()) {
            case Locator.ID:
                return expected.equals(attributes.get("id"));
            case Locator.NAME:
                return expected.equals(attributes.get("name"));
            case Locator.TAG:
                return tag.equalsIgnoreCase(expected);
            case Locator.CLASS:
                String classes = attributes.getOrDefault("class", "");
                return Arrays.asList(classes.trim().split("\\s+")).contains(expected);
            case Locator.TEXT:
                return expected.equals(allText());
            default:
                return false;
        }
    }

    // ── State ─────────────────────────────────────────────────────────────────

    public String getTag()                 { return tag; }
    public String getAttribute(String n)   { return attributes.get(n); }
    public String getValue()               { return value; }
    public boolean isChecked()             { return checked; }
    public boolean isSelected()            { return selected; }
    public boolean isDisabled()            { return disabled; }
    public boolean isReadonly()            { return readonly; }
    public boolean isMultiple()            { return multiple; }

    void setValue(String value)            { this.value = value; }
    void setChecked(boolean checked)       { this.checked = checked; }
    void setSelected(boolean selected)     { this.selected = selected; }
    void setDisabled(boolean disabled)     { this.disabled = disabled; }

    public boolean isVisible() {
        for (SimulatedNode n = this; n != null; n = n.parent) {
            if (n.hidden) return false;
        }
        return true;
    }

    public String allText() {
        return gatherText(false);
    }

    public String visibleText() {
        return isVisible() ? gatherText(true) : "";
    }

    private String gatherText(boolean visibleOnly) {
        List<String> parts = new ArrayList<>();
        if (text != null && !text.isBlank()) parts.add(text.trim());
        for (SimulatedNode child : children) {
            if (visibleOnly && child.hidden) continue;
            String childText = child.gatherText(visibleOnly);
            if (!childText.isEmpty()) parts.add(childText);
        }
        return parts.stream().collect(Collectors.joining(" "));
    }

    /** Absolute XPath, indexing a step only when it has same-tag siblings. */
    public String path() {
        if (parent == null) return "/" + tag;
        List<SimulatedNode> sameTag = parent.children.stream()
            .filter(c -> c.tag.equals(tag))
            .toList();
        String step = sameTag.size() > 1 ? tag + "[" + (sameTag.indexOf(this) + 1) + "]" : tag;
        return parent.path() + "/" + step;
    }

    @Override
    public String toString() {
        return "SimulatedNode{" + tag + (attributes.isEmpty() ? "" : " " + attributes) + "}";
    }
}
