package com.elementanchor.driver.simulated;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON description of one node of a simulated document.
 *
 * <pre>
 *   {
 *     "tag": "input",
 *     "attributes": { "id": "name", "type": "text" },
 *     "value": "",
 *     "readonly": false
 *   }
 * </pre>
 *
 * Every field except {@code tag} is optional.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SimulatedNodeSpec {

    private String tag;
    private Map<String, String> attributes = new LinkedHashMap<>();
    private String text;                   // Own text, rendered before children's text
    private String value;                  // Form value; falls back to the "value" attribute
    private boolean hidden;                // Hidden nodes hide their whole subtree
    private boolean checked;
    private boolean selected;
    private boolean disabled;
    private boolean readonly;
    private boolean multiple;
    private List<SimulatedNodeSpec> children = new ArrayList<>();

    public SimulatedNodeSpec() {}

    public SimulatedNodeSpec(String tag) {
        this.tag = tag;
    }

    // ── Fluent helpers for building fixtures in code ──────────────────────────

    public SimulatedNodeSpec attr(String name, String val) { attributes.put(name, val); return this; }
    public SimulatedNodeSpec child(SimulatedNodeSpec c)    { children.add(c); return this; }
    public SimulatedNodeSpec withText(String t)            { this.text = t; return this; }
    public SimulatedNodeSpec withValue(String v)           { this.value = v; return this; }

    // ── Getters / Setters ─────────────────────────────────────────────────────

    public String getTag()                             { return tag; }
    public void setTag(String tag)                     { this.tag = tag; }
    public Map<String, String> getAttributes()         { return attributes; }
    public void setAttributes(Map<String, String> a)   { this.attributes = a != null ? a : new LinkedHashMap<>(); }
    public String getText()                            { return text; }
    public void setText(String text)                   { this.text = text; }
    public String getValue()                           { return value; }
    public void setValue(String value)                 { this.value = value; }
    public boolean isHidden()                          { return hidden; }
    public void setHidden(boolean hidden)              { this.hidden = hidden; }
    public boolean isChecked()                         { return checked; }
    public void setChecked(boolean checked)            { this.checked = checked; }
    public boolean isSelected()                        { return selected; }
    public void setSelected(boolean selected)          { this.selected = selected; }
    public boolean isDisabled()                        { return disabled; }
    public void setDisabled(boolean disabled)          { this.disabled = disabled; }
    public boolean isReadonly()                        { return readonly; }
    public void setReadonly(boolean readonly)          { this.readonly = readonly; }
    public boolean isMultiple()                        { return multiple; }
    public void setMultiple(boolean multiple)          { this.multiple = multiple; }
    public List<SimulatedNodeSpec> getChildren()       { return children; }
    public void setChildren(List<SimulatedNodeSpec> c) { this.children = c != null ? c : new ArrayList<>(); }
}
