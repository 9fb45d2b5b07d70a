package com.elementanchor.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of how an element was found: the selector kind, the selector
 * value and the lookup options that were in effect.
 *
 * A handle keeps its Locator for its whole lifetime and replays it against its scope
 * when the underlying binding has gone stale.
 *
 * <pre>
 *   Locator login = Locator.builder()
 *       .kind(Locator.CSS)
 *       .value("#login")
 *       .option(Locator.OPTION_VISIBLE, true)
 *       .build();
 * </pre>
 */
public final class Locator {

    public static final String CSS       = "css";
    public static final String XPATH     = "xpath";
    public static final String ID        = "id";
    public static final String NAME      = "name";
    public static final String TAG       = "tag";
    public static final String CLASS     = "class";
    public static final String TEXT      = "text";
    public static final String LINK_TEXT = "link_text";

    /** Option key: when {@code true}, only visible nodes match. */
    public static final String OPTION_VISIBLE = "visible";

    private final String kind;
    private final String value;
    private final Map<String, Object> options;

    private Locator(String kind, String value, Map<String, Object> options) {
        this.kind    = kind;
        this.value   = value;
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static Locator of(String kind, String value) {
        return builder().kind(kind).value(value).build();
    }

    public static Locator css(String selector)  { return of(CSS, selector); }
    public static Locator xpath(String path)     { return of(XPATH, path); }
    public static Locator id(String id)          { return of(ID, id); }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String getKind()                  { return kind; }
    public String getValue()                 { return value; }
    public Map<String, Object> getOptions()  { return options; }

    public Object getOption(String key, Object defaultValue) {
        return options.getOrDefault(key, defaultValue);
    }

    /** True when the {@link #OPTION_VISIBLE} option is present and {@code true}. */
    public boolean isVisibleOnly() {
        return Boolean.TRUE.equals(options.get(OPTION_VISIBLE));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Locator)) return false;
        Locator other = (Locator) o;
        return kind.equals(other.kind) && value.equals(other.value) && options.equals(other.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, options);
    }

    @Override
    public String toString() {
        return options.isEmpty()
            ? String.format("%s '%s'", kind, value)
            : String.format("%s '%s' %s", kind, value, options);
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private String kind;
        private String value;
        private final Map<String, Object> options = new LinkedHashMap<>();

        public Builder kind(String kind)                   { this.kind = kind; return this; }
        public Builder value(String value)                 { this.value = value; return this; }
        public Builder option(String key, Object value)    { this.options.put(key, value); return this; }
        public Builder options(Map<String, Object> opts)   { if (opts != null) this.options.putAll(opts); return this; }

        public Locator build() {
            if (kind == null || kind.isBlank()) throw new IllegalStateException("kind is required");
            if (value == null) throw new IllegalStateException("value is required");
            return new Locator(kind, value, options);
        }
    }
}
