package com.elementanchor.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Extended arguments for click, right-click and double-click: modifier keys to hold
 * while clicking, and an optional offset from the element's top-left corner.
 *
 * When no offset is given drivers click the middle of the element.
 * {@link #none()} carries no extended arguments at all and always selects the
 * minimal click form.
 */
public final class ClickOptions {

    private static final ClickOptions NONE = new ClickOptions(EnumSet.noneOf(Modifier.class), null, null);

    private final Set<Modifier> modifiers;
    private final Integer x;
    private final Integer y;

    private ClickOptions(Set<Modifier> modifiers, Integer x, Integer y) {
        this.modifiers = Collections.unmodifiableSet(modifiers);
        this.x = x;
        this.y = y;
    }

    public static ClickOptions none() {
        return NONE;
    }

    public static ClickOptions modifiers(Modifier first, Modifier... rest) {
        return new ClickOptions(EnumSet.of(first, rest), null, null);
    }

    public static ClickOptions offset(int x, int y) {
        return new ClickOptions(EnumSet.noneOf(Modifier.class), x, y);
    }

    /** Returns a copy of these options with the given offset. */
    public ClickOptions withOffset(int x, int y) {
        Set<Modifier> copy = modifiers.isEmpty() ? EnumSet.noneOf(Modifier.class) : EnumSet.copyOf(modifiers);
        return new ClickOptions(copy, x, y);
    }

    public Set<Modifier> getModifiers() { return modifiers; }
    public Integer getX()               { return x; }
    public Integer getY()               { return y; }

    public boolean hasOffset() {
        return x != null && y != null;
    }

    /** True when neither modifiers nor an offset were supplied. */
    public boolean isEmpty() {
        return modifiers.isEmpty() && x == null && y == null;
    }

    @Override
    public String toString() {
        return hasOffset()
            ? String.format("ClickOptions{modifiers=%s, x=%d, y=%d}", modifiers, x, y)
            : String.format("ClickOptions{modifiers=%s}", modifiers);
    }
}
