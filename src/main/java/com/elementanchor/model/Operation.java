package com.elementanchor.model;

/**
 * Operations that have both a minimal form and an extended, argument-carrying form.
 *
 *   CLICK         -- click() vs click(modifiers, offset)
 *   RIGHT_CLICK   -- rightClick() vs rightClick(modifiers, offset)
 *   DOUBLE_CLICK  -- doubleClick() vs doubleClick(modifiers, offset)
 *   SET           -- set(value) vs set(value, driver options)
 *
 * Driver bindings declare which extended forms they accept; see
 * {@link com.elementanchor.driver.SupportsExtended}.
 */
public enum Operation {
    CLICK("click"),
    RIGHT_CLICK("right_click"),
    DOUBLE_CLICK("double_click"),
    SET("set");

    private final String displayName;

    Operation(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() { return displayName; }
}
