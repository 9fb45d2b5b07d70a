package com.elementanchor.model;

/**
 * Which text an element read should return.
 *
 *   ALL      -- every text node, including text inside hidden descendants
 *   VISIBLE  -- only text a user could see
 */
public enum TextType {
    ALL,
    VISIBLE
}
