package com.elementanchor.model;

/**
 * Keys that may be held down while a click is performed.
 */
public enum Modifier {
    ALT,
    CONTROL,
    META,
    SHIFT
}
