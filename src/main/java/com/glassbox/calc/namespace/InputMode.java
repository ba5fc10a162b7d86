package com.glassbox.calc.namespace;

import java.util.Locale;

/** Addressing mode shared by the inputs of one input group. */
public enum InputMode {
    CONSTANT, VALUES, SERIES, LOOKUP, TIMING;

    /** Parses {@code constant}, {@code values}, {@code series}, {@code lookup} (or {@code lookup2}), {@code timing}. */
    public static InputMode fromString(String s) {
        if (s == null || s.isBlank())
            return VALUES;
        String v = s.trim().toLowerCase(Locale.ROOT);
        if (v.equals("lookup2"))
            return LOOKUP;
        try {
            return valueOf(v.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown input mode: " + s, e);
        }
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
