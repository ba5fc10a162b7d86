package com.glassbox.calc.namespace;

import java.util.regex.Matcher;

/**
 * A parsed reference key such as {@code V1.3}, {@code F2.Start}, {@code R195}
 * or {@code M3.1}.
 */
public record Ref(RefCategory category, String key) {

    public Ref {
        if (category == null || key == null)
            throw new IllegalArgumentException("category and key are required");
    }

    /** Parses a key, returning null when it is not a reference. */
    public static Ref parse(String key) {
        RefCategory c = RefCategory.classify(key);
        return c == null ? null : new Ref(c, key);
    }

    public static boolean isReference(String key) {
        return RefCategory.classify(key) != null;
    }

    public static Ref calculation(int id) {
        return new Ref(RefCategory.CALCULATION, "R" + id);
    }

    /**
     * Calculation ID of an {@code R} reference, or -1 when the number is too
     * large for an int. No calculation carries such an id, so callers treat it
     * as an unknown reference.
     */
    public int calculationId() {
        if (category != RefCategory.CALCULATION)
            throw new IllegalStateException("Not a calculation reference: " + key);
        try {
            return Integer.parseInt(key.substring(1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /** First positional number after the prefix ({@code 3} for {@code M3.1} or {@code V3}). */
    public int primaryIndex() {
        Matcher m = category.matcher(key);
        if (!m.matches() || category == RefCategory.TIME_CONSTANT)
            throw new IllegalStateException("No positional index in " + key);
        return Integer.parseInt(m.group(1));
    }

    @Override
    public String toString() {
        return key;
    }
}
