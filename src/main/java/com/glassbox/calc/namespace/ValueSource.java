package com.glassbox.calc.namespace;

/**
 * Anything that can hand out a period array for a reference key.
 * Returned arrays are shared and must be treated as read-only.
 */
@FunctionalInterface
public interface ValueSource {

    /** The array for {@code key}, or null when the key is not defined here. */
    double[] lookup(String key);

    /** Consults this source first, then {@code fallback}. */
    default ValueSource orElse(ValueSource fallback) {
        return key -> {
            double[] v = lookup(key);
            return v != null ? v : fallback.lookup(key);
        };
    }
}
