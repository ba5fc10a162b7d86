package com.glassbox.calc.expr;

import java.util.Locale;

/**
 * Functions whose value at a period depends on other periods of their
 * argument.
 */
enum ArrayFunction {
    /** Running total including the current period. */
    CUMSUM,
    /** Running product including the current period. */
    CUMPROD,
    /** Running total that only moves at a year change, by the prior year's first value. */
    CUMSUM_Y,
    /** Running product that only moves at a year change, by the prior year's first value. */
    CUMPROD_Y,
    /** Running total of earlier periods only. */
    PREVSUM,
    /** Value one period earlier, 0 in the first period. */
    PREVVAL,
    /** Value n periods earlier, 0 before the start. */
    SHIFT,
    /** Running count of non-zero periods. */
    COUNT,
    /** Largest value over the whole horizon, in every period. */
    MAXVAL,
    /** Sum of the window of n periods starting at the current one. */
    FWDSUM;

    static ArrayFunction lookup(String name) {
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** Takes a second, window argument. */
    boolean windowed() {
        return this == SHIFT || this == FWDSUM;
    }

    /** Reads only earlier periods of its value argument. */
    boolean lagging() {
        return this == SHIFT || this == PREVVAL || this == PREVSUM;
    }
}
