package com.glassbox.calc.namespace;

import java.util.Locale;

/**
 * Type tag carried by every resolved period array.
 * FLOW sums when aggregated; STOCK and STOCK_START take a representative period.
 */
public enum SeriesType {
    FLOW, STOCK, STOCK_START, FLAG, RATIO, FLOW_CONVERTER;

    public static SeriesType fromString(String s) {
        if (s == null || s.isBlank())
            return FLOW;
        String v = s.trim().toUpperCase(Locale.ROOT);
        if (v.equals("FLOWCONVERTER"))
            return FLOW_CONVERTER;
        try {
            return valueOf(v);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown series type: " + s, e);
        }
    }

    public String id() {
        return this == FLOW_CONVERTER ? "flowConverter" : name().toLowerCase(Locale.ROOT);
    }
}
