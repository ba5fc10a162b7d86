package com.glassbox.calc.namespace;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Categories of symbolic references, each with the grammar its keys follow.
 * <p>
 * The category is decided from the key's prefix; the pattern then checks the
 * positional part. A key that matches no category is not a reference.
 */
public enum RefCategory {
    CALCULATION("R", "R(\\d+)"),
    MODULE_OUTPUT("M", "M(\\d+)\\.(\\d+)"),
    VALUE_GROUP("V", "V(\\d+)(?:\\.(\\d+))?"),
    SERIES_GROUP("S", "S(\\d+)(?:\\.(\\d+))?"),
    CONSTANT_GROUP("C", "C(\\d+)(?:\\.(\\d+))?"),
    TIMING_GROUP("T", "T(\\d+)(?:\\.(\\d+))?"),
    LOOKUP_GROUP("L", "L(\\d+)(?:\\.(\\d+)(?:\\.(\\d+))?)?"),
    FLAG("F", "F(\\d+)(?:\\.(Start|End))?"),
    INDEX("I", "I(\\d+)"),
    TIME_CONSTANT("T.", "T\\.([A-Za-z]+)");

    private final String prefix;
    private final Pattern pattern;

    RefCategory(String prefix, String regex) {
        this.prefix = prefix;
        this.pattern = Pattern.compile(regex);
    }

    public String prefix() {
        return prefix;
    }

    Matcher matcher(String key) {
        return pattern.matcher(key);
    }

    /** True for the input-group categories (V, S, C, T, L). */
    public boolean isInputGroup() {
        return switch (this) {
            case VALUE_GROUP, SERIES_GROUP, CONSTANT_GROUP, TIMING_GROUP, LOOKUP_GROUP -> true;
            default -> false;
        };
    }

    /** Category whose grammar matches {@code key}, or null. */
    public static RefCategory classify(String key) {
        if (key == null || key.isEmpty())
            return null;
        if (key.startsWith("T.")) {
            return TIME_CONSTANT.pattern.matcher(key).matches() ? TIME_CONSTANT : null;
        }
        for (RefCategory c : values()) {
            if (c == TIME_CONSTANT || !key.startsWith(c.prefix))
                continue;
            if (c.pattern.matcher(key).matches())
                return c;
        }
        return null;
    }

    /** Group-ref prefix letter for an input addressing mode. */
    public static RefCategory forMode(InputMode mode) {
        return switch (mode) {
            case CONSTANT -> CONSTANT_GROUP;
            case VALUES -> VALUE_GROUP;
            case SERIES -> SERIES_GROUP;
            case LOOKUP -> LOOKUP_GROUP;
            case TIMING -> TIMING_GROUP;
        };
    }
}
