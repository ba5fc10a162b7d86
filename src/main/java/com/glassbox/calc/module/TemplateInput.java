package com.glassbox.calc.module;

/**
 * A named template parameter.
 *
 * @param defaultValue used when the module does not bind the key; null means required
 */
public record TemplateInput(String key, String defaultValue) {

    public static TemplateInput required(String key) {
        return new TemplateInput(key, null);
    }

    public static TemplateInput optional(String key, String defaultValue) {
        return new TemplateInput(key, defaultValue);
    }

    public boolean isRequired() {
        return defaultValue == null;
    }
}
