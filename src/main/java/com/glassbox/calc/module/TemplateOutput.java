package com.glassbox.calc.module;

import com.glassbox.calc.namespace.SeriesType;

/**
 * One output of a module template. {@code formula} may contain placeholders
 * ({@code $input.X}, {@code $self.Y}, {@code $M2.key}, {@code M_SELF.1}) and
 * {@code {Name}} symbols.
 *
 * @param solver the value is filled by an external solver; the formula is a placeholder
 */
public record TemplateOutput(String key, String name, SeriesType type, String formula, boolean solver,
        String description) {

    public static TemplateOutput of(String key, String name, SeriesType type, String formula) {
        return new TemplateOutput(key, name, type, formula, false, null);
    }

    public TemplateOutput describedAs(String text) {
        return new TemplateOutput(key, name, type, formula, solver, text);
    }

    public TemplateOutput asSolver() {
        return new TemplateOutput(key, name, type, formula, true, description);
    }
}
