package com.glassbox.calc.engine;

import java.util.List;

import com.glassbox.calc.util.Diagnostic.Kind;

/**
 * Values of one calculation after a run. A failed calculation has all-zero
 * values and a non-null {@code error}. Warnings do not affect the values.
 */
public record CalculationResult(int id, String name, double[] values, String error, Kind errorKind,
        List<String> warnings) {

    public CalculationResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean isOk() {
        return error == null;
    }

    public String ref() {
        return "R" + id;
    }
}
