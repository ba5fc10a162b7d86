package com.glassbox.calc.engine;

import com.glassbox.calc.namespace.SeriesType;

/**
 * One calculation to schedule and evaluate; published as {@code R{id}}.
 *
 * @param solver output is produced by an external solver; the formula is a placeholder
 */
public record Calculation(int id, String name, String formula, SeriesType type, boolean solver) {

    public Calculation(int id, String name, String formula) {
        this(id, name, formula, SeriesType.FLOW, false);
    }

    public String ref() {
        return "R" + id;
    }

    /** Same calculation with another formula. */
    public Calculation withFormula(String newFormula) {
        return new Calculation(id, name, newFormula, type, solver);
    }
}
