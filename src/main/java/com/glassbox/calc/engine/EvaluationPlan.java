package com.glassbox.calc.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.glassbox.calc.expr.Formula;
import com.glassbox.calc.expr.FormulaSyntaxException;

/**
 * Output of the {@link Scheduler}: what to evaluate, in which order, and what
 * could not be ordered.
 */
public final class EvaluationPlan {
    private final Map<Integer, Calculation> calculations;
    private final Map<Integer, Formula> formulas;
    private final Map<Integer, FormulaSyntaxException> parseErrors;
    private final Map<Integer, List<Integer>> samePeriodDeps;
    private final Map<Integer, List<Integer>> laggedDeps;
    private final List<EvaluationUnit> units;
    private final List<List<Integer>> cycles;

    EvaluationPlan(Map<Integer, Calculation> calculations, Map<Integer, Formula> formulas,
            Map<Integer, FormulaSyntaxException> parseErrors, Map<Integer, List<Integer>> samePeriodDeps,
            Map<Integer, List<Integer>> laggedDeps, List<EvaluationUnit> units, List<List<Integer>> cycles) {
        this.calculations = Collections.unmodifiableMap(calculations);
        this.formulas = Collections.unmodifiableMap(formulas);
        this.parseErrors = Collections.unmodifiableMap(parseErrors);
        this.samePeriodDeps = Collections.unmodifiableMap(samePeriodDeps);
        this.laggedDeps = Collections.unmodifiableMap(laggedDeps);
        this.units = List.copyOf(units);
        this.cycles = List.copyOf(cycles);
    }

    /** Calculations by id, in input order. */
    public Map<Integer, Calculation> calculations() {
        return calculations;
    }

    public Calculation calculation(int id) {
        return calculations.get(id);
    }

    /** Parsed formula, or null when it failed to parse. */
    public Formula formula(int id) {
        return formulas.get(id);
    }

    public FormulaSyntaxException parseError(int id) {
        return parseErrors.get(id);
    }

    public List<Integer> samePeriodDependencies(int id) {
        return samePeriodDeps.getOrDefault(id, List.of());
    }

    public List<Integer> laggedDependencies(int id) {
        return laggedDeps.getOrDefault(id, List.of());
    }

    public List<EvaluationUnit> units() {
        return units;
    }

    /** Same-period cycles, each listed in input order. */
    public List<List<Integer>> cycles() {
        return cycles;
    }

    public boolean isCyclic(int id) {
        for (List<Integer> c : cycles) {
            if (c.contains(id))
                return true;
        }
        return false;
    }

    public List<EvaluationUnit> clusters() {
        List<EvaluationUnit> out = new ArrayList<>();
        for (EvaluationUnit u : units) {
            if (u.cluster())
                out.add(u);
        }
        return out;
    }

    /** Calculation ids in evaluation order, cluster members inline. */
    public List<Integer> order() {
        List<Integer> out = new ArrayList<>();
        for (EvaluationUnit u : units)
            out.addAll(u.ids());
        return out;
    }
}
