package com.glassbox.calc.util;

import java.util.ArrayList;
import java.util.List;

import com.glassbox.calc.engine.Calculation;
import com.glassbox.calc.engine.CalculationResult;
import com.glassbox.calc.engine.EvaluationPlan;
import com.glassbox.calc.engine.EvaluationUnit;
import com.glassbox.calc.engine.ResultTable;
import com.glassbox.calc.timeline.Timeline;

/**
 * Diagnostic utility for inspecting a schedule and its results.
 *
 * <p>
 * Intended for debugging sessions and error reports. Allocates freely; keep it
 * out of evaluation loops.
 */
public final class ModelExplain {
    private static final int PREVIEW_PERIODS = 6;

    private final EvaluationPlan plan;
    private final ResultTable results;
    private final Timeline timeline;

    public ModelExplain(EvaluationPlan plan) {
        this(plan, null, null);
    }

    /** {@code results} and {@code timeline} may be null before a run. */
    public ModelExplain(EvaluationPlan plan, ResultTable results, Timeline timeline) {
        this.plan = plan;
        this.results = results;
        this.timeline = timeline;
    }

    /**
     * Dumps one calculation: formula, dependencies both ways, its place in the
     * order and, after a run, its outcome.
     */
    public String explainCalculation(int id) {
        Calculation calc = plan.calculation(id);
        if (calc == null)
            throw new IllegalArgumentException("Unknown calculation: R" + id);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Calculation: R").append(id).append(" (").append(calc.name()).append(")\n")
                .append("  Formula: ").append(calc.formula()).append('\n')
                .append("  Type: ").append(calc.type().id()).append('\n')
                .append("  Order index: ").append(plan.order().indexOf(id)).append('\n');
        if (plan.isCyclic(id))
            sb.append("  Cyclic: yes\n");
        for (EvaluationUnit u : plan.clusters()) {
            if (u.ids().contains(id))
                sb.append("  Lag cluster: ").append(refs(u.ids())).append('\n');
        }
        if (plan.parseError(id) != null)
            sb.append("  Parse error: ").append(plan.parseError(id).getMessage()).append('\n');
        sb.append("  Reads: ").append(refs(plan.samePeriodDependencies(id))).append('\n')
                .append("  Reads lagged: ").append(refs(plan.laggedDependencies(id))).append('\n')
                .append("  Read by: ").append(refs(dependents(id))).append('\n');

        CalculationResult r = results == null ? null : results.get(id);
        if (r != null) {
            if (!r.isOk())
                sb.append("  Error: ").append(r.error()).append('\n');
            for (String w : r.warnings())
                sb.append("  Warning: ").append(w).append('\n');
            sb.append("  Values: ").append(preview(r.values())).append('\n');
        }
        return sb.toString();
    }

    /** Calculations that read {@code id}, in input order. */
    public List<Integer> dependents(int id) {
        List<Integer> out = new ArrayList<>();
        for (int other : plan.calculations().keySet()) {
            if (plan.samePeriodDependencies(other).contains(id) || plan.laggedDependencies(other).contains(id))
                out.add(other);
        }
        return out;
    }

    /**
     * Dumps the evaluation order, one unit per line, followed by any cycles.
     */
    public String dumpOrder() {
        StringBuilder sb = new StringBuilder(1024);
        List<EvaluationUnit> units = plan.units();
        sb.append("Plan (").append(plan.calculations().size()).append(" calculations, ")
                .append(units.size()).append(" units):\n");
        for (int i = 0; i < units.size(); i++) {
            EvaluationUnit u = units.get(i);
            sb.append("  [").append(i).append("] ");
            if (u.cluster()) {
                sb.append("cluster ").append(refs(u.ids()));
            } else {
                int id = u.ids().get(0);
                sb.append('R').append(id).append(' ').append(plan.calculation(id).name());
                List<Integer> reads = plan.samePeriodDependencies(id);
                if (!reads.isEmpty())
                    sb.append(" <- ").append(refs(reads));
            }
            sb.append('\n');
        }
        for (List<Integer> cycle : plan.cycles())
            sb.append("  cycle ").append(refs(cycle)).append('\n');
        return sb.toString();
    }

    /**
     * Generates a Mermaid graph. Same-period reads are solid edges, lagged reads
     * dotted; cyclic calculations are styled apart.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");
        for (Calculation c : plan.calculations().values()) {
            sb.append("  R").append(c.id()).append("[\"R").append(c.id()).append(": ")
                    .append(escape(c.name())).append("\"];\n");
        }
        for (Calculation c : plan.calculations().values()) {
            for (int dep : plan.samePeriodDependencies(c.id()))
                sb.append("  R").append(dep).append(" --> R").append(c.id()).append(";\n");
            for (int dep : plan.laggedDependencies(c.id()))
                sb.append("  R").append(dep).append(" -.-> R").append(c.id()).append(";\n");
        }
        for (List<Integer> cycle : plan.cycles()) {
            for (int id : cycle)
                sb.append("  style R").append(id).append(" stroke:#c00;\n");
        }
        return sb.toString();
    }

    private String preview(double[] values) {
        StringBuilder sb = new StringBuilder();
        int n = Math.min(values.length, PREVIEW_PERIODS);
        for (int p = 0; p < n; p++) {
            if (p > 0)
                sb.append(", ");
            if (timeline != null)
                sb.append(timeline.label(p)).append('=');
            sb.append(String.format("%.4f", values[p]));
        }
        if (values.length > n)
            sb.append(", ... (").append(values.length).append(" periods)");
        return sb.toString();
    }

    private static String refs(List<Integer> ids) {
        if (ids.isEmpty())
            return "-";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < ids.size(); i++) {
            if (i > 0)
                sb.append(", ");
            sb.append('R').append(ids.get(i));
        }
        return sb.toString();
    }

    private static String escape(String name) {
        return name == null ? "" : name.replace("\"", "'");
    }
}
