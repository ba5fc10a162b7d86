package com.glassbox.calc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.glassbox.calc.engine.Calculation;
import com.glassbox.calc.engine.CalculationResult;
import com.glassbox.calc.engine.EvaluationPlan;
import com.glassbox.calc.engine.EvaluationUnit;
import com.glassbox.calc.engine.ResultTable;
import com.glassbox.calc.namespace.AliasTable;
import com.glassbox.calc.namespace.ReferenceNamespace;
import com.glassbox.calc.recipe.Recipe;
import com.glassbox.calc.timeline.Timeline;
import com.glassbox.calc.util.Diagnostic;
import com.glassbox.calc.util.ModelExplain;
import com.glassbox.calc.validation.ValidationReport;

/**
 * Everything one evaluation of a recipe produced.
 *
 * @param aliases     authoring references rewritten to positional ones before scheduling
 * @param diagnostics compile findings (when run from a specification), then per-calculation
 *                    errors and upstream warnings
 */
public record ModelRun(Recipe recipe, ReferenceNamespace namespace, AliasTable aliases, EvaluationPlan plan,
        ResultTable results, List<Diagnostic> diagnostics, ValidationReport validation) {

    public ModelRun {
        diagnostics = List.copyOf(diagnostics);
    }

    public Timeline timeline() {
        return namespace.timeline();
    }

    /**
     * Copy of a series by reference: a calculation {@code R{id}}, a module
     * output {@code M{n}.{k}}, or any namespace key. Authoring references are
     * accepted through the alias table.
     */
    public double[] values(String ref) {
        double[] v = results.values(ref);
        if (v != null)
            return v;
        return namespace.values(aliases.resolve(ref));
    }

    public CalculationResult result(int id) {
        return results.get(id);
    }

    public Map<String, String> moduleRefs() {
        return results.moduleRefs();
    }

    /** Formula as evaluated, after alias rewriting. */
    public String formula(int id) {
        Calculation c = plan.calculation(id);
        return c == null ? null : c.formula();
    }

    public String type(int id) {
        Calculation c = plan.calculation(id);
        return c == null ? null : c.type().id();
    }

    public List<Integer> order() {
        return plan.order();
    }

    public List<List<Integer>> clusters() {
        List<List<Integer>> out = new ArrayList<>();
        for (EvaluationUnit u : plan.clusters())
            out.add(u.ids());
        return out;
    }

    public List<Diagnostic> errors() {
        List<Diagnostic> out = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            if (d.isError())
                out.add(d);
        }
        return out;
    }

    public ModelExplain explain() {
        return new ModelExplain(plan, results, timeline());
    }
}
