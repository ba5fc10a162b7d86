package com.glassbox.calc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.glassbox.calc.engine.Calculation;
import com.glassbox.calc.engine.CalculationEngine;
import com.glassbox.calc.engine.CalculationListener;
import com.glassbox.calc.engine.CalculationResult;
import com.glassbox.calc.engine.EvaluationPlan;
import com.glassbox.calc.engine.ResultTable;
import com.glassbox.calc.engine.Scheduler;
import com.glassbox.calc.expr.FormulaEvaluator;
import com.glassbox.calc.io.EngineSettings;
import com.glassbox.calc.io.EngineSettingsLoader;
import com.glassbox.calc.module.TemplateRegistry;
import com.glassbox.calc.namespace.AliasTable;
import com.glassbox.calc.namespace.NamespaceBuilder;
import com.glassbox.calc.namespace.ReferenceNamespace;
import com.glassbox.calc.namespace.SeriesType;
import com.glassbox.calc.recipe.Recipe;
import com.glassbox.calc.recipe.Recipe.CalculationDef;
import com.glassbox.calc.spec.CompiledRecipe;
import com.glassbox.calc.spec.ModelSpec;
import com.glassbox.calc.spec.SpecCompiler;
import com.glassbox.calc.timeline.Timeline;
import com.glassbox.calc.util.CompositeCalculationListener;
import com.glassbox.calc.util.Diagnostic;
import com.glassbox.calc.util.Diagnostic.Kind;
import com.glassbox.calc.util.Diagnostics;
import com.glassbox.calc.validation.ModelValidator;
import com.glassbox.calc.validation.ValidationReport;

import lombok.extern.log4j.Log4j2;

/**
 * Glassbox calculation engine: monthly time-series financial models.
 *
 * <p>
 * A model goes through these stages:
 * <ul>
 * <li><b>Compile</b>: a {@link ModelSpec} written with names and symbolic
 * dates becomes an addressed {@link Recipe}; modules are expanded into
 * calculations.</li>
 * <li><b>Resolve</b>: inputs, flags, indices and time constants become the
 * {@link ReferenceNamespace}.</li>
 * <li><b>Schedule</b>: calculations are ordered by dependency; same-period
 * cycles are isolated and lag clusters identified.</li>
 * <li><b>Evaluate</b>: each calculation is published once to the result table.</li>
 * <li><b>Validate</b>: balance, covenant and IRR checks declared by the model.</li>
 * </ul>
 *
 * Only structural problems throw. Everything else is reported through the
 * diagnostics of the returned {@link ModelRun}.
 */
@Log4j2
public final class GlassboxModel {
    private final EngineSettings settings;
    private final SpecCompiler compiler;
    private final FormulaEvaluator evaluator;
    private CalculationListener listener;

    /** Settings from {@code glassbox-engine.json} on the classpath, or defaults. */
    public GlassboxModel() {
        this(EngineSettingsLoader.load());
    }

    public GlassboxModel(EngineSettings settings) {
        this(settings, new TemplateRegistry());
    }

    public GlassboxModel(EngineSettings settings, TemplateRegistry templates) {
        this.settings = settings;
        this.compiler = new SpecCompiler(templates);
        this.evaluator = new FormulaEvaluator(settings.formulaLimits());
    }

    /** Replaces every listener with {@code listener}, or removes them all when null. */
    public GlassboxModel setListener(CalculationListener listener) {
        this.listener = listener;
        return this;
    }

    /** Adds {@code listener} after the ones already registered. */
    public GlassboxModel addListener(CalculationListener listener) {
        if (listener == null)
            throw new IllegalArgumentException("listener is required");
        if (this.listener == null)
            this.listener = listener;
        else if (this.listener instanceof CompositeCalculationListener composite)
            composite.add(listener);
        else
            this.listener = CompositeCalculationListener.of(this.listener, listener);
        return this;
    }

    public EngineSettings settings() {
        return settings;
    }

    public CompiledRecipe compile(ModelSpec spec) {
        return compiler.compile(spec);
    }

    /** Compiles and evaluates; compile diagnostics come first in the run's list. */
    public ModelRun run(ModelSpec spec) {
        CompiledRecipe compiled = compile(spec);
        return run(compiled.recipe(), compiled.diagnostics());
    }

    public ModelRun run(Recipe recipe) {
        return run(recipe, List.of());
    }

    private ModelRun run(Recipe recipe, List<Diagnostic> prior) {
        Timeline timeline = NamespaceBuilder.timelineOf(recipe);
        ReferenceNamespace namespace = NamespaceBuilder.build(recipe, timeline);
        AliasTable aliases = AliasTable.of(recipe, namespace);
        if (!aliases.isEmpty())
            log.debug("Aliases: {}", aliases);

        Diagnostics diagnostics = new Diagnostics(null);
        diagnostics.addAll(prior);
        List<Calculation> calculations = new ArrayList<>(recipe.getCalculations().size());
        for (CalculationDef def : recipe.getCalculations()) {
            String formula = def.getFormula() == null || def.getFormula().isBlank() ? "0" : def.getFormula();
            calculations.add(new Calculation(def.getId(), def.getName(), aliases.rewrite(formula),
                    typeOf(def), def.isSolver()));
        }

        Map<String, String> moduleRefs = recipe.getModuleRefs();
        EvaluationPlan plan = new Scheduler(evaluator).plan(calculations, moduleRefs);
        CalculationEngine engine = new CalculationEngine(evaluator, settings.getErrorLogIntervalMillis());
        engine.setListener(listener);
        ResultTable results = engine.run(plan, namespace, timeline, moduleRefs);

        for (CalculationResult r : results.all()) {
            if (!r.isOk())
                diagnostics.error(r.errorKind() == null ? Kind.ARITHMETIC_FAULT : r.errorKind(), r.ref(), r.error());
            for (String w : r.warnings())
                diagnostics.warn(Kind.UPSTREAM_ERROR, r.ref(), w);
        }

        ModelValidator validator = new ModelValidator(settings.getBalanceTolerance(), settings.getIrrMaxIterations(),
                settings.getIrrTolerance());
        ValidationReport report = validator.validate(recipe.getValidation(),
                results.orElse(key -> namespace.lookup(aliases.resolve(key))), timeline);

        log.info("Evaluated {} calculations over {}: {} failed", results.size(), timeline, results.failures().size());
        return new ModelRun(recipe, namespace, aliases, plan, results, diagnostics.list(), report);
    }

    private static SeriesType typeOf(CalculationDef def) {
        try {
            return SeriesType.fromString(def.getType());
        } catch (IllegalArgumentException e) {
            log.warn("R{} ({}): {}, treating as flow", def.getId(), def.getName(), e.getMessage());
            return SeriesType.FLOW;
        }
    }
}
