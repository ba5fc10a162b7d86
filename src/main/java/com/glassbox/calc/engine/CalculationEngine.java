package com.glassbox.calc.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.glassbox.calc.expr.BoundFormula;
import com.glassbox.calc.expr.EvalResult;
import com.glassbox.calc.expr.EvaluationException;
import com.glassbox.calc.expr.Formula;
import com.glassbox.calc.expr.FormulaEvaluator;
import com.glassbox.calc.expr.FormulaSyntaxException;
import com.glassbox.calc.namespace.Ref;
import com.glassbox.calc.namespace.RefCategory;
import com.glassbox.calc.namespace.ValueSource;
import com.glassbox.calc.timeline.Timeline;
import com.glassbox.calc.util.Diagnostic.Kind;
import com.glassbox.calc.util.ErrorRateLimiter;

import lombok.extern.log4j.Log4j2;

/**
 * Evaluates an {@link EvaluationPlan} into a {@link ResultTable}.
 *
 * Algorithm:
 *
 * 1. Publish every member of a same-period cycle as failed with a zero array,
 * so that anything reading it still resolves.
 *
 * 2. Walk the units in plan order. A single calculation is evaluated over the
 * whole horizon against the results published so far, then the inputs.
 *
 * 3. A lag cluster gets a zero buffer per member. For each period, members
 * are evaluated in order and their value written into the buffer, so a lagged
 * read of another member sees the periods already filled. Buffers are
 * published once the last period is done.
 *
 * Failure isolation:
 * A failing calculation is published with zeros and an error; the run
 * continues. Anything that read a failed calculation gets a warning naming it.
 * Each result is published exactly once.
 */
@Log4j2
public final class CalculationEngine {
    private final FormulaEvaluator evaluator;
    private final ErrorRateLimiter errorLog;
    private CalculationListener listener;

    public CalculationEngine(FormulaEvaluator evaluator) {
        this(evaluator, 1000);
    }

    public CalculationEngine(FormulaEvaluator evaluator, long errorLogIntervalMillis) {
        this.evaluator = evaluator;
        this.errorLog = new ErrorRateLimiter(log, errorLogIntervalMillis);
    }

    public void setListener(CalculationListener listener) {
        this.listener = listener;
    }

    public ResultTable run(EvaluationPlan plan, ValueSource inputs, Timeline timeline,
            Map<String, String> moduleRefs) {
        Run run = new Run(plan, inputs, timeline, new ResultTable(moduleRefs));
        final CalculationListener l = this.listener;
        if (l != null)
            l.onRunStart(plan.calculations().size());

        for (List<Integer> cycle : plan.cycles()) {
            String msg = "Circular dependency detected: " + Scheduler.refs(cycle);
            for (int id : cycle)
                run.publish(id, timeline.zeros(), msg, Kind.CIRCULAR_DEPENDENCY, 0);
        }

        for (EvaluationUnit unit : plan.units()) {
            if (unit.cluster())
                run.evaluateCluster(unit.ids());
            else
                run.evaluateSingle(unit.ids().get(0));
        }

        if (l != null)
            l.onRunEnd(run.evaluated, run.failed.size());
        log.debug("Run complete: {} evaluated, {} failed", run.evaluated, run.failed.size());
        return run.results;
    }

    /** State of one run. */
    private final class Run {
        final EvaluationPlan plan;
        final Timeline timeline;
        final ResultTable results;
        final ValueSource source;
        final Set<Integer> failed = new HashSet<>();
        int evaluated;

        Run(EvaluationPlan plan, ValueSource inputs, Timeline timeline, ResultTable results) {
            this.plan = plan;
            this.timeline = timeline;
            this.results = results;
            this.source = results.orElse(inputs);
        }

        void evaluateSingle(int id) {
            long start = System.nanoTime();
            Formula formula = plan.formula(id);
            if (formula == null) {
                FormulaSyntaxException e = plan.parseError(id);
                publish(id, timeline.zeros(), e.getMessage(), e.kind(), 0);
                return;
            }
            EvalResult r = evaluator.evaluate(formula, source, timeline);
            publish(id, r.values(), r.error(), r.errorKind(), System.nanoTime() - start);
        }

        void evaluateCluster(List<Integer> ids) {
            long start = System.nanoTime();
            int n = ids.size();
            Map<String, double[]> buffers = new HashMap<>();
            for (int id : ids)
                buffers.put("R" + id, timeline.zeros());
            ValueSource clusterSource = key -> buffers.get(calculationKey(key));
            ValueSource scoped = clusterSource.orElse(source);

            BoundFormula[] bound = new BoundFormula[n];
            String[] errors = new String[n];
            Kind[] kinds = new Kind[n];
            for (int i = 0; i < n; i++) {
                int id = ids.get(i);
                Formula f = plan.formula(id);
                if (f == null) {
                    errors[i] = plan.parseError(id).getMessage();
                    kinds[i] = plan.parseError(id).kind();
                    continue;
                }
                try {
                    bound[i] = f.bind(scoped, timeline);
                } catch (EvaluationException e) {
                    errors[i] = e.getMessage();
                    kinds[i] = e.kind();
                }
            }

            for (int p = 0; p < timeline.periods(); p++) {
                for (int i = 0; i < n; i++) {
                    if (errors[i] != null)
                        continue;
                    double[] buf = buffers.get("R" + ids.get(i));
                    try {
                        buf[p] = bound[i].valueAt(p);
                    } catch (EvaluationException e) {
                        errors[i] = FormulaEvaluator.describe(e, timeline);
                        kinds[i] = e.kind();
                        // Later periods of the other members read zeros, as for any failed dependency
                        Arrays.fill(buf, 0.0);
                    }
                }
            }

            // Every member reaches every other, so one failure taints the whole cluster
            Set<Integer> clusterFailures = new LinkedHashSet<>();
            for (int i = 0; i < n; i++) {
                if (errors[i] != null)
                    clusterFailures.add(ids.get(i));
            }
            long share = (System.nanoTime() - start) / Math.max(1, n);
            for (int i = 0; i < n; i++) {
                double[] buf = buffers.get("R" + ids.get(i));
                if (errors[i] != null)
                    Arrays.fill(buf, 0.0);
                publish(ids.get(i), buf, errors[i], kinds[i], share, clusterFailures);
            }
        }

        private String calculationKey(String key) {
            if (key.startsWith("M")) {
                Ref ref = Ref.parse(key);
                if (ref != null && ref.category() == RefCategory.MODULE_OUTPUT)
                    return results.moduleRefs().get(key);
            }
            return key;
        }

        void publish(int id, double[] values, String error, Kind kind, long nanos) {
            publish(id, values, error, kind, nanos, Set.of());
        }

        /** Publishes a result; {@code alsoFailed} are failed ids upstream of {@code id} beyond its direct dependencies. */
        void publish(int id, double[] values, String error, Kind kind, long nanos, Set<Integer> alsoFailed) {
            Calculation calc = plan.calculation(id);
            List<String> warnings = new ArrayList<>();
            Set<Integer> upstream = new LinkedHashSet<>();
            for (int dep : plan.samePeriodDependencies(id)) {
                if (dep != id && failed.contains(dep))
                    upstream.add(dep);
            }
            for (int dep : plan.laggedDependencies(id)) {
                if (dep != id && failed.contains(dep))
                    upstream.add(dep);
            }
            for (int dep : alsoFailed) {
                if (dep != id)
                    upstream.add(dep);
            }
            if (!upstream.isEmpty() && error == null)
                warnings.add("Depends on failed calculation(s): " + Scheduler.refs(new ArrayList<>(upstream)));

            results.publish(new CalculationResult(id, calc.name(), values, error, kind, warnings));
            final CalculationListener l = listener;
            if (error != null) {
                failed.add(id);
                errorLog.warn("R" + id + " (" + calc.name() + "): " + error);
                if (l != null)
                    l.onCalculationError(id, calc.name(), error);
            } else {
                evaluated++;
                if (l != null)
                    l.onCalculationEvaluated(id, calc.name(), nanos);
            }
        }
    }
}
