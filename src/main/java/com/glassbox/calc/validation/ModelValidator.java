package com.glassbox.calc.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.glassbox.calc.namespace.ValueSource;
import com.glassbox.calc.recipe.ValidationRules;
import com.glassbox.calc.recipe.ValidationRules.BalanceCheck;
import com.glassbox.calc.recipe.ValidationRules.CovenantRule;
import com.glassbox.calc.recipe.ValidationRules.IrrCheck;
import com.glassbox.calc.timeline.Timeline;
import com.glassbox.calc.validation.ValidationReport.BalanceResult;
import com.glassbox.calc.validation.ValidationReport.CovenantResult;
import com.glassbox.calc.validation.ValidationReport.IrrResult;

/**
 * Runs balance, covenant and IRR checks against the series of a finished run.
 */
public final class ModelValidator {
    private static final Logger log = LogManager.getLogger(ModelValidator.class);

    public static final double DEFAULT_BALANCE_TOLERANCE = 0.01;

    private final double defaultTolerance;
    private final int irrMaxIterations;
    private final double irrTolerance;

    public ModelValidator() {
        this(DEFAULT_BALANCE_TOLERANCE, Irr.DEFAULT_MAX_ITERATIONS, Irr.DEFAULT_TOLERANCE);
    }

    public ModelValidator(double defaultTolerance, int irrMaxIterations, double irrTolerance) {
        this.defaultTolerance = defaultTolerance;
        this.irrMaxIterations = irrMaxIterations;
        this.irrTolerance = irrTolerance;
    }

    public ValidationReport validate(ValidationRules rules, ValueSource series, Timeline timeline) {
        if (rules == null)
            return new ValidationReport(null, null, List.of(), List.of());
        BalanceResult bs = rules.getBalanceSheet() == null ? null : balance(rules.getBalanceSheet(), series, timeline);
        BalanceResult su = rules.getSourcesAndUses() == null ? null
                : balance(rules.getSourcesAndUses(), series, timeline);

        List<CovenantResult> covenants = new ArrayList<>();
        for (CovenantRule c : rules.getCovenants())
            covenants.add(covenant(c, series));
        List<IrrResult> irr = new ArrayList<>();
        for (IrrCheck c : rules.getIrr())
            irr.add(irr(c, series));

        ValidationReport report = new ValidationReport(bs, su, covenants, irr);
        if (report.passed())
            log.info("Validation passed");
        else
            log.warn("Validation failed: {}", report.failures());
        return report;
    }

    BalanceResult balance(BalanceCheck check, ValueSource series, Timeline timeline) {
        double tolerance = check.getTolerance() == null ? defaultTolerance : check.getTolerance();
        double[] values = series.lookup(check.getCheckRef());
        if (values == null)
            return new BalanceResult(check.getCheckRef(), false, Double.NaN, -1, null,
                    check.getCheckRef() + " not found in results");
        double max = 0;
        int first = -1;
        for (int p = 0; p < values.length; p++) {
            double abs = Math.abs(values[p]);
            max = Math.max(max, abs);
            if (first < 0 && abs > tolerance)
                first = p;
        }
        return new BalanceResult(check.getCheckRef(), max <= tolerance, max, first,
                first < 0 ? null : timeline.label(first), null);
    }

    static CovenantResult covenant(CovenantRule rule, ValueSource series) {
        double[] values = series.lookup(rule.getRef());
        if (values == null)
            return new CovenantResult(rule.getName(), rule.getRef(), false, Double.NaN, rule.getThreshold(),
                    rule.getRef() + " not found");
        String kind = rule.getRule() == null ? "min" : rule.getRule().toLowerCase(Locale.ROOT);
        boolean max = kind.startsWith("max");
        if (!max && !kind.startsWith("min"))
            return new CovenantResult(rule.getName(), rule.getRef(), false, Double.NaN, rule.getThreshold(),
                    "Unknown covenant rule: " + rule.getRule());

        double extreme = max ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        boolean any = false;
        for (double v : values) {
            if (v == 0)
                continue;
            any = true;
            extreme = max ? Math.max(extreme, v) : Math.min(extreme, v);
        }
        if (!any)
            extreme = 0;
        boolean passed = max ? extreme <= rule.getThreshold() : extreme >= rule.getThreshold();
        return new CovenantResult(rule.getName(), rule.getRef(), passed, extreme, rule.getThreshold(), null);
    }

    IrrResult irr(IrrCheck check, ValueSource series) {
        double[] values = series.lookup(check.getCashFlowRef());
        if (values == null)
            return new IrrResult(check.getName(), check.getCashFlowRef(), false, Double.NaN,
                    check.getCashFlowRef() + " not found");
        OptionalDouble rate = Irr.annual(values, irrMaxIterations, irrTolerance);
        double r = rate.orElse(Double.NaN);
        boolean passed = rate.isPresent();
        List<Double> range = check.getExpectedRange();
        if (passed && range != null && range.size() == 2)
            passed = r >= range.get(0) && r <= range.get(1);
        return new IrrResult(check.getName(), check.getCashFlowRef(), passed, r, null);
    }
}
