package com.glassbox.calc.expr;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.glassbox.calc.namespace.ValueSource;
import com.glassbox.calc.timeline.Timeline;

/**
 * Entry point for parsing and evaluating formulas.
 * <p>
 * {@link #evaluate} never throws for a bad formula or bad data: parse errors,
 * limit violations, unknown references and arithmetic faults all come back as
 * a failed {@link EvalResult} with a zero array.
 */
public final class FormulaEvaluator {
    private static final Logger log = LogManager.getLogger(FormulaEvaluator.class);

    private final FormulaLimits limits;

    public FormulaEvaluator() {
        this(FormulaLimits.DEFAULT);
    }

    public FormulaEvaluator(FormulaLimits limits) {
        this.limits = limits;
    }

    public FormulaLimits limits() {
        return limits;
    }

    /**
     * @throws FormulaSyntaxException when the formula is malformed or over a limit
     */
    public Formula parse(String formula) {
        return Parser.parse(formula, limits);
    }

    public EvalResult evaluate(String formula, ValueSource values, Timeline timeline) {
        Formula f;
        try {
            f = parse(formula);
        } catch (FormulaSyntaxException e) {
            log.debug("Rejected formula '{}': {}", formula, e.getMessage());
            return EvalResult.failed(timeline.periods(), e.kind(), e.getMessage());
        }
        return evaluate(f, values, timeline);
    }

    public EvalResult evaluate(Formula formula, ValueSource values, Timeline timeline) {
        try {
            return EvalResult.ok(formula.bind(values, timeline).evaluateAll());
        } catch (EvaluationException e) {
            return EvalResult.failed(timeline.periods(), e.kind(), describe(e, timeline));
        }
    }

    /** Error text with the period label appended when known. */
    public static String describe(EvaluationException e, Timeline timeline) {
        int p = e.period();
        if (p < 0 || p >= timeline.periods())
            return e.getMessage();
        return e.getMessage() + " at period " + p + " (" + timeline.label(p) + ")";
    }
}
