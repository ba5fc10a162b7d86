package com.glassbox.calc.expr;

import com.glassbox.calc.timeline.Timeline;
import com.glassbox.calc.util.Diagnostic.Kind;

/**
 * A formula with its references resolved to arrays. Keeps its memo tables
 * between calls, so periods may be requested one at a time in increasing order
 * while the referenced arrays are still being filled.
 */
public final class BoundFormula {
    private final Formula formula;
    private final EvalScope scope;
    private final Timeline timeline;

    BoundFormula(Formula formula, EvalScope scope, Timeline timeline) {
        this.formula = formula;
        this.scope = scope;
        this.timeline = timeline;
    }

    public Formula formula() {
        return formula;
    }

    /**
     * Value at one period.
     *
     * @throws EvaluationException on division by zero or a non-finite result
     */
    public double valueAt(int period) {
        double v;
        try {
            v = formula.root().eval(period, scope);
        } catch (EvaluationException e) {
            if (e.period() >= 0 || e.kind() != Kind.ARITHMETIC_FAULT)
                throw e;
            throw new EvaluationException(e.kind(), e.getMessage(), period);
        }
        if (!Double.isFinite(v))
            throw new EvaluationException(Kind.ARITHMETIC_FAULT, "Non-finite result (" + v + ")", period);
        return v;
    }

    /** Values for every period of the timeline. */
    public double[] evaluateAll() {
        double[] out = new double[timeline.periods()];
        for (int i = 0; i < out.length; i++)
            out[i] = valueAt(i);
        return out;
    }
}
