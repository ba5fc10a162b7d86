package com.glassbox.calc.expr;

import com.glassbox.calc.util.Diagnostic.Kind;

/**
 * Outcome of evaluating one formula. On failure {@code values} is all zeros and
 * {@code error} says why.
 */
public record EvalResult(double[] values, String error, Kind errorKind) {

    public static EvalResult ok(double[] values) {
        return new EvalResult(values, null, null);
    }

    public static EvalResult failed(int periods, Kind kind, String error) {
        return new EvalResult(new double[periods], error, kind);
    }

    public boolean isOk() {
        return error == null;
    }
}
