package com.glassbox.calc.expr;

import com.glassbox.calc.util.Diagnostic.Kind;

/** Raised while computing a formula's values; caught at the evaluator boundary. */
public class EvaluationException extends RuntimeException {
    private final Kind kind;
    private final int period;

    public EvaluationException(Kind kind, String message) {
        this(kind, message, -1);
    }

    public EvaluationException(Kind kind, String message, int period) {
        super(message);
        this.kind = kind;
        this.period = period;
    }

    public Kind kind() {
        return kind;
    }

    /** Period index where it happened, or -1. */
    public int period() {
        return period;
    }
}
