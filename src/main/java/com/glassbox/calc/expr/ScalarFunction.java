package com.glassbox.calc.expr;

import java.util.List;
import java.util.Locale;

/**
 * Period-wise functions. {@code IF} evaluates only the chosen branch; the
 * logical functions treat any non-zero value as true.
 */
enum ScalarFunction {
    MIN(1, Integer.MAX_VALUE),
    MAX(1, Integer.MAX_VALUE),
    ABS(1, 1),
    IF(3, 3),
    AND(1, Integer.MAX_VALUE),
    OR(1, Integer.MAX_VALUE),
    NOT(1, 1),
    ROUND(1, 2);

    private final int minArgs, maxArgs;

    ScalarFunction(int minArgs, int maxArgs) {
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    boolean accepts(int argc) {
        return argc >= minArgs && argc <= maxArgs;
    }

    static ScalarFunction lookup(String name) {
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    double apply(List<ExprNode> args, int p, EvalScope s) {
        switch (this) {
            case MIN: {
                double m = args.get(0).eval(p, s);
                for (int i = 1; i < args.size(); i++)
                    m = Math.min(m, args.get(i).eval(p, s));
                return m;
            }
            case MAX: {
                double m = args.get(0).eval(p, s);
                for (int i = 1; i < args.size(); i++)
                    m = Math.max(m, args.get(i).eval(p, s));
                return m;
            }
            case ABS:
                return Math.abs(args.get(0).eval(p, s));
            case IF:
                return args.get(0).eval(p, s) != 0 ? args.get(1).eval(p, s) : args.get(2).eval(p, s);
            case AND:
                for (ExprNode a : args) {
                    if (a.eval(p, s) == 0)
                        return 0;
                }
                return 1;
            case OR:
                for (ExprNode a : args) {
                    if (a.eval(p, s) != 0)
                        return 1;
                }
                return 0;
            case NOT:
                return args.get(0).eval(p, s) == 0 ? 1 : 0;
            case ROUND: {
                double x = args.get(0).eval(p, s);
                int digits = args.size() > 1 ? (int) Math.round(args.get(1).eval(p, s)) : 0;
                double f = Math.pow(10, digits);
                double scaled = x * f;
                // Beyond 2^52 every double is already a whole number
                if (!Double.isFinite(scaled) || Math.abs(scaled) >= 0x1p52)
                    return x;
                return Math.floor(scaled + 0.5) / f;
            }
            default:
                throw new IllegalStateException("Unhandled function " + this);
        }
    }
}
