package com.glassbox.calc.expr;

import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.Map;

import com.glassbox.calc.timeline.Timeline;
import com.glassbox.calc.util.Diagnostic.Kind;

/**
 * Per-evaluation state: the arrays bound to a formula's reference slots and
 * the memo tables of its array-function calls.
 * <p>
 * Running functions fill their result lazily from the first period up to the
 * one requested, so the same scope serves both whole-horizon evaluation and
 * period-by-period evaluation, where referenced arrays are still being filled.
 * Each fill step only reads the argument at periods no later than the one
 * being filled.
 */
final class EvalScope {
    private final Timeline timeline;
    private final double[][] slots;
    private final Map<ArrayCallNode, Prefix> prefixes = new IdentityHashMap<>();
    private final Map<ArrayCallNode, double[]> wholes = new IdentityHashMap<>();
    private final Map<ArrayCallNode, Integer> windows = new IdentityHashMap<>();

    EvalScope(Timeline timeline, double[][] slots) {
        this.timeline = timeline;
        this.slots = slots;
    }

    double value(int slot, int period) {
        return slots[slot][period];
    }

    int periods() {
        return timeline.periods();
    }

    /**
     * Window length of a SHIFT or FWDSUM call: a literal rounded to an integer,
     * or the first non-zero value of a referenced series (its first value when
     * all are zero).
     */
    int window(ArrayCallNode call) {
        Integer w = windows.get(call);
        if (w != null)
            return w;
        ExprNode node = call.window();
        double raw;
        if (node instanceof RefNode ref) {
            double[] arr = slots[ref.slot()];
            raw = arr.length > 0 ? arr[0] : 0.0;
            for (double v : arr) {
                if (v != 0.0) {
                    raw = v;
                    break;
                }
            }
        } else {
            raw = node.eval(0, this);
        }
        long n = Math.round(raw);
        if (n < 0)
            throw new EvaluationException(Kind.ARITHMETIC_FAULT,
                    call.fn() + " window must not be negative, got " + n);
        int result = (int) Math.min(n, Integer.MAX_VALUE);
        windows.put(call, result);
        return result;
    }

    /** Running-function value at {@code period}, filling the memo up to it. */
    double prefix(ArrayCallNode call, int period) {
        Prefix st = prefixes.get(call);
        if (st == null) {
            st = new Prefix(timeline.periods());
            prefixes.put(call, st);
        }
        ExprNode arg = call.arg();
        double[] out = st.out;
        while (st.filled <= period) {
            int i = st.filled;
            double prev;
            switch (call.fn()) {
                case CUMSUM:
                    out[i] = (i > 0 ? out[i - 1] : 0.0) + arg.eval(i, this);
                    break;
                case CUMPROD:
                    out[i] = (i > 0 ? out[i - 1] : 1.0) * arg.eval(i, this);
                    break;
                case COUNT:
                    out[i] = (i > 0 ? out[i - 1] : 0.0) + (arg.eval(i, this) != 0.0 ? 1 : 0);
                    break;
                case PREVSUM:
                    out[i] = i > 0 ? out[i - 1] + arg.eval(i - 1, this) : 0.0;
                    break;
                case CUMSUM_Y:
                case CUMPROD_Y: {
                    boolean sum = call.fn() == ArrayFunction.CUMSUM_Y;
                    if (i == 0) {
                        out[i] = sum ? 0.0 : 1.0;
                    } else if (timeline.year(i) != timeline.year(i - 1)) {
                        prev = arg.eval(st.yearStart, this);
                        out[i] = sum ? out[i - 1] + prev : out[i - 1] * prev;
                        st.yearStart = i;
                    } else {
                        out[i] = out[i - 1];
                    }
                    break;
                }
                default:
                    throw new IllegalStateException(call.fn() + " is not a running function");
            }
            st.filled++;
        }
        return out[period];
    }

    /**
     * Whole-horizon result of MAXVAL or FWDSUM, computed once on first use.
     * The argument is evaluated in a separate scope so that filling it for
     * every period never advances this scope's running memos.
     */
    double[] whole(ArrayCallNode call) {
        double[] out = wholes.get(call);
        if (out != null)
            return out;
        int n = timeline.periods();
        EvalScope iso = new EvalScope(timeline, slots);
        double[] inner = new double[n];
        for (int i = 0; i < n; i++)
            inner[i] = call.arg().eval(i, iso);

        out = new double[n];
        if (call.fn() == ArrayFunction.MAXVAL) {
            double max = n > 0 ? inner[0] : 0.0;
            for (double v : inner)
                max = Math.max(max, v);
            Arrays.fill(out, max);
        } else {
            int w = window(call);
            for (int i = 0; i < n; i++) {
                double s = 0.0;
                int end = (int) Math.min((long) i + w, n);
                for (int j = i; j < end; j++)
                    s += inner[j];
                out[i] = s;
            }
        }
        wholes.put(call, out);
        return out;
    }

    private static final class Prefix {
        final double[] out;
        int filled;
        int yearStart;

        Prefix(int n) {
            this.out = new double[n];
        }
    }
}
