package com.glassbox.calc.expr;

/**
 * An array-function call. Results are memoised per node in the
 * {@link EvalScope}, so each call is computed once per evaluation however
 * many periods ask for it.
 */
final class ArrayCallNode implements ExprNode {
    private final ArrayFunction fn;
    private final ExprNode arg;
    private final ExprNode window;

    ArrayCallNode(ArrayFunction fn, ExprNode arg, ExprNode window) {
        this.fn = fn;
        this.arg = arg;
        this.window = window;
    }

    ArrayFunction fn() {
        return fn;
    }

    ExprNode arg() {
        return arg;
    }

    /** Second argument of SHIFT and FWDSUM, otherwise null. */
    ExprNode window() {
        return window;
    }

    @Override
    public double eval(int period, EvalScope scope) {
        return switch (fn) {
            case PREVVAL -> period > 0 ? arg.eval(period - 1, scope) : 0.0;
            case SHIFT -> {
                int src = period - scope.window(this);
                yield src >= 0 ? arg.eval(src, scope) : 0.0;
            }
            case MAXVAL, FWDSUM -> scope.whole(this)[period];
            default -> scope.prefix(this, period);
        };
    }

    @Override
    public void collectRefs(RefVisitor visitor, boolean lagged) {
        arg.collectRefs(visitor, lagged || fn.lagging());
        if (window != null)
            window.collectRefs(visitor, lagged);
    }

    @Override
    public String toString() {
        return fn + "(" + arg + (window == null ? "" : ", " + window) + ")";
    }
}
