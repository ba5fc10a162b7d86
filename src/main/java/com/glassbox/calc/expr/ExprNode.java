package com.glassbox.calc.expr;

/** A node of a parsed formula, evaluated one period at a time. */
interface ExprNode {

    double eval(int period, EvalScope scope);

    /**
     * Reports every reference below this node. {@code lagged} is true while
     * inside the value argument of a function that only reads earlier periods.
     */
    void collectRefs(RefVisitor visitor, boolean lagged);

    @FunctionalInterface
    interface RefVisitor {
        void visit(RefNode ref, boolean lagged);
    }
}
