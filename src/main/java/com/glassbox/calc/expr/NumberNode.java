package com.glassbox.calc.expr;

record NumberNode(double value) implements ExprNode {

    @Override
    public double eval(int period, EvalScope scope) {
        return value;
    }

    @Override
    public void collectRefs(RefVisitor visitor, boolean lagged) {
    }
}
