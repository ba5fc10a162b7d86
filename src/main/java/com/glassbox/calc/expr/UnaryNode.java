package com.glassbox.calc.expr;

record UnaryNode(boolean negate, ExprNode operand) implements ExprNode {

    @Override
    public double eval(int period, EvalScope scope) {
        double v = operand.eval(period, scope);
        return negate ? -v : v;
    }

    @Override
    public void collectRefs(RefVisitor visitor, boolean lagged) {
        operand.collectRefs(visitor, lagged);
    }
}
