package com.glassbox.calc.expr;

record BinaryNode(BinaryOp op, ExprNode left, ExprNode right) implements ExprNode {

    @Override
    public double eval(int period, EvalScope scope) {
        return op.apply(left.eval(period, scope), right.eval(period, scope), period);
    }

    @Override
    public void collectRefs(RefVisitor visitor, boolean lagged) {
        left.collectRefs(visitor, lagged);
        right.collectRefs(visitor, lagged);
    }
}
