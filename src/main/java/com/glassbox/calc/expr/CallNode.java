package com.glassbox.calc.expr;

import java.util.List;

record CallNode(ScalarFunction fn, List<ExprNode> args) implements ExprNode {

    @Override
    public double eval(int period, EvalScope scope) {
        return fn.apply(args, period, scope);
    }

    @Override
    public void collectRefs(RefVisitor visitor, boolean lagged) {
        for (ExprNode a : args)
            a.collectRefs(visitor, lagged);
    }
}
