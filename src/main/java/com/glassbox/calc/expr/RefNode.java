package com.glassbox.calc.expr;

import com.glassbox.calc.namespace.Ref;

/** A reference; {@code slot} indexes the bound arrays of the owning formula. */
record RefNode(Ref ref, int slot) implements ExprNode {

    @Override
    public double eval(int period, EvalScope scope) {
        return scope.value(slot, period);
    }

    @Override
    public void collectRefs(RefVisitor visitor, boolean lagged) {
        visitor.visit(this, lagged);
    }
}
