package com.glassbox.calc.expr;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.glassbox.calc.namespace.Ref;
import com.glassbox.calc.namespace.ValueSource;
import com.glassbox.calc.timeline.Timeline;

/**
 * A parsed formula. Immutable and reusable; bind it to a value source to
 * evaluate.
 */
public final class Formula {
    private final String source;
    private final ExprNode root;
    private final List<Ref> refs;
    private final int nodeCount;

    Formula(String source, ExprNode root, List<Ref> refs, int nodeCount) {
        this.source = source;
        this.root = root;
        this.refs = List.copyOf(refs);
        this.nodeCount = nodeCount;
    }

    public String source() {
        return source;
    }

    /** Distinct references in order of first appearance. */
    public List<Ref> references() {
        return refs;
    }

    public int nodeCount() {
        return nodeCount;
    }

    /**
     * Splits references into those read at the same period and those read only
     * at earlier periods (inside SHIFT, PREVVAL or PREVSUM). A reference used
     * both ways counts as same-period.
     */
    public FormulaDependencies dependencies() {
        Set<Ref> same = new LinkedHashSet<>();
        Set<Ref> lagged = new LinkedHashSet<>();
        root.collectRefs((node, isLagged) -> (isLagged ? lagged : same).add(node.ref()), false);
        lagged.removeAll(same);
        return new FormulaDependencies(new ArrayList<>(same), new ArrayList<>(lagged));
    }

    /**
     * Resolves every reference against {@code values}.
     *
     * @throws UnknownReferenceException listing all unresolved references in order
     */
    public BoundFormula bind(ValueSource values, Timeline timeline) {
        double[][] slots = new double[refs.size()][];
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < refs.size(); i++) {
            String key = refs.get(i).key();
            double[] arr = values.lookup(key);
            if (arr == null)
                missing.add(key);
            slots[i] = arr;
        }
        if (!missing.isEmpty())
            throw new UnknownReferenceException(missing);
        return new BoundFormula(this, new EvalScope(timeline, slots), timeline);
    }

    ExprNode root() {
        return root;
    }

    @Override
    public String toString() {
        return source;
    }
}
