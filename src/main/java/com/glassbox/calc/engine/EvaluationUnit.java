package com.glassbox.calc.engine;

import java.util.List;

/**
 * A step of the evaluation order: one calculation evaluated across the whole
 * horizon, or a lag cluster evaluated period by period with its members in
 * {@code ids} order at each period.
 */
public record EvaluationUnit(List<Integer> ids, boolean cluster) {

    public static EvaluationUnit single(int id) {
        return new EvaluationUnit(List.of(id), false);
    }

    public static EvaluationUnit cluster(List<Integer> ids) {
        return new EvaluationUnit(List.copyOf(ids), true);
    }
}
