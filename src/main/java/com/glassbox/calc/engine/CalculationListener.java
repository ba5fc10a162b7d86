package com.glassbox.calc.engine;

/**
 * Observability hooks for a calculation run.
 *
 * Callbacks run on the evaluating thread between calculations. Keep them
 * cheap; anything slow here slows the whole run.
 */
public interface CalculationListener {

    /**
     * Called before the first calculation is evaluated.
     *
     * @param calculationCount number of calculations in the plan, cyclic ones included
     */
    void onRunStart(int calculationCount);

    /**
     * Called after a calculation's values are published.
     *
     * @param id            calculation id
     * @param name          calculation name
     * @param durationNanos time spent evaluating; for cluster members the
     *                      cluster's time divided evenly
     */
    void onCalculationEvaluated(int id, String name, long durationNanos);

    /**
     * Called when a calculation is published as failed.
     *
     * @param error the message stored on the result
     */
    void onCalculationError(int id, String name, String error);

    /**
     * Called once every calculation has a published result.
     *
     * @param evaluated number evaluated successfully
     * @param failed    number published with an error
     */
    void onRunEnd(int evaluated, int failed);
}
