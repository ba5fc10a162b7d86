package com.glassbox.calc.util;

import java.util.Arrays;
import java.util.function.Consumer;

import com.glassbox.calc.engine.CalculationListener;

import lombok.extern.log4j.Log4j2;

/**
 * Fans engine callbacks out to several {@link CalculationListener}s in the
 * order they were added. A listener that throws is logged and the remaining
 * listeners still receive the callback; the run itself is never aborted by an
 * observer.
 */
@Log4j2
public final class CompositeCalculationListener implements CalculationListener {
    private CalculationListener[] listeners = new CalculationListener[0];

    /** Composite of the non-null {@code listeners}. */
    public static CompositeCalculationListener of(CalculationListener... listeners) {
        CompositeCalculationListener c = new CompositeCalculationListener();
        for (CalculationListener l : listeners) {
            if (l != null)
                c.add(l);
        }
        return c;
    }

    public CompositeCalculationListener add(CalculationListener listener) {
        if (listener == null)
            throw new IllegalArgumentException("listener is required");
        if (listener == this)
            throw new IllegalArgumentException("A composite cannot contain itself");
        CalculationListener[] next = Arrays.copyOf(listeners, listeners.length + 1);
        next[listeners.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRunStart(int calculationCount) {
        each("onRunStart", l -> l.onRunStart(calculationCount));
    }

    @Override
    public void onCalculationEvaluated(int id, String name, long durationNanos) {
        each("onCalculationEvaluated", l -> l.onCalculationEvaluated(id, name, durationNanos));
    }

    @Override
    public void onCalculationError(int id, String name, String error) {
        each("onCalculationError", l -> l.onCalculationError(id, name, error));
    }

    @Override
    public void onRunEnd(int evaluated, int failed) {
        each("onRunEnd", l -> l.onRunEnd(evaluated, failed));
    }

    private void each(String callback, Consumer<CalculationListener> call) {
        for (CalculationListener l : listeners) {
            try {
                call.accept(l);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed in {}", l.getClass().getSimpleName(), callback, e);
            }
        }
    }
}
