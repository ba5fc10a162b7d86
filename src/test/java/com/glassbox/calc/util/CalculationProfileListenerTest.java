package com.glassbox.calc.util;

import org.junit.Test;

import com.glassbox.calc.engine.CalculationListener;
import com.glassbox.calc.util.CalculationProfileListener.CalculationStats;

import static org.junit.Assert.*;

public class CalculationProfileListenerTest {

    @Test
    public void testAggregatesPerCalculation() {
        CalculationProfileListener profile = new CalculationProfileListener();
        profile.onRunStart(2);
        profile.onCalculationEvaluated(1, "Revenue", 2_000);
        profile.onCalculationEvaluated(2, "Costs", 10_000);
        profile.onRunEnd(2, 0);
        profile.onRunStart(2);
        profile.onCalculationEvaluated(1, "Revenue", 4_000);
        profile.onCalculationError(2, "Costs", "Division by zero");
        profile.onRunEnd(1, 1);

        assertEquals(2, profile.runs());
        CalculationStats revenue = profile.get(1);
        assertEquals(2, revenue.count);
        assertEquals(4_000, revenue.maxDurationNanos);
        assertEquals(3.0, revenue.avgMicros(), 1e-9);
        assertEquals(1, profile.get(2).errors);

        // Slowest total first
        String dump = profile.dump();
        assertTrue(dump, dump.indexOf("Costs") < dump.indexOf("Revenue"));

        profile.reset();
        assertNull(profile.get(1));
        assertEquals(0, profile.runs());
    }

    @Test
    public void testCompositeFansOut() {
        CalculationProfileListener a = new CalculationProfileListener();
        CalculationProfileListener b = new CalculationProfileListener();
        CompositeCalculationListener composite = new CompositeCalculationListener().add(a).add(b);
        composite.onRunStart(1);
        composite.onCalculationEvaluated(9, "X", 100);
        composite.onCalculationError(9, "X", "boom");
        composite.onRunEnd(0, 1);

        for (CalculationProfileListener l : new CalculationProfileListener[] { a, b }) {
            assertEquals(1, l.runs());
            assertEquals(1, l.get(9).count);
            assertEquals(1, l.get(9).errors);
        }
    }

    @Test
    public void testThrowingListenerDoesNotStopTheOthers() {
        CalculationProfileListener after = new CalculationProfileListener();
        CalculationListener broken = new CalculationProfileListener() {
            @Override
            public void onCalculationEvaluated(int id, String name, long durationNanos) {
                throw new IllegalStateException("listener failure");
            }
        };
        CompositeCalculationListener composite = CompositeCalculationListener.of(broken, null, after);
        assertEquals(2, composite.size());

        composite.onRunStart(1);
        composite.onCalculationEvaluated(3, "Y", 50);
        composite.onRunEnd(1, 0);
        assertEquals(1, after.get(3).count);
        assertEquals(1, after.runs());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCompositeRejectsItself() {
        CompositeCalculationListener composite = new CompositeCalculationListener();
        composite.add(composite);
    }
}
