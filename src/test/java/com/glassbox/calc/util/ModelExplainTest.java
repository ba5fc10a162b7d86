package com.glassbox.calc.util;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import com.glassbox.calc.engine.Calculation;
import com.glassbox.calc.engine.CalculationEngine;
import com.glassbox.calc.engine.EvaluationPlan;
import com.glassbox.calc.engine.ResultTable;
import com.glassbox.calc.engine.Scheduler;
import com.glassbox.calc.expr.FormulaEvaluator;
import com.glassbox.calc.timeline.Timeline;

import static org.junit.Assert.*;

public class ModelExplainTest {

    private final Timeline timeline = Timeline.ofPeriods(2024, 1, 3);
    private EvaluationPlan plan;

    @Before
    public void setUp() {
        FormulaEvaluator evaluator = new FormulaEvaluator();
        plan = new Scheduler(evaluator).plan(List.of(
                new Calculation(1, "Revenue", "V1"),
                new Calculation(2, "Doubled", "R1 * 2"),
                new Calculation(3, "Plus One", "R2 + 1"),
                new Calculation(4, "Loop A", "R5 + 1"),
                new Calculation(5, "Loop B", "R4 + 1"),
                new Calculation(6, "Prior", "PREVVAL(R3)")), Map.of());
    }

    @Test
    public void testExplainCalculation() {
        String text = new ModelExplain(plan).explainCalculation(2);
        assertTrue(text, text.contains("Calculation: R2 (Doubled)"));
        assertTrue(text, text.contains("Formula: R1 * 2"));
        assertTrue(text, text.contains("Reads: R1\n"));
        assertTrue(text, text.contains("Read by: R3\n"));
        assertFalse(text, text.contains("Cyclic"));
        assertFalse(text, text.contains("Values"));
    }

    @Test
    public void testExplainAfterRun() {
        Map<String, double[]> inputs = new HashMap<>();
        inputs.put("V1", new double[] { 1, 2, 3 });
        ResultTable results = new CalculationEngine(new FormulaEvaluator(), 0).run(plan, inputs::get, timeline,
                Map.of());

        ModelExplain explain = new ModelExplain(plan, results, timeline);
        String text = explain.explainCalculation(3);
        assertTrue(text, text.contains("2024-01=3.0000, 2024-02=5.0000, 2024-03=7.0000"));

        String cyclic = explain.explainCalculation(4);
        assertTrue(cyclic, cyclic.contains("Cyclic: yes"));
        assertTrue(cyclic, cyclic.contains("Error: "));
    }

    @Test
    public void testDependents() {
        ModelExplain explain = new ModelExplain(plan);
        assertEquals(List.of(2), explain.dependents(1));
        // Lagged readers count too
        assertEquals(List.of(6), explain.dependents(3));
        assertTrue(explain.dependents(6).isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownCalculation() {
        new ModelExplain(plan).explainCalculation(42);
    }

    @Test
    public void testDumpOrder() {
        String dump = new ModelExplain(plan).dumpOrder();
        assertTrue(dump, dump.startsWith("Plan (6 calculations, 4 units):\n"));
        assertTrue(dump, dump.contains("R2 Doubled <- R1\n"));
        assertTrue(dump, dump.contains("cycle R4, R5\n"));
    }

    @Test
    public void testMermaid() {
        String mermaid = new ModelExplain(plan).toMermaid();
        assertTrue(mermaid, mermaid.startsWith("graph TD;\n"));
        assertTrue(mermaid, mermaid.contains("R1[\"R1: Revenue\"];"));
        assertTrue(mermaid, mermaid.contains("R1 --> R2;"));
        assertTrue(mermaid, mermaid.contains("R3 -.-> R6;"));
        assertTrue(mermaid, mermaid.contains("style R4 stroke:#c00;"));
    }
}
