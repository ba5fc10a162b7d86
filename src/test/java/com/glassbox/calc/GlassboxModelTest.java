package com.glassbox.calc;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.glassbox.calc.io.EngineSettings;
import com.glassbox.calc.io.ModelJson;
import com.glassbox.calc.recipe.Recipe;
import com.glassbox.calc.recipe.Recipe.CalculationDef;
import com.glassbox.calc.recipe.Recipe.InputDef;
import com.glassbox.calc.recipe.Recipe.InputGroupDef;
import com.glassbox.calc.util.CalculationProfileListener;
import com.glassbox.calc.util.Diagnostic;
import com.glassbox.calc.util.Diagnostic.Kind;

import static org.junit.Assert.*;

public class GlassboxModelTest {
    private static final double EPS = 1e-9;

    private GlassboxModel model;

    @Before
    public void setUp() {
        model = new GlassboxModel(new EngineSettings());
    }

    private static Recipe twoMonths() {
        Recipe r = new Recipe();
        Recipe.TimelineDef t = new Recipe.TimelineDef();
        t.setStartYear(2024);
        t.setStartMonth(1);
        t.setEndYear(2024);
        t.setEndMonth(2);
        r.setTimeline(t);
        return r;
    }

    private static void input(Recipe r, int groupId, String mode, String authoredRef, int inputId, double value) {
        InputGroupDef g = new InputGroupDef();
        g.setId(groupId);
        g.setName("Group " + groupId);
        g.setMode(mode);
        g.setRef(authoredRef);
        r.getInputGroups().add(g);
        InputDef in = new InputDef();
        in.setId(inputId);
        in.setGroupId(groupId);
        in.setName("Input " + inputId);
        in.setValue(value);
        r.getInputs().add(in);
    }

    private static void calc(Recipe r, int id, String formula) {
        CalculationDef c = new CalculationDef();
        c.setId(id);
        c.setName("Calc " + id);
        c.setFormula(formula);
        r.getCalculations().add(c);
    }

    @Test
    public void testRecipeRun() {
        Recipe r = twoMonths();
        input(r, 100, "constant", null, 100, 100.0);
        calc(r, 1, "C1.1 * 2");
        calc(r, 2, "R1 + T.MiY");

        ModelRun run = model.run(r);
        assertArrayEquals(new double[] { 200, 200 }, run.values("R1"), EPS);
        assertArrayEquals(new double[] { 212, 212 }, run.values("R2"), EPS);
        assertArrayEquals(new double[] { 100, 100 }, run.values("C1.1"), EPS);
        assertTrue(run.diagnostics().isEmpty());
        assertTrue("No rules means nothing to fail", run.validation().passed());
    }

    @Test
    public void testAuthoredReferencesRewritten() {
        Recipe r = twoMonths();
        input(r, 5, "values", "V3", 7, 2.0);
        calc(r, 1, "V3 * 10");

        ModelRun run = model.run(r);
        assertEquals("V1 * 10", run.formula(1));
        assertArrayEquals(new double[] { 20, 20 }, run.values("R1"), EPS);
        // The authored name still reads the input
        assertArrayEquals(new double[] { 2, 2 }, run.values("V3"), EPS);
    }

    @Test
    public void testFailuresBecomeDiagnostics() {
        Recipe r = twoMonths();
        calc(r, 1, "V9 + 1");
        calc(r, 2, "R1 * 2");
        calc(r, 3, "1 / 0");

        ModelRun run = model.run(r);
        List<Diagnostic> errors = run.errors();
        assertEquals(2, errors.size());
        assertEquals(Kind.UNKNOWN_REFERENCE, errors.get(0).kind());
        assertEquals("R1", errors.get(0).subject());
        assertEquals(Kind.ARITHMETIC_FAULT, errors.get(1).kind());
        assertEquals("R3", errors.get(1).subject());

        // R2 evaluates over R1's zeros with a warning
        assertTrue(run.result(2).isOk());
        assertArrayEquals(new double[] { 0, 0 }, run.values("R2"), EPS);
        List<Diagnostic> warnings = new ArrayList<>(run.diagnostics());
        warnings.removeAll(errors);
        assertEquals(1, warnings.size());
        assertEquals(Kind.UPSTREAM_ERROR, warnings.get(0).kind());
    }

    @Test
    public void testOversizedCalculationIdReportedNotThrown() {
        Recipe r = twoMonths();
        calc(r, 1, "R99999999999 + 1");
        calc(r, 2, "T.MiY");

        ModelRun run = model.run(r);
        assertEquals(1, run.errors().size());
        assertEquals(Kind.UNKNOWN_REFERENCE, run.errors().get(0).kind());
        assertEquals("R1", run.errors().get(0).subject());
        assertArrayEquals(new double[] { 12, 12 }, run.values("R2"), EPS);
    }

    @Test
    public void testCompiledModelWithCycle() throws IOException {
        String json = "{"
                + "\"timeline\": {\"start\": \"Jan 2024\", \"end\": \"Jun 2024\"},"
                + "\"calculationGroups\": [{\"name\": \"Main\"}],"
                + "\"calculations\": ["
                + "  {\"name\": \"A\", \"group\": \"Main\", \"formula\": \"{B} + 1\"},"
                + "  {\"name\": \"B\", \"group\": \"Main\", \"formula\": \"{A} + 1\"},"
                + "  {\"name\": \"C\", \"group\": \"Main\", \"formula\": \"T.MiY\"}"
                + "]}";
        CalculationProfileListener profile = new CalculationProfileListener();
        ModelRun run = model.setListener(profile).run(ModelJson.parseSpec(json));

        assertEquals(List.of(3), run.order());
        assertEquals(2, run.errors().size());
        for (Diagnostic d : run.errors())
            assertEquals(Kind.CIRCULAR_DEPENDENCY, d.kind());
        assertEquals(12, run.values("R3")[5], EPS);

        assertEquals(1, profile.runs());
        assertEquals(1, profile.get(1).errors);
        assertEquals(1, profile.get(3).count);
    }

    @Test
    public void testListenersCombine() {
        Recipe r = twoMonths();
        calc(r, 1, "T.MiY");
        calc(r, 2, "1 / 0");

        CalculationProfileListener first = new CalculationProfileListener();
        CalculationProfileListener second = new CalculationProfileListener();
        CalculationProfileListener third = new CalculationProfileListener();
        model.addListener(first).addListener(second).addListener(third).run(r);

        for (CalculationProfileListener l : List.of(first, second, third)) {
            assertEquals(1, l.runs());
            assertEquals(1, l.get(1).count);
            assertEquals(1, l.get(2).errors);
        }

        // Replacing drops the earlier listeners
        model.setListener(third).run(r);
        assertEquals(1, first.runs());
        assertEquals(2, third.runs());
    }

    @Test
    public void testReserveModel() throws IOException {
        ModelRun run = model.run(ModelJson.readSpecResource("reserve-model.json"));
        assertTrue(run.errors().toString(), run.errors().isEmpty());

        double[] identity = run.values("R5");
        for (int p = 0; p < identity.length; p++)
            assertEquals("Reserve identity at " + run.timeline().label(p), 0, identity[p], EPS);

        double[] closing = run.values("M1.5");
        assertEquals(1200, closing[5], EPS);
        assertEquals(1100, closing[6], EPS);
        assertEquals(0, closing[17], EPS);
        assertEquals("R10", run.moduleRefs().get("M1.5"));

        assertTrue(run.validation().failures().toString(), run.validation().passed());
        double irr = run.validation().irr().get(0).annualRate();
        assertTrue("IRR " + irr, irr > 0.3 && irr < 0.8);
        assertFalse(run.explain().dumpOrder().isEmpty());
    }
}
