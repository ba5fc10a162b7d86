package com.glassbox.calc.namespace;

import java.util.Map;

import org.junit.Test;

import com.glassbox.calc.recipe.Recipe;
import com.glassbox.calc.recipe.Recipe.IndexDef;
import com.glassbox.calc.recipe.Recipe.InputDef;
import com.glassbox.calc.recipe.Recipe.InputGroupDef;
import com.glassbox.calc.recipe.Recipe.KeyPeriodDef;

import static org.junit.Assert.*;

public class NamespaceBuilderTest {

    private static Recipe recipe(int startYear, int startMonth, int endYear, int endMonth) {
        Recipe r = new Recipe();
        Recipe.TimelineDef t = new Recipe.TimelineDef();
        t.setStartYear(startYear);
        t.setStartMonth(startMonth);
        t.setEndYear(endYear);
        t.setEndMonth(endMonth);
        r.setTimeline(t);
        return r;
    }

    private static InputGroupDef group(Recipe r, int id, String mode) {
        InputGroupDef g = new InputGroupDef();
        g.setId(id);
        g.setName("Group " + id);
        g.setMode(mode);
        r.getInputGroups().add(g);
        return g;
    }

    private static InputDef input(Recipe r, int id, int groupId, Double value) {
        InputDef in = new InputDef();
        in.setId(id);
        in.setGroupId(groupId);
        in.setName("Input " + id);
        in.setValue(value);
        r.getInputs().add(in);
        return in;
    }

    private static KeyPeriodDef keyPeriod(Recipe r, int id, int sy, int sm, int ey, int em) {
        KeyPeriodDef kp = new KeyPeriodDef();
        kp.setId(id);
        kp.setName("Period " + id);
        kp.setFlag("F" + id);
        kp.setStartYear(sy);
        kp.setStartMonth(sm);
        kp.setEndYear(ey);
        kp.setEndMonth(em);
        kp.setPeriods((ey - sy) * 12 + em - sm + 1);
        r.getKeyPeriods().add(kp);
        return kp;
    }

    @Test
    public void testFlagWithStartAndEnd() {
        // Six monthly periods, key period covering periods 2..4 (1-based)
        Recipe r = recipe(2024, 1, 2024, 6);
        keyPeriod(r, 1, 2024, 2, 2024, 4);

        ReferenceNamespace ns = NamespaceBuilder.build(r);

        assertArrayEquals(new double[] { 0, 1, 1, 1, 0, 0 }, ns.lookup("F1"), 0.0);
        assertArrayEquals(new double[] { 0, 1, 0, 0, 0, 0 }, ns.lookup("F1.Start"), 0.0);
        assertArrayEquals(new double[] { 0, 0, 0, 1, 0, 0 }, ns.lookup("F1.End"), 0.0);
        assertEquals(SeriesType.FLAG, ns.type("F1"));
    }

    @Test
    public void testUndatedKeyPeriodIsAllZeros() {
        Recipe r = recipe(2024, 1, 2024, 3);
        KeyPeriodDef kp = new KeyPeriodDef();
        kp.setId(4);
        kp.setName("Unanchored");
        r.getKeyPeriods().add(kp);

        ReferenceNamespace ns = NamespaceBuilder.build(r);

        assertArrayEquals(new double[3], ns.lookup("F4"), 0.0);
        assertArrayEquals(new double[3], ns.lookup("F4.Start"), 0.0);
    }

    @Test
    public void testConstantsNumberFromOne() {
        Recipe r = recipe(2024, 1, 2024, 2);
        group(r, NamespaceBuilder.CONSTANTS_GROUP_ID, "constant");
        input(r, 100, 100, 5.0);
        input(r, 101, 100, 7.0);

        ReferenceNamespace ns = NamespaceBuilder.build(r);

        assertArrayEquals(new double[] { 5, 5 }, ns.lookup("C1.1"), 0.0);
        assertArrayEquals(new double[] { 7, 7 }, ns.lookup("C1.2"), 0.0);
        assertArrayEquals("Group ref is the subtotal", new double[] { 12, 12 }, ns.lookup("C1"), 0.0);
        assertEquals(SeriesType.STOCK, ns.type("C1.1"));
    }

    @Test
    public void testPrefixesArePositionalPerMode() {
        Recipe r = recipe(2024, 1, 2024, 3);
        group(r, 1, "values"); // no inputs: takes no prefix
        group(r, 2, "values");
        group(r, 3, "series");
        input(r, 5, 2, 3.0);
        input(r, 6, 3, 4.0);

        ReferenceNamespace ns = NamespaceBuilder.build(r);

        assertTrue(ns.contains("V1"));
        assertFalse(ns.contains("V2"));
        assertArrayEquals(new double[] { 3, 3, 3 }, ns.lookup("V1.5"), 0.0);
        assertArrayEquals(new double[] { 4, 4, 4 }, ns.lookup("S1.6"), 0.0);
        assertEquals(2, ns.groups().size());
        assertEquals(2, ns.groups().get(0).groupId());
        assertEquals("V1", ns.groups().get(0).ref());
    }

    @Test
    public void testValueSpreadByFrequency() {
        Recipe r = recipe(2024, 1, 2024, 3);
        group(r, 1, "values");
        input(r, 1, 1, 30.0).setFrequency("Q");
        input(r, 2, 1, 120.0).setFrequency("Y");

        ReferenceNamespace ns = NamespaceBuilder.build(r);

        assertArrayEquals(new double[] { 10, 10, 10 }, ns.lookup("V1.1"), 1e-12);
        assertArrayEquals(new double[] { 10, 10, 10 }, ns.lookup("V1.2"), 1e-12);
    }

    @Test
    public void testSparseValuesFollowLinkedKeyPeriod() {
        Recipe r = recipe(2024, 1, 2024, 6);
        keyPeriod(r, 1, 2024, 2, 2024, 4);
        InputGroupDef g = group(r, 1, "values");
        g.setLinkedKeyPeriodId(1);
        input(r, 1, 1, null).setValues(Map.of(0, 7.0, 2, 9.0, 5, 99.0));

        ReferenceNamespace ns = NamespaceBuilder.build(r);

        // Offsets are relative to the key period start; offset 5 is past its span
        assertArrayEquals(new double[] { 0, 7, 0, 9, 0, 0 }, ns.lookup("V1.1"), 0.0);
    }

    @Test
    public void testLookupInputsFillForward() {
        Recipe r = recipe(2024, 1, 2024, 6);
        group(r, 1, "lookup");
        input(r, 10, 1, null).setValues(Map.of(0, 1.0));
        input(r, 11, 1, null).setValues(Map.of(1, 2.0, 4, 5.0));

        ReferenceNamespace ns = NamespaceBuilder.build(r);

        assertArrayEquals(new double[] { 1, 1, 1, 1, 1, 1 }, ns.lookup("L1.1"), 0.0);
        assertArrayEquals(new double[] { 0, 2, 2, 2, 5, 5 }, ns.lookup("L1.2"), 0.0);
        assertNull("Lookup inputs are addressed by position, not id", ns.lookup("L1.10"));
    }

    @Test
    public void testAnnualAndMonthlyIndices() {
        Recipe r = recipe(2024, 1, 2025, 6);
        IndexDef annual = new IndexDef();
        annual.setId(1);
        annual.setRate(10);
        annual.setPeriod("annual");
        annual.setStartYear(2024);
        IndexDef monthly = new IndexDef();
        monthly.setId(2);
        monthly.setRate(10);
        monthly.setPeriod("monthly");
        monthly.setStartYear(2024);
        r.getIndices().add(annual);
        r.getIndices().add(monthly);

        ReferenceNamespace ns = NamespaceBuilder.build(r);

        double[] i1 = ns.lookup("I1");
        assertEquals(1.0, i1[0], 1e-12);
        assertEquals(1.0, i1[11], 1e-12);
        assertEquals(1.1, i1[12], 1e-12);

        double[] i2 = ns.lookup("I2");
        assertEquals(1.0, i2[0], 1e-12);
        assertTrue(i2[1] > 1.0 && i2[1] < 1.01);
        assertEquals(1.1, i2[12], 1e-9);
    }

    @Test
    public void testTimeConstants() {
        Recipe r = recipe(2024, 1, 2024, 6);

        ReferenceNamespace ns = NamespaceBuilder.build(r);

        assertArrayEquals(new double[] { 31, 29, 31, 30, 31, 30 }, ns.lookup("T.DiM"), 0.0);
        assertArrayEquals(new double[] { 0, 0, 1, 0, 0, 1 }, ns.lookup("T.QE"), 0.0);
        assertArrayEquals(new double[] { 0, 0, 0, 0, 0, 1 }, ns.lookup("T.FYE"), 0.0);
        assertEquals(91, ns.lookup("T.DiQ")[0], 0.0);
        assertEquals(366 * 24, ns.lookup("T.HiY")[0], 0.0);
        assertEquals(12, ns.lookup("T.MiY")[3], 0.0);
        for (String key : TimeConstants.KEYS)
            assertTrue(key, ns.contains(key));
    }

    @Test
    public void testFinancialYearEndFromProject() {
        Recipe r = recipe(2024, 1, 2024, 4);
        Recipe.ProjectInfo p = new Recipe.ProjectInfo();
        p.setFinancialYearEndMonth(3);
        r.setProject(p);

        ReferenceNamespace ns = NamespaceBuilder.build(r);

        assertArrayEquals(new double[] { 0, 0, 1, 0 }, ns.lookup("T.FYE"), 0.0);
    }

    @Test
    public void testUnknownKeyIsNull() {
        ReferenceNamespace ns = NamespaceBuilder.build(recipe(2024, 1, 2024, 2));
        assertNull(ns.lookup("V9"));
        assertNull(ns.values("R1"));
        assertEquals(-1, ns.handle("F3"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingTimelineRejected() {
        NamespaceBuilder.build(new Recipe());
    }
}
