package com.glassbox.calc.namespace;

import org.junit.Test;

import com.glassbox.calc.recipe.Recipe;
import com.glassbox.calc.recipe.Recipe.InputDef;
import com.glassbox.calc.recipe.Recipe.InputGroupDef;

import static org.junit.Assert.*;

public class AliasTableTest {

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

    private static void addGroup(Recipe r, int id, String authoredRef, int inputId, double value) {
        InputGroupDef g = new InputGroupDef();
        g.setId(id);
        g.setMode("values");
        g.setRef(authoredRef);
        r.getInputGroups().add(g);
        InputDef in = new InputDef();
        in.setId(inputId);
        in.setGroupId(id);
        in.setRef(authoredRef + "." + inputId);
        in.setValue(value);
        r.getInputs().add(in);
    }

    @Test
    public void testAuthoredRefsMapToPositional() {
        Recipe r = twoMonths();
        addGroup(r, 5, "V3", 7, 2.0);

        ReferenceNamespace ns = NamespaceBuilder.build(r);
        AliasTable aliases = AliasTable.of(r, ns);

        assertEquals("V1", aliases.resolve("V3"));
        assertEquals("V1.7", aliases.resolve("V3.7"));
        assertEquals("Unaliased refs resolve to themselves", "R4", aliases.resolve("R4"));
        assertEquals("V1.7 + V1 * 2", aliases.rewrite("V3.7 + V3 * 2"));
    }

    @Test
    public void testSwappedPairsRewriteInOnePass() {
        Recipe r = twoMonths();
        addGroup(r, 1, "V2", 1, 10.0);
        addGroup(r, 2, "V1", 2, 20.0);

        ReferenceNamespace ns = NamespaceBuilder.build(r);
        AliasTable aliases = AliasTable.of(r, ns);

        assertEquals("V2 + V1", aliases.rewrite("V1 + V2"));
        assertEquals("V1.1 * V2.2", aliases.rewrite("V2.1 * V1.2"));
        assertArrayEquals(new double[] { 10, 10 }, ns.lookup(aliases.resolve("V2.1")), 0.0);
    }

    @Test
    public void testMatchingRefsProduceNoAliases() {
        Recipe r = twoMonths();
        addGroup(r, 1, "V1", 1, 1.0);

        AliasTable aliases = AliasTable.of(r, NamespaceBuilder.build(r));

        assertTrue(aliases.isEmpty());
        String formula = "V1.1 * 2";
        assertSame(formula, aliases.rewrite(formula));
    }

    @Test
    public void testNumbersWithExponentAreNotRewritten() {
        Recipe r = twoMonths();
        addGroup(r, 1, "V9", 1, 1.0);

        AliasTable aliases = AliasTable.of(r, NamespaceBuilder.build(r));

        assertEquals("1e5 + V1", aliases.rewrite("1e5 + V9"));
    }
}
