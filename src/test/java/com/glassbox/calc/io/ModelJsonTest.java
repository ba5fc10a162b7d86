package com.glassbox.calc.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.glassbox.calc.recipe.Recipe;
import com.glassbox.calc.recipe.Recipe.CalculationDef;
import com.glassbox.calc.spec.ModelSpec;

import static org.junit.Assert.*;

public class ModelJsonTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testReadSpecResource() throws IOException {
        ModelSpec spec = ModelJson.readSpecResource("reserve-model.json");
        assertEquals("Reserve Test", spec.getProject().getName());
        assertEquals("Jan 2024", spec.getTimeline().getStart());
        assertEquals(2, spec.getKeyPeriods().size());
        assertEquals(5, spec.getCalculations().size());
        assertEquals("reserve_account", spec.getModules().get(0).getTemplate());
        // threshold is accepted for tolerance
        assertEquals(0.001, spec.getValidation().getSourcesAndUses().getTolerance(), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingResource() throws IOException {
        ModelJson.readSpecResource("no-such-model.json");
    }

    @Test
    public void testRecipeAliases() throws IOException {
        String json = "{"
                + "\"calculations\": [{\"id\": 4, \"name\": \"Debt\", \"formula\": \"R1 * 2\", \"isSolver\": true}],"
                + "\"mRefMap\": {\"M1.1\": \"R4\"},"
                + "\"somethingElse\": 1"
                + "}";
        Recipe recipe = ModelJson.parseRecipe(json);
        CalculationDef calc = recipe.getCalculations().get(0);
        assertEquals(4, calc.getId());
        assertTrue(calc.isSolver());
        assertEquals("R4", recipe.getModuleRefs().get("M1.1"));
    }

    @Test
    public void testRecipeFileRoundTrip() throws IOException {
        Recipe recipe = new Recipe();
        CalculationDef calc = new CalculationDef();
        calc.setId(7);
        calc.setName("Revenue");
        calc.setFormula("V1 * F2");
        recipe.getCalculations().add(calc);
        recipe.getModuleRefs().put("M2.1", "R7");

        Path file = tmp.getRoot().toPath().resolve("recipe.json");
        ModelJson.writeRecipe(recipe, file);
        String text = Files.readString(file);
        // Empty collections are left out
        assertFalse(text, text.contains("inputGroups"));
        assertTrue(text, text.contains("\"moduleRefs\""));

        assertEquals(recipe, ModelJson.readRecipe(file));
    }

    @Test
    public void testToJsonIsIndented() {
        CalculationDef calc = new CalculationDef();
        calc.setId(1);
        calc.setName("A");
        String json = ModelJson.toJson(calc);
        assertTrue(json, json.contains("\n"));
        assertTrue(json, json.contains("\"name\" : \"A\""));
    }
}
