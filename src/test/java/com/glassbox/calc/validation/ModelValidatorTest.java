package com.glassbox.calc.validation;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import com.glassbox.calc.namespace.ValueSource;
import com.glassbox.calc.recipe.ValidationRules;
import com.glassbox.calc.recipe.ValidationRules.BalanceCheck;
import com.glassbox.calc.recipe.ValidationRules.CovenantRule;
import com.glassbox.calc.recipe.ValidationRules.IrrCheck;
import com.glassbox.calc.timeline.Timeline;
import com.glassbox.calc.validation.ValidationReport.BalanceResult;
import com.glassbox.calc.validation.ValidationReport.CovenantResult;
import com.glassbox.calc.validation.ValidationReport.IrrResult;

import static org.junit.Assert.*;

public class ModelValidatorTest {

    private final Timeline timeline = Timeline.ofPeriods(2024, 1, 3);
    private final Map<String, double[]> series = new HashMap<>();
    private final ValueSource source = series::get;
    private final ModelValidator validator = new ModelValidator();

    @Before
    public void setUp() {
        series.put("R1", new double[] { 0, 0.005, -0.001 });
        series.put("R2", new double[] { 0, 0.5, 0 });
        series.put("R3", new double[] { 0, 1.5, 1.2 });
        series.put("R4", new double[] { -100, 110, 0 });
    }

    private static BalanceCheck balance(String ref, Double tolerance) {
        BalanceCheck b = new BalanceCheck();
        b.setCheckRef(ref);
        b.setTolerance(tolerance);
        return b;
    }

    private static CovenantRule covenant(String ref, String rule, double threshold) {
        CovenantRule c = new CovenantRule();
        c.setName("Cov " + ref);
        c.setRef(ref);
        c.setRule(rule);
        c.setThreshold(threshold);
        return c;
    }

    private static IrrCheck irr(String ref, List<Double> range) {
        IrrCheck c = new IrrCheck();
        c.setName("IRR " + ref);
        c.setCashFlowRef(ref);
        c.setExpectedRange(range);
        return c;
    }

    @Test
    public void testBalanceWithinDefaultTolerance() {
        BalanceResult r = validator.balance(balance("R1", null), source, timeline);
        assertTrue(r.passed());
        assertEquals(0.005, r.maxImbalance(), 1e-12);
        assertEquals(-1, r.firstPeriod());
        assertNull(r.firstLabel());
    }

    @Test
    public void testBalanceFailureLocated() {
        BalanceResult r = validator.balance(balance("R2", null), source, timeline);
        assertFalse(r.passed());
        assertEquals(1, r.firstPeriod());
        assertEquals("2024-02", r.firstLabel());

        assertTrue(validator.balance(balance("R2", 1.0), source, timeline).passed());
    }

    @Test
    public void testMissingSeriesIsFailureNotException() {
        BalanceResult r = validator.balance(balance("R9", null), source, timeline);
        assertFalse(r.passed());
        assertEquals("R9 not found in results", r.error());

        CovenantResult c = ModelValidator.covenant(covenant("M4.2", "min", 1), source);
        assertFalse(c.passed());
        assertNotNull(c.error());
    }

    @Test
    public void testCovenantsLookAtNonZeroValues() {
        assertFalse(ModelValidator.covenant(covenant("R3", "min", 1.3), source).passed());
        CovenantResult min = ModelValidator.covenant(covenant("R3", "minValue", 1.1), source);
        assertTrue(min.passed());
        assertEquals(1.2, min.value(), 1e-12);

        CovenantResult max = ModelValidator.covenant(covenant("R3", "max", 1.5), source);
        assertTrue(max.passed());
        assertEquals(1.5, max.value(), 1e-12);
        assertFalse(ModelValidator.covenant(covenant("R3", "maxValue", 1.4), source).passed());
    }

    @Test
    public void testUnknownCovenantRule() {
        CovenantResult c = ModelValidator.covenant(covenant("R3", "average", 1), source);
        assertFalse(c.passed());
        assertEquals("Unknown covenant rule: average", c.error());
    }

    @Test
    public void testIrrRange() {
        IrrResult inRange = validator.irr(irr("R4", List.of(1.0, 3.0)), source);
        assertTrue(inRange.isDetermined());
        assertEquals(Math.pow(1.1, 12) - 1, inRange.annualRate(), 1e-5);
        assertTrue(inRange.passed());

        IrrResult outOfRange = validator.irr(irr("R4", List.of(0.0, 0.5)), source);
        assertFalse(outOfRange.passed());

        IrrResult undetermined = validator.irr(irr("R3", null), source);
        assertFalse(undetermined.isDetermined());
        assertFalse(undetermined.passed());
    }

    @Test
    public void testReport() {
        ValidationRules rules = new ValidationRules();
        rules.setBalanceSheet(balance("R1", null));
        rules.setSourcesAndUses(balance("R2", null));
        rules.getCovenants().add(covenant("R3", "min", 1.0));
        rules.getIrr().add(irr("R4", null));

        ValidationReport report = validator.validate(rules, source, timeline);
        assertFalse(report.passed());
        List<String> failures = report.failures();
        assertEquals(1, failures.size());
        assertTrue(failures.get(0), failures.get(0).startsWith("Sources and uses: max imbalance 0.5"));
    }

    @Test
    public void testNoRulesPasses() {
        ValidationReport report = validator.validate(null, source, timeline);
        assertTrue(report.passed());
        assertTrue(report.failures().isEmpty());
    }
}
