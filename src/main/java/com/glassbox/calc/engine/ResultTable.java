package com.glassbox.calc.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.glassbox.calc.namespace.Ref;
import com.glassbox.calc.namespace.RefCategory;
import com.glassbox.calc.namespace.ValueSource;

/**
 * Append-only store of calculation results, readable as {@code R{id}} and,
 * through the module map, as {@code M{n}.{k}}. A result is never replaced.
 */
public final class ResultTable implements ValueSource {
    private final Map<Integer, CalculationResult> results = new LinkedHashMap<>();
    private final Map<String, String> moduleRefs;

    public ResultTable(Map<String, String> moduleRefs) {
        this.moduleRefs = moduleRefs == null ? Map.of() : moduleRefs;
    }

    void publish(CalculationResult result) {
        if (results.containsKey(result.id()))
            throw new IllegalStateException("Result for R" + result.id() + " already published");
        results.put(result.id(), result);
    }

    @Override
    public double[] lookup(String key) {
        Ref ref = Ref.parse(key);
        if (ref == null)
            return null;
        if (ref.category() == RefCategory.MODULE_OUTPUT) {
            String mapped = moduleRefs.get(key);
            ref = mapped == null ? null : Ref.parse(mapped);
        }
        if (ref == null || ref.category() != RefCategory.CALCULATION)
            return null;
        CalculationResult r = results.get(ref.calculationId());
        return r == null ? null : r.values();
    }

    public boolean contains(int id) {
        return results.containsKey(id);
    }

    public CalculationResult get(int id) {
        return results.get(id);
    }

    /** Copy of the values of {@code R{id}}, or null. */
    public double[] values(int id) {
        CalculationResult r = results.get(id);
        return r == null ? null : r.values().clone();
    }

    /** Copy of the values behind a calculation or module-output key, or null. */
    public double[] values(String key) {
        double[] v = lookup(key);
        return v == null ? null : v.clone();
    }

    public int size() {
        return results.size();
    }

    /** Results in the order they were published. */
    public Collection<CalculationResult> all() {
        return Collections.unmodifiableCollection(results.values());
    }

    public List<CalculationResult> failures() {
        List<CalculationResult> out = new ArrayList<>();
        for (CalculationResult r : results.values()) {
            if (!r.isOk())
                out.add(r);
        }
        return out;
    }

    public Map<String, String> moduleRefs() {
        return moduleRefs;
    }
}
