package com.glassbox.calc.module;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.glassbox.calc.recipe.Recipe.CalculationDef;

/**
 * Output of {@link ModuleExpander#expand}.
 *
 * @param moduleRefs positional aliases, {@code M{n}.{k}} to {@code R{id}} with k 1-based
 * @param outputRefs named aliases, {@code M{n}.{key}} to {@code R{id}}
 */
public record ExpansionResult(List<ExpandedModule> modules, Map<String, String> moduleRefs,
        Map<String, String> outputRefs) {

    /** Every expanded calculation, module by module. */
    public List<CalculationDef> calculations() {
        List<CalculationDef> out = new ArrayList<>();
        for (ExpandedModule m : modules)
            out.addAll(m.calculations());
        return out;
    }
}
