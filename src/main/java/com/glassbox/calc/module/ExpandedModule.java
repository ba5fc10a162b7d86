package com.glassbox.calc.module;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.glassbox.calc.recipe.Recipe.CalculationDef;
import com.glassbox.calc.recipe.Recipe.ModuleDef;

/**
 * A module after expansion: its numbers and the calculations it produced, in
 * output order.
 */
public record ExpandedModule(int moduleId, int groupId, String name, String templateId,
        Map<String, String> inputs, boolean enabled, List<CalculationDef> calculations) {

    public List<Integer> calculationIds() {
        List<Integer> ids = new ArrayList<>(calculations.size());
        for (CalculationDef c : calculations)
            ids.add(c.getId());
        return ids;
    }

    public ModuleDef toModuleDef() {
        ModuleDef def = new ModuleDef();
        def.setId(moduleId);
        def.setName(name);
        def.setTemplateId(templateId);
        def.setInputs(inputs);
        def.setEnabled(enabled);
        def.setOutputCalcIds(calculationIds());
        return def;
    }
}
