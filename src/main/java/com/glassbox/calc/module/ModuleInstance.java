package com.glassbox.calc.module;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One module to expand.
 *
 * @param id                explicit module number, or null to allocate one
 * @param inputs            template input bindings (references, literals or expressions)
 * @param extraCalculations custom outputs placed ahead of the template's own
 */
public record ModuleInstance(Integer id, String name, String templateId, Map<String, String> inputs,
        List<TemplateOutput> extraCalculations, boolean enabled) {

    public ModuleInstance {
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        extraCalculations = extraCalculations == null ? List.of() : List.copyOf(extraCalculations);
    }

    public static ModuleInstance of(String name, String templateId, Map<String, String> inputs) {
        return new ModuleInstance(null, name, templateId, inputs, List.of(), true);
    }
}
