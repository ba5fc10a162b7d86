package com.glassbox.calc.module;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A reusable, parameterised set of calculations.
 */
public record ModuleTemplate(String id, String description, List<TemplateInput> inputs, OutputFactory factory) {

    public ModuleTemplate {
        inputs = List.copyOf(inputs);
    }

    /** Bindings with defaults filled in for unbound optional inputs. */
    public Map<String, String> withDefaults(Map<String, String> bindings) {
        Map<String, String> out = new LinkedHashMap<>();
        for (TemplateInput in : inputs) {
            if (!in.isRequired())
                out.put(in.key(), in.defaultValue());
        }
        if (bindings != null)
            out.putAll(bindings);
        return out;
    }

    public List<TemplateOutput> outputs(Map<String, String> bindings) {
        return factory.create(withDefaults(bindings));
    }
}
