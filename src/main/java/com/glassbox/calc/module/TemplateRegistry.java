package com.glassbox.calc.module;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.glassbox.calc.util.SpecificationException;

/**
 * Registry of module templates by id.
 */
public final class TemplateRegistry {
    private final Map<String, ModuleTemplate> templates = new LinkedHashMap<>();

    public TemplateRegistry() {
        registerBuiltIns();
    }

    /** A registry with no templates. */
    public static TemplateRegistry empty() {
        TemplateRegistry r = new TemplateRegistry();
        r.templates.clear();
        return r;
    }

    public TemplateRegistry register(ModuleTemplate template) {
        if (templates.putIfAbsent(template.id(), template) != null)
            throw new IllegalArgumentException("Duplicate template id: " + template.id());
        return this;
    }

    /**
     * @throws SpecificationException when no template has this id
     */
    public ModuleTemplate get(String id) {
        ModuleTemplate t = templates.get(id);
        if (t == null)
            throw new SpecificationException("Unknown module template: " + id);
        return t;
    }

    public boolean contains(String id) {
        return templates.containsKey(id);
    }

    public List<String> ids() {
        return new ArrayList<>(templates.keySet());
    }

    private void registerBuiltIns() {
        AccountingTemplates.registerAll(this);
        FundingTemplates.registerAll(this);
        DebtTemplates.registerAll(this);
    }
}
