package com.glassbox.calc.module;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.glassbox.calc.recipe.Recipe.CalculationDef;
import com.glassbox.calc.util.Diagnostic.Kind;
import com.glassbox.calc.util.Diagnostics;

import lombok.extern.log4j.Log4j2;

/**
 * Instantiates module templates into concrete calculations.
 *
 * Expansion runs in two stages over an arena of module records:
 *
 * 1. Addressing. For every module in declaration order: allocate a module
 * number, a calculation group and one contiguous block of calculation ids
 * (extra calculations first, then template outputs). Publish the module's
 * self map ({@code key -> R{id}}), its named cross-module aliases
 * ({@code M{n}.key -> R{id}}) and its positional aliases
 * ({@code M{n}.{i} -> R{id}}).
 *
 * 2. Substitution. With every module addressed, rewrite each output formula:
 * <ul>
 * <li>{@code $input.KEY.Start|End|M|Q|Y} becomes the bound value plus the suffix</li>
 * <li>{@code $input.KEY} becomes the bound value</li>
 * <li>{@code $self.KEY} becomes this module's output reference</li>
 * <li>{@code $M{n}.KEY} becomes another module's output reference</li>
 * <li>{@code M_SELF.{n}} becomes this module's positional alias</li>
 * </ul>
 * then translate remaining {@code {Name}} symbols.
 *
 * Addressing completes before substitution starts because module N may refer
 * to module M > N. A placeholder that cannot be resolved is reported as a
 * warning and left verbatim for the reference validator to surface.
 */
@Log4j2
public final class ModuleExpander {
    private static final Pattern INPUT_SUFFIXED = Pattern
            .compile("\\$input\\.([a-zA-Z_][a-zA-Z0-9_]*)\\.(Start|End|M|Q|Y)\\b");
    private static final Pattern INPUT = Pattern.compile("\\$input\\.([a-zA-Z_][a-zA-Z0-9_]*)");
    private static final Pattern SELF = Pattern.compile("\\$self\\.([a-zA-Z_][a-zA-Z0-9_]*)");
    private static final Pattern CROSS = Pattern.compile("\\$M(\\d+)\\.([a-zA-Z_][a-zA-Z0-9_]*)");
    private static final Pattern MODULE_SELF = Pattern.compile("M_SELF\\.(\\d+)");

    private final TemplateRegistry registry;

    public ModuleExpander(TemplateRegistry registry) {
        this.registry = registry;
    }

    /** Numbering state threaded through one compilation. */
    public record Allocators(IdAllocator modules, IdAllocator groups, IdAllocator calculations) {
    }

    /** Addressing-stage record of one module. */
    private static final class Slot {
        final ModuleInstance source;
        final int moduleId;
        final int groupId;
        final Map<String, String> inputs;
        final List<TemplateOutput> outputs;
        final int firstCalcId;
        final Map<String, String> selfRefs = new LinkedHashMap<>();

        Slot(ModuleInstance source, int moduleId, int groupId, Map<String, String> inputs,
                List<TemplateOutput> outputs, int firstCalcId) {
            this.source = source;
            this.moduleId = moduleId;
            this.groupId = groupId;
            this.inputs = inputs;
            this.outputs = outputs;
            this.firstCalcId = firstCalcId;
        }
    }

    /**
     * Expands {@code modules}.
     *
     * @param symbols     translates {@code {Name}} symbols in bindings and formulas; identity when absent
     * @param diagnostics receives unresolved placeholders
     * @throws com.glassbox.calc.util.SpecificationException for an unknown template id or a
     *                                                      duplicate explicit module number
     */
    public ExpansionResult expand(List<ModuleInstance> modules, Allocators ids, UnaryOperator<String> symbols,
            Diagnostics diagnostics) {
        UnaryOperator<String> translate = symbols == null ? UnaryOperator.identity() : symbols;
        for (ModuleInstance m : modules) {
            if (m.id() != null)
                ids.modules().claim(m.id());
        }

        List<Slot> arena = new ArrayList<>(modules.size());
        Map<String, String> outputRefs = new LinkedHashMap<>();
        Map<String, String> moduleRefs = new LinkedHashMap<>();
        for (ModuleInstance m : modules)
            arena.add(address(m, ids, translate, outputRefs, moduleRefs));

        List<ExpandedModule> expanded = new ArrayList<>(arena.size());
        for (Slot slot : arena)
            expanded.add(substitute(slot, outputRefs, translate, diagnostics));
        return new ExpansionResult(expanded, moduleRefs, outputRefs);
    }

    private Slot address(ModuleInstance m, Allocators ids, UnaryOperator<String> translate,
            Map<String, String> outputRefs, Map<String, String> moduleRefs) {
        ModuleTemplate template = registry.get(m.templateId());
        int moduleId = m.id() != null ? m.id() : ids.modules().next();
        int groupId = ids.groups().next();

        Map<String, String> inputs = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : template.withDefaults(m.inputs()).entrySet())
            inputs.put(e.getKey(), e.getValue() == null ? null : translate.apply(e.getValue()));

        List<TemplateOutput> outputs = new ArrayList<>(m.extraCalculations());
        outputs.addAll(template.outputs(inputs));
        int first = ids.calculations().allocateBlock(outputs.size());

        Slot slot = new Slot(m, moduleId, groupId, inputs, outputs, first);
        for (int i = 0; i < outputs.size(); i++) {
            String ref = "R" + (first + i);
            slot.selfRefs.putIfAbsent(outputs.get(i).key(), ref);
            outputRefs.putIfAbsent("M" + moduleId + "." + outputs.get(i).key(), ref);
            moduleRefs.put("M" + moduleId + "." + (i + 1), ref);
        }
        log.debug("Module M{} ({}) -> R{}..R{}", moduleId, m.templateId(), first, first + outputs.size() - 1);
        return slot;
    }

    private ExpandedModule substitute(Slot slot, Map<String, String> outputRefs, UnaryOperator<String> translate,
            Diagnostics diagnostics) {
        ModuleInstance m = slot.source;
        List<CalculationDef> calcs = new ArrayList<>(slot.outputs.size());
        for (int i = 0; i < slot.outputs.size(); i++) {
            TemplateOutput out = slot.outputs.get(i);
            int calcId = slot.firstCalcId + i;
            String formula = m.enabled()
                    ? translate.apply(rewrite(out.formula(), slot, outputRefs, "R" + calcId, diagnostics))
                    : "0";

            CalculationDef def = new CalculationDef();
            def.setId(calcId);
            def.setGroupId(slot.groupId);
            def.setModuleId(slot.moduleId);
            def.setName(m.name() + ": " + out.name());
            def.setFormula(formula);
            def.setType(out.type() == null ? "flow" : out.type().id());
            def.setDescription(out.description());
            def.setModuleOutputKey(out.key());
            def.setSolver(out.solver());
            calcs.add(def);
        }
        return new ExpandedModule(slot.moduleId, slot.groupId, m.name(), m.templateId(), slot.inputs, m.enabled(),
                calcs);
    }

    private static String rewrite(String formula, Slot slot, Map<String, String> outputRefs, String subject,
            Diagnostics diagnostics) {
        if (formula == null)
            return null;
        String f = formula.replace('×', '*');
        f = replace(f, INPUT_SUFFIXED, mr -> {
            String v = slot.inputs.get(mr.group(1));
            return v == null ? null : v + "." + mr.group(2);
        }, subject, "Unknown module input", diagnostics);
        f = replace(f, INPUT, mr -> slot.inputs.get(mr.group(1)), subject, "Unknown module input", diagnostics);
        f = replace(f, SELF, mr -> slot.selfRefs.get(mr.group(1)), subject, "Unknown $self ref", diagnostics);
        f = replace(f, CROSS, mr -> outputRefs.get("M" + mr.group(1) + "." + mr.group(2)), subject,
                "Unknown cross-module ref", diagnostics);
        f = replace(f, MODULE_SELF, mr -> "M" + slot.moduleId + "." + mr.group(1), subject, null, diagnostics);
        return f;
    }

    private interface Resolver {
        String resolve(Matcher match);
    }

    private static String replace(String formula, Pattern pattern, Resolver resolver, String subject,
            String failure, Diagnostics diagnostics) {
        Matcher m = pattern.matcher(formula);
        StringBuilder sb = new StringBuilder(formula.length());
        while (m.find()) {
            String value = resolver.resolve(m);
            if (value == null) {
                diagnostics.warn(Kind.UNRESOLVED_PLACEHOLDER, subject, failure + ": " + m.group());
                value = m.group();
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
