package com.glassbox.calc.namespace;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.glassbox.calc.recipe.Recipe;
import com.glassbox.calc.recipe.Recipe.IndexDef;
import com.glassbox.calc.recipe.Recipe.InputDef;
import com.glassbox.calc.recipe.Recipe.InputGroupDef;
import com.glassbox.calc.recipe.Recipe.KeyPeriodDef;
import com.glassbox.calc.recipe.Recipe.SubgroupDef;
import com.glassbox.calc.timeline.Timeline;

/**
 * Resolves every input, flag, index and time constant of a recipe into a
 * {@link ReferenceNamespace}.
 * <p>
 * Group prefixes are positional: only groups that own at least one input take
 * a number, and each addressing mode counts separately in declaration order.
 * The constants group (id {@value #CONSTANTS_GROUP_ID}) numbers its inputs
 * from 1 by subtracting 99 from the input id.
 */
public final class NamespaceBuilder {
    private static final Logger log = LogManager.getLogger(NamespaceBuilder.class);

    public static final int CONSTANTS_GROUP_ID = 100;

    private NamespaceBuilder() {
    }

    public static Timeline timelineOf(Recipe recipe) {
        Recipe.TimelineDef t = recipe.getTimeline();
        if (t == null)
            throw new IllegalArgumentException("Recipe has no timeline");
        return new Timeline(t.getStartYear(), t.getStartMonth(), t.getEndYear(), t.getEndMonth());
    }

    public static ReferenceNamespace build(Recipe recipe) {
        return build(recipe, timelineOf(recipe));
    }

    public static ReferenceNamespace build(Recipe recipe, Timeline timeline) {
        ReferenceNamespace.Builder b = ReferenceNamespace.builder(timeline);
        addInputGroups(b, recipe, timeline);
        addFlags(b, recipe.getKeyPeriods(), timeline);
        addIndices(b, recipe.getIndices(), timeline);

        Integer fye = recipe.getProject() == null ? null : recipe.getProject().getFinancialYearEndMonth();
        TimeConstants.register(b, fye == null ? TimeConstants.DEFAULT_FINANCIAL_YEAR_END_MONTH : fye);

        ReferenceNamespace ns = b.build();
        log.debug("Built namespace: {}", ns);
        return ns;
    }

    private static void addInputGroups(ReferenceNamespace.Builder b, Recipe recipe, Timeline timeline) {
        Map<InputMode, Integer> counters = new EnumMap<>(InputMode.class);
        List<KeyPeriodDef> keyPeriods = recipe.getKeyPeriods();

        for (InputGroupDef group : recipe.getInputGroups()) {
            List<InputDef> inputs = inputsOf(recipe, group.getId());
            if (inputs.isEmpty())
                continue;

            InputMode mode = InputMode.fromString(group.getMode());
            int n = counters.merge(mode, 1, Integer::sum);
            String groupRef = RefCategory.forMode(mode).prefix() + n;
            SeriesType type = mode == InputMode.CONSTANT || mode == InputMode.LOOKUP ? SeriesType.STOCK
                    : SeriesType.FLOW;

            Map<Integer, double[]> arrays = new LinkedHashMap<>();
            double[] subtotal = timeline.zeros();
            for (InputDef input : inputs) {
                double[] arr = InputArrays.build(input, group, mode, keyPeriods, timeline);
                arrays.put(input.getId(), arr);
                for (int i = 0; i < arr.length; i++)
                    subtotal[i] += arr[i];
            }
            b.put(groupRef, subtotal, type);

            Map<Integer, String> inputRefs = mode == InputMode.LOOKUP
                    ? addLookupRefs(b, groupRef, group, inputs, arrays)
                    : addInputRefs(b, groupRef, group, inputs, arrays, type);
            b.group(new GroupAddress(group.getId(), mode, group.getRef(), groupRef, inputRefs));
        }
    }

    private static Map<Integer, String> addInputRefs(ReferenceNamespace.Builder b, String groupRef,
            InputGroupDef group, List<InputDef> inputs, Map<Integer, double[]> arrays, SeriesType type) {
        Map<Integer, String> refs = new LinkedHashMap<>();
        for (InputDef input : inputs) {
            int num = group.getId() == CONSTANTS_GROUP_ID ? input.getId() - 99 : input.getId();
            String ref = groupRef + "." + num;
            if (b.contains(ref)) {
                log.warn("Input {} of group {} collides with {}; skipped", input.getId(), group.getId(), ref);
                continue;
            }
            b.put(ref, arrays.get(input.getId()), type);
            refs.put(input.getId(), ref);
        }
        return refs;
    }

    /**
     * Lookup inputs are addressed by position. Without subgroups each input is
     * {@code L{n}.{i}}. With subgroups, {@code L{n}.{s}} is the selected option
     * of subgroup {@code s} and {@code L{n}.{s}.{o}} each option.
     */
    private static Map<Integer, String> addLookupRefs(ReferenceNamespace.Builder b, String groupRef,
            InputGroupDef group, List<InputDef> inputs, Map<Integer, double[]> arrays) {
        Map<Integer, String> refs = new LinkedHashMap<>();
        List<InputDef> root = new ArrayList<>();
        for (InputDef in : inputs) {
            if (in.getSubgroupId() == null)
                root.add(in);
        }
        List<SubgroupDef> subgroups = group.getSubgroups() == null ? List.of() : group.getSubgroups();

        if (subgroups.isEmpty()) {
            for (int i = 0; i < root.size(); i++) {
                String ref = groupRef + "." + (i + 1);
                b.put(ref, arrays.get(root.get(i).getId()), SeriesType.STOCK);
                refs.put(root.get(i).getId(), ref);
            }
            return refs;
        }

        List<String> keys = new ArrayList<>();
        List<List<InputDef>> options = new ArrayList<>();
        if (!root.isEmpty()) {
            keys.add("root");
            options.add(root);
        }
        for (SubgroupDef sg : subgroups) {
            List<InputDef> members = new ArrayList<>();
            for (InputDef in : inputs) {
                if (in.getSubgroupId() != null && in.getSubgroupId() == sg.getId())
                    members.add(in);
            }
            keys.add(String.valueOf(sg.getId()));
            options.add(members);
        }

        Map<String, Integer> selected = group.getSelectedIndices() == null ? Map.of() : group.getSelectedIndices();
        for (int s = 0; s < options.size(); s++) {
            List<InputDef> opts = options.get(s);
            if (opts.isEmpty())
                continue;
            String subRef = groupRef + "." + (s + 1);
            int sel = selected.getOrDefault(keys.get(s), 0);
            if (sel < 0 || sel >= opts.size()) {
                log.warn("Lookup {} subgroup {}: selected option {} out of range, using first", groupRef,
                        keys.get(s), sel);
                sel = 0;
            }
            b.put(subRef, arrays.get(opts.get(sel).getId()).clone(), SeriesType.STOCK);
            for (int o = 0; o < opts.size(); o++) {
                String optRef = subRef + "." + (o + 1);
                b.put(optRef, arrays.get(opts.get(o).getId()), SeriesType.STOCK);
                refs.put(opts.get(o).getId(), optRef);
            }
        }
        return refs;
    }

    private static void addFlags(ReferenceNamespace.Builder b, List<KeyPeriodDef> keyPeriods, Timeline timeline) {
        int n = timeline.periods();
        for (KeyPeriodDef kp : keyPeriods) {
            double[] flag = new double[n], start = new double[n], end = new double[n];
            if (kp.hasDates()) {
                int from = Timeline.monthKey(kp.getStartYear(), kp.getStartMonth());
                int to = Timeline.monthKey(kp.getEndYear(), kp.getEndMonth());
                int first = -1, last = -1;
                for (int i = 0; i < n; i++) {
                    int k = Timeline.monthKey(timeline.year(i), timeline.month(i));
                    if (k >= from && k <= to) {
                        flag[i] = 1;
                        if (first < 0)
                            first = i;
                        last = i;
                    }
                }
                if (first >= 0) {
                    start[first] = 1;
                    end[last] = 1;
                }
            } else {
                log.warn("Key period F{} ({}) has no resolved dates; flag is all zeros", kp.getId(), kp.getName());
            }
            b.put("F" + kp.getId(), flag, SeriesType.FLAG);
            b.put("F" + kp.getId() + ".Start", start, SeriesType.FLAG);
            b.put("F" + kp.getId() + ".End", end, SeriesType.FLAG);
        }
    }

    private static void addIndices(ReferenceNamespace.Builder b, List<IndexDef> indices, Timeline timeline) {
        for (IndexDef idx : indices) {
            b.put("I" + idx.getId(), indexSeries(idx, timeline), SeriesType.RATIO);
        }
    }

    /**
     * Annual indices step once per whole year elapsed since the base month;
     * monthly indices compound at the equivalent monthly rate.
     */
    static double[] indexSeries(IndexDef idx, Timeline timeline) {
        int n = timeline.periods();
        double[] out = new double[n];
        double rate = idx.getRate() / 100.0;
        int baseYear = idx.getStartYear() != null ? idx.getStartYear() : timeline.startYear();
        int baseMonth = idx.getStartMonth() != null ? idx.getStartMonth() : 1;
        boolean annual = idx.getPeriod() == null || idx.getPeriod().equalsIgnoreCase("annual");
        double monthlyRate = Math.pow(1 + rate, 1.0 / 12) - 1;

        for (int i = 0; i < n; i++) {
            if (annual) {
                int wholeYears = (int) Math.floor(timeline.year(i) - baseYear
                        + (timeline.month(i) - baseMonth) / 12.0);
                out[i] = Math.pow(1 + rate, Math.max(0, wholeYears));
            } else {
                int months = (timeline.year(i) - baseYear) * 12 + (timeline.month(i) - baseMonth);
                out[i] = Math.pow(1 + monthlyRate, Math.max(0, months));
            }
        }
        return out;
    }

    private static List<InputDef> inputsOf(Recipe recipe, int groupId) {
        List<InputDef> out = new ArrayList<>();
        for (InputDef in : recipe.getInputs()) {
            if (in.getGroupId() == groupId)
                out.add(in);
        }
        return out;
    }
}
