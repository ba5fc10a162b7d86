package com.glassbox.calc.namespace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.glassbox.calc.recipe.Recipe;
import com.glassbox.calc.recipe.Recipe.InputDef;
import com.glassbox.calc.recipe.Recipe.InputGroupDef;

/**
 * Maps references a recipe was authored with to the positional references the
 * namespace assigned. Only differing pairs are kept.
 */
public final class AliasTable {
    private static final Pattern IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    private final Map<String, String> aliases;

    private AliasTable(Map<String, String> aliases) {
        this.aliases = Collections.unmodifiableMap(aliases);
    }

    public static AliasTable empty() {
        return new AliasTable(new LinkedHashMap<>());
    }

    public static AliasTable of(Recipe recipe, ReferenceNamespace namespace) {
        Map<Integer, InputGroupDef> groupsById = new LinkedHashMap<>();
        for (InputGroupDef g : recipe.getInputGroups())
            groupsById.put(g.getId(), g);
        Map<Integer, InputDef> inputsById = new LinkedHashMap<>();
        for (InputDef in : recipe.getInputs())
            inputsById.put(in.getId(), in);

        Map<String, String> map = new LinkedHashMap<>();
        for (GroupAddress addr : namespace.groups()) {
            putIfDifferent(map, addr.authoringRef(), addr.ref());
            for (Map.Entry<Integer, String> e : addr.inputRefs().entrySet()) {
                InputDef in = inputsById.get(e.getKey());
                if (in != null)
                    putIfDifferent(map, in.getRef(), e.getValue());
            }
        }
        return new AliasTable(map);
    }

    private static void putIfDifferent(Map<String, String> map, String from, String to) {
        if (from != null && !from.isBlank() && !from.equals(to))
            map.put(from, to);
    }

    /** Positional reference for {@code authoringRef}, or the argument itself when not aliased. */
    public String resolve(String authoringRef) {
        return aliases.getOrDefault(authoringRef, authoringRef);
    }

    public boolean isEmpty() {
        return aliases.isEmpty();
    }

    public int size() {
        return aliases.size();
    }

    public Map<String, String> asMap() {
        return aliases;
    }

    /**
     * Rewrites every aliased identifier in a formula in one pass, so swapped
     * pairs ({@code V1} to {@code V2} and back) are handled.
     */
    public String rewrite(String formula) {
        if (formula == null || aliases.isEmpty())
            return formula;
        Matcher m = IDENT.matcher(formula);
        StringBuilder sb = new StringBuilder(formula.length());
        int last = 0;
        while (m.find()) {
            // Skip identifiers glued to a digit on the left (e.g. the tail of "1e5").
            if (m.start() > 0 && Character.isDigit(formula.charAt(m.start() - 1)))
                continue;
            String to = aliases.get(m.group());
            if (to == null)
                continue;
            sb.append(formula, last, m.start()).append(to);
            last = m.end();
        }
        if (last == 0)
            return formula;
        return sb.append(formula, last, formula.length()).toString();
    }

    @Override
    public String toString() {
        return "AliasTable" + aliases;
    }
}
