package com.glassbox.calc.spec;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.glassbox.calc.module.IdAllocator;
import com.glassbox.calc.recipe.Recipe.KeyPeriodDef;
import com.glassbox.calc.spec.ModelSpec.KeyPeriodSpec;
import com.glassbox.calc.util.Diagnostic.Kind;
import com.glassbox.calc.util.Diagnostics;
import com.glassbox.calc.util.SpecificationException;

/**
 * Turns anchored key periods into dated ones.
 *
 * Three passes: number every period (a flag {@code F6} fixes id 6), parse each
 * start anchor, then resolve dates depth-first so an anchor target is dated
 * before the periods that hang off it. An anchor that names a missing period,
 * or sits on a cycle, leaves the period undated with a warning.
 */
final class KeyPeriodResolver {
    private static final Pattern FLAG = Pattern.compile("^F(\\d+)$");
    private static final String TIMELINE_START = "timeline.start";

    private enum AnchorKind {
        TIMELINE, AFTER, WITH, DATE, NONE
    }

    private record Anchor(AnchorKind kind, String target, YearMonth date) {
    }

    private static final class Entry {
        final KeyPeriodSpec spec;
        final KeyPeriodDef def;
        Anchor anchor;

        Entry(KeyPeriodSpec spec, KeyPeriodDef def) {
            this.spec = spec;
            this.def = def;
        }
    }

    private final YearMonth timelineStart;
    private final Diagnostics diagnostics;
    private final Map<String, Entry> byFlag = new HashMap<>();
    private final Set<Integer> done = new HashSet<>();
    private final Set<Integer> visiting = new HashSet<>();

    KeyPeriodResolver(YearMonth timelineStart, Diagnostics diagnostics) {
        this.timelineStart = timelineStart;
        this.diagnostics = diagnostics;
    }

    List<KeyPeriodDef> resolve(List<KeyPeriodSpec> specs) {
        IdAllocator ids = IdAllocator.startingAt(1);
        Integer[] fixed = new Integer[specs.size()];
        for (int i = 0; i < specs.size(); i++) {
            fixed[i] = fixedId(specs.get(i));
            if (fixed[i] != null)
                ids.claim(fixed[i]);
        }

        List<Entry> entries = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            KeyPeriodSpec spec = specs.get(i);
            int id = fixed[i] != null ? fixed[i] : ids.next();
            KeyPeriodDef def = new KeyPeriodDef();
            def.setId(id);
            def.setName(spec.getName());
            def.setFlag("F" + id);
            def.setPeriods(SpecDates.parseDuration(spec.getDuration()));
            Entry e = new Entry(spec, def);
            entries.add(e);
            byFlag.put(def.getFlag(), e);
            if (spec.getFlag() != null)
                byFlag.putIfAbsent(spec.getFlag(), e);
        }

        for (Entry e : entries)
            e.anchor = parseAnchor(e.spec.getStart());
        for (Entry e : entries)
            date(e);

        List<KeyPeriodDef> out = new ArrayList<>(entries.size());
        for (Entry e : entries)
            out.add(e.def);
        return out;
    }

    private static Integer fixedId(KeyPeriodSpec spec) {
        if (spec.getFlag() != null) {
            Matcher m = FLAG.matcher(spec.getFlag().trim());
            if (m.matches())
                return Integer.parseInt(m.group(1));
        }
        return spec.getId();
    }

    private static Anchor parseAnchor(String start) {
        if (start == null || start.isBlank())
            return new Anchor(AnchorKind.NONE, null, null);
        String s = start.trim();
        if (s.equals(TIMELINE_START))
            return new Anchor(AnchorKind.TIMELINE, null, null);
        if (s.startsWith("after "))
            return new Anchor(AnchorKind.AFTER, s.substring(6).trim(), null);
        if (s.startsWith("with "))
            return new Anchor(AnchorKind.WITH, s.substring(5).trim(), null);
        if (SpecDates.isDate(s))
            return new Anchor(AnchorKind.DATE, null, SpecDates.parseDate(s));
        throw new SpecificationException("Invalid key period start: " + start);
    }

    private void date(Entry e) {
        int id = e.def.getId();
        if (done.contains(id))
            return;
        if (!visiting.add(id)) {
            diagnostics.warn(Kind.ANCHOR_UNRESOLVED, e.def.getName(), "Circular key period anchor through F" + id);
            return;
        }

        YearMonth start = startOf(e);
        if (start != null) {
            YearMonth end = SpecDates.endOf(start, e.def.getPeriods());
            e.def.setStartYear(start.getYear());
            e.def.setStartMonth(start.getMonthValue());
            e.def.setEndYear(end.getYear());
            e.def.setEndMonth(end.getMonthValue());
        }
        visiting.remove(id);
        done.add(id);
    }

    private YearMonth startOf(Entry e) {
        Anchor a = e.anchor;
        switch (a.kind()) {
            case TIMELINE:
                return timelineStart;
            case DATE:
                return a.date();
            case NONE:
                diagnostics.warn(Kind.ANCHOR_UNRESOLVED, e.def.getName(), "Key period has no start");
                return null;
            default:
                break;
        }

        Entry target = byFlag.get(a.target());
        if (target == null) {
            diagnostics.warn(Kind.ANCHOR_UNRESOLVED, e.def.getName(),
                    "Anchor target not found: " + a.target());
            return null;
        }
        date(target);
        KeyPeriodDef t = target.def;
        if (!t.hasDates()) {
            diagnostics.warn(Kind.ANCHOR_UNRESOLVED, e.def.getName(),
                    "Anchor target " + a.target() + " has no dates");
            return null;
        }
        YearMonth anchor = a.kind() == AnchorKind.AFTER
                ? YearMonth.of(t.getEndYear(), t.getEndMonth()).plusMonths(1)
                : YearMonth.of(t.getStartYear(), t.getStartMonth());
        Integer offset = e.spec.getOffset();
        return offset == null ? anchor : anchor.plusMonths(offset);
    }
}
