package com.glassbox.calc.namespace;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.glassbox.calc.recipe.Recipe.InputDef;
import com.glassbox.calc.recipe.Recipe.InputGroupDef;
import com.glassbox.calc.recipe.Recipe.KeyPeriodDef;
import com.glassbox.calc.timeline.Timeline;

/** Lays a single input out over the timeline. */
final class InputArrays {

    private InputArrays() {
    }

    static double[] build(InputDef input, InputGroupDef group, InputMode mode, List<KeyPeriodDef> keyPeriods,
            Timeline timeline) {
        int n = timeline.periods();
        double[] out = new double[n];
        if (mode == InputMode.CONSTANT) {
            double v = input.getValue() == null ? 0.0 : input.getValue();
            Arrays.fill(out, v);
            return out;
        }

        int startYear = group.getStartYear() != null ? group.getStartYear() : timeline.startYear();
        int startMonth = group.getStartMonth() != null ? group.getStartMonth() : timeline.startMonth();
        int span = group.getPeriods() != null && group.getPeriods() > 0 ? group.getPeriods() : n;

        if (group.getLinkedKeyPeriodId() != null) {
            KeyPeriodDef kp = findKeyPeriod(keyPeriods, group.getLinkedKeyPeriodId());
            if (kp != null && kp.getStartYear() != null && kp.getStartMonth() != null) {
                startYear = kp.getStartYear();
                startMonth = kp.getStartMonth();
                if (kp.getPeriods() != null && kp.getPeriods() > 0)
                    span = kp.getPeriods();
            }
        }

        double[] local = new double[span];
        Map<Integer, Double> sparse = input.getValues();
        if (sparse != null && !sparse.isEmpty()) {
            for (Map.Entry<Integer, Double> e : sparse.entrySet()) {
                int i = e.getKey();
                if (i >= 0 && i < span && e.getValue() != null)
                    local[i] = e.getValue();
            }
        } else if (input.getValue() != null) {
            String freq = input.getFrequency() != null ? input.getFrequency() : group.getFrequency();
            Arrays.fill(local, input.getValue() / monthsPerEntry(freq));
        }

        int offset = Timeline.monthKey(startYear, startMonth) - Timeline.monthKey(timeline.startYear(),
                timeline.startMonth());
        for (int i = 0; i < span; i++) {
            int t = offset + i;
            if (t >= 0 && t < n)
                out[t] = local[i];
        }

        if (mode == InputMode.LOOKUP) {
            double last = 0.0;
            for (int i = 0; i < n; i++) {
                if (out[i] != 0.0)
                    last = out[i];
                else
                    out[i] = last;
            }
        }
        return out;
    }

    /** Months covered by one entered value: 3 for quarterly, 12 for annual, otherwise 1. */
    static int monthsPerEntry(String frequency) {
        if (frequency == null)
            return 1;
        return switch (frequency.trim().toUpperCase(Locale.ROOT)) {
            case "Q", "QUARTERLY" -> 3;
            case "Y", "FY", "ANNUAL", "YEARLY" -> 12;
            default -> 1;
        };
    }

    static KeyPeriodDef findKeyPeriod(List<KeyPeriodDef> keyPeriods, int id) {
        if (keyPeriods == null)
            return null;
        for (KeyPeriodDef kp : keyPeriods) {
            if (kp.getId() == id)
                return kp;
        }
        return null;
    }
}
