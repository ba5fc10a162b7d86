package com.glassbox.calc.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.glassbox.calc.engine.CalculationListener;

/** Aggregates evaluation time and failures per calculation across runs. */
public class CalculationProfileListener implements CalculationListener {

    public static class CalculationStats {
        public final int id;
        public final String name;
        public long count;
        public long errors;
        public long totalDurationNanos;
        public long maxDurationNanos;

        public CalculationStats(int id, String name) {
            this.id = id;
            this.name = name;
        }

        void update(long duration) {
            count++;
            totalDurationNanos += duration;
            if (duration > maxDurationNanos)
                maxDurationNanos = duration;
        }

        public double avgMicros() {
            return count == 0 ? 0 : totalDurationNanos / (double) count / 1000.0;
        }
    }

    private final Map<Integer, CalculationStats> stats = new LinkedHashMap<>();
    private long runs;

    @Override
    public void onRunStart(int calculationCount) {
        runs++;
    }

    @Override
    public void onCalculationEvaluated(int id, String name, long durationNanos) {
        stats.computeIfAbsent(id, k -> new CalculationStats(id, name)).update(durationNanos);
    }

    @Override
    public void onCalculationError(int id, String name, String error) {
        stats.computeIfAbsent(id, k -> new CalculationStats(id, name)).errors++;
    }

    @Override
    public void onRunEnd(int evaluated, int failed) {
        // totals are per calculation
    }

    public long runs() {
        return runs;
    }

    public CalculationStats get(int id) {
        return stats.get(id);
    }

    public void reset() {
        stats.clear();
        runs = 0;
    }

    /** Table of calculations, slowest total first. */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-8s %-30s | %8s | %8s | %10s | %10s%n", "Ref", "Name", "Count", "Errors",
                "Avg (us)", "Max (us)"));
        sb.append("-".repeat(86)).append('\n');
        List<CalculationStats> sorted = new ArrayList<>(stats.values());
        sorted.sort((a, b) -> Long.compare(b.totalDurationNanos, a.totalDurationNanos));
        for (CalculationStats s : sorted) {
            sb.append(String.format("%-8s %-30s | %8d | %8d | %10.2f | %10.2f%n", "R" + s.id, truncate(s.name, 30),
                    s.count, s.errors, s.avgMicros(), s.maxDurationNanos / 1000.0));
        }
        return sb.toString();
    }

    private static String truncate(String s, int len) {
        if (s == null)
            return "";
        return s.length() <= len ? s : s.substring(0, len - 3) + "...";
    }
}
