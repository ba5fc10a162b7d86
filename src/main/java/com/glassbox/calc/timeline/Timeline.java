package com.glassbox.calc.timeline;

import java.util.HashMap;
import java.util.Map;

/**
 * The model horizon: a contiguous run of calendar months.
 *
 * Every period array in the engine has exactly {@link #periods()} entries and
 * entry {@code i} corresponds to {@code year(i)}/{@code month(i)}. Months are
 * 1-based (January = 1).
 */
public final class Timeline {
    private final int startYear, startMonth, endYear, endMonth;
    private final int[] year;
    private final int[] month;
    private final Map<Integer, Integer> indexByMonthKey;

    public Timeline(int startYear, int startMonth, int endYear, int endMonth) {
        if (startMonth < 1 || startMonth > 12 || endMonth < 1 || endMonth > 12)
            throw new IllegalArgumentException("Month out of range: " + startMonth + ", " + endMonth);
        int n = (endYear - startYear) * 12 + (endMonth - startMonth) + 1;
        if (n <= 0)
            throw new IllegalArgumentException("Timeline end precedes start: "
                    + startYear + "-" + startMonth + " .. " + endYear + "-" + endMonth);
        this.startYear = startYear;
        this.startMonth = startMonth;
        this.endYear = endYear;
        this.endMonth = endMonth;
        this.year = new int[n];
        this.month = new int[n];
        this.indexByMonthKey = new HashMap<>(n * 2);

        int cy = startYear, cm = startMonth;
        for (int i = 0; i < n; i++) {
            year[i] = cy;
            month[i] = cm;
            indexByMonthKey.put(monthKey(cy, cm), i);
            if (++cm > 12) {
                cm = 1;
                cy++;
            }
        }
    }

    /** Convenience: a timeline of {@code periods} months starting at the given month. */
    public static Timeline ofPeriods(int startYear, int startMonth, int periods) {
        if (periods <= 0)
            throw new IllegalArgumentException("periods must be positive: " + periods);
        int end = monthKey(startYear, startMonth) + periods - 1;
        return new Timeline(startYear, startMonth, end / 12, end % 12 + 1);
    }

    public int periods() {
        return year.length;
    }

    public int year(int i) {
        return year[i];
    }

    public int month(int i) {
        return month[i];
    }

    public int startYear() {
        return startYear;
    }

    public int startMonth() {
        return startMonth;
    }

    public int endYear() {
        return endYear;
    }

    public int endMonth() {
        return endMonth;
    }

    /** Period index of the given calendar month, or -1 when outside the horizon. */
    public int indexOf(int y, int m) {
        Integer idx = indexByMonthKey.get(monthKey(y, m));
        return idx == null ? -1 : idx;
    }

    /** Label in {@code YYYY-MM} form. */
    public String label(int i) {
        return String.format("%d-%02d", year[i], month[i]);
    }

    public double[] zeros() {
        return new double[year.length];
    }

    /** Months since year 0, with January of year 0 = 0. */
    public static int monthKey(int y, int m) {
        return y * 12 + (m - 1);
    }

    @Override
    public String toString() {
        return "Timeline[" + label(0) + " .. " + label(periods() - 1) + ", " + periods() + " periods]";
    }
}
