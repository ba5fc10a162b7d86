package com.glassbox.calc.namespace;

import java.time.Year;
import java.time.YearMonth;
import java.util.Arrays;
import java.util.List;

import com.glassbox.calc.timeline.Timeline;

/** Calendar-derived {@code T.*} series. */
public final class TimeConstants {
    public static final int DEFAULT_FINANCIAL_YEAR_END_MONTH = 6;

    /** Every key {@link #register} defines. */
    public static final List<String> KEYS = List.of("T.DiM", "T.DiY", "T.HiM", "T.HiY", "T.DiQ", "T.QE", "T.CYE",
            "T.FYE", "T.MiY", "T.QiY", "T.WiY", "T.HiD", "T.MiQ");

    private TimeConstants() {
    }

    public static void register(ReferenceNamespace.Builder b, int financialYearEndMonth) {
        Timeline t = b.timeline();
        int n = t.periods();
        double[] diM = new double[n], diY = new double[n], hiM = new double[n], hiY = new double[n];
        double[] diQ = new double[n], qe = new double[n], cye = new double[n], fye = new double[n];

        for (int i = 0; i < n; i++) {
            int y = t.year(i), m = t.month(i);
            int dim = YearMonth.of(y, m).lengthOfMonth();
            int diy = Year.of(y).length();
            diM[i] = dim;
            diY[i] = diy;
            hiM[i] = dim * 24;
            hiY[i] = diy * 24;
            int qStart = ((m - 1) / 3) * 3 + 1;
            diQ[i] = YearMonth.of(y, qStart).lengthOfMonth() + YearMonth.of(y, qStart + 1).lengthOfMonth()
                    + YearMonth.of(y, qStart + 2).lengthOfMonth();
            qe[i] = m % 3 == 0 ? 1 : 0;
            cye[i] = m == 12 ? 1 : 0;
            fye[i] = m == financialYearEndMonth ? 1 : 0;
        }

        put(b, "T.DiM", diM);
        put(b, "T.DiY", diY);
        put(b, "T.HiM", hiM);
        put(b, "T.HiY", hiY);
        put(b, "T.DiQ", diQ);
        put(b, "T.QE", qe);
        put(b, "T.CYE", cye);
        put(b, "T.FYE", fye);
        put(b, "T.MiY", filled(n, 12));
        put(b, "T.QiY", filled(n, 4));
        put(b, "T.WiY", filled(n, 52));
        put(b, "T.HiD", filled(n, 24));
        put(b, "T.MiQ", filled(n, 3));
    }

    private static void put(ReferenceNamespace.Builder b, String key, double[] values) {
        b.put(key, values, SeriesType.FLOW_CONVERTER);
    }

    private static double[] filled(int n, double v) {
        double[] a = new double[n];
        Arrays.fill(a, v);
        return a;
    }
}
