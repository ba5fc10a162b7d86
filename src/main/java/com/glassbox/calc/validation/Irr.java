package com.glassbox.calc.validation;

import java.util.OptionalDouble;

/**
 * Internal rate of return of a monthly cash-flow series.
 *
 * Leading and trailing zeros are dropped. Newton's method runs on the monthly
 * rate from 1%; the answer is annualised as {@code (1+r)^12 - 1}. There is no
 * answer without a sign change, when the derivative vanishes, or when the
 * monthly rate leaves [-50%, 100%].
 */
public final class Irr {
    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_TOLERANCE = 1e-8;

    private static final double INITIAL_RATE = 0.01;
    private static final double MIN_RATE = -0.5;
    private static final double MAX_RATE = 1.0;

    private Irr() {
    }

    public static OptionalDouble annual(double[] cashFlows) {
        return annual(cashFlows, DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
    }

    public static OptionalDouble annual(double[] cashFlows, int maxIterations, double tolerance) {
        OptionalDouble monthly = monthly(cashFlows, maxIterations, tolerance);
        return monthly.isPresent() ? OptionalDouble.of(Math.pow(1 + monthly.getAsDouble(), 12) - 1)
                : OptionalDouble.empty();
    }

    public static OptionalDouble monthly(double[] cashFlows, int maxIterations, double tolerance) {
        int first = 0;
        while (first < cashFlows.length && cashFlows[first] == 0)
            first++;
        int last = cashFlows.length - 1;
        while (last > first && cashFlows[last] == 0)
            last--;
        if (last - first + 1 < 2 || !hasSignChange(cashFlows, first, last))
            return OptionalDouble.empty();

        double rate = INITIAL_RATE;
        for (int iter = 0; iter < maxIterations; iter++) {
            double npv = 0, dnpv = 0;
            for (int i = 0; i <= last - first; i++) {
                double cf = cashFlows[first + i];
                double factor = Math.pow(1 + rate, -i);
                npv += cf * factor;
                dnpv -= i * cf * factor / (1 + rate);
            }
            if (Math.abs(dnpv) < 1e-20)
                return OptionalDouble.empty();
            double next = rate - npv / dnpv;
            if (Math.abs(next - rate) < tolerance)
                return inRange(next) ? OptionalDouble.of(next) : OptionalDouble.empty();
            rate = next;
            if (!inRange(rate))
                return OptionalDouble.empty();
        }
        return OptionalDouble.of(rate);
    }

    private static boolean inRange(double rate) {
        return rate >= MIN_RATE && rate <= MAX_RATE;
    }

    private static boolean hasSignChange(double[] cf, int from, int to) {
        boolean pos = false, neg = false;
        for (int i = from; i <= to; i++) {
            if (cf[i] > 0)
                pos = true;
            else if (cf[i] < 0)
                neg = true;
        }
        return pos && neg;
    }
}
