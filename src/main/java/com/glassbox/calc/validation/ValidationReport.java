package com.glassbox.calc.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of the post-run checks. A check whose series is missing fails with
 * an {@code error}.
 */
public record ValidationReport(BalanceResult balanceSheet, BalanceResult sourcesAndUses,
        List<CovenantResult> covenants, List<IrrResult> irr) {

    public ValidationReport {
        covenants = List.copyOf(covenants);
        irr = List.copyOf(irr);
    }

    /**
     * @param firstPeriod first period over tolerance, or -1
     * @param firstLabel  its {@code YYYY-MM} label, or null
     */
    public record BalanceResult(String ref, boolean passed, double maxImbalance, int firstPeriod, String firstLabel,
            String error) {
    }

    /** @param value the extreme non-zero value the rule looked at (0 when none) */
    public record CovenantResult(String name, String ref, boolean passed, double value, double threshold,
            String error) {
    }

    /** @param annualRate NaN when undetermined */
    public record IrrResult(String name, String ref, boolean passed, double annualRate, String error) {

        public boolean isDetermined() {
            return !Double.isNaN(annualRate);
        }
    }

    public boolean passed() {
        if (balanceSheet != null && !balanceSheet.passed())
            return false;
        if (sourcesAndUses != null && !sourcesAndUses.passed())
            return false;
        for (CovenantResult c : covenants) {
            if (!c.passed())
                return false;
        }
        for (IrrResult r : irr) {
            if (!r.passed())
                return false;
        }
        return true;
    }

    /** One line per failed check. */
    public List<String> failures() {
        List<String> out = new ArrayList<>();
        if (balanceSheet != null && !balanceSheet.passed())
            out.add(describe("Balance sheet", balanceSheet));
        if (sourcesAndUses != null && !sourcesAndUses.passed())
            out.add(describe("Sources and uses", sourcesAndUses));
        for (CovenantResult c : covenants) {
            if (!c.passed())
                out.add(c.error() != null ? c.name() + ": " + c.error()
                        : c.name() + ": " + c.value() + " against threshold " + c.threshold());
        }
        for (IrrResult r : irr) {
            if (!r.passed())
                out.add(r.error() != null ? r.name() + ": " + r.error()
                        : r.name() + ": " + (r.isDetermined() ? "IRR " + r.annualRate() + " out of range" : "IRR undetermined"));
        }
        return out;
    }

    private static String describe(String what, BalanceResult b) {
        if (b.error() != null)
            return what + ": " + b.error();
        return what + ": max imbalance " + b.maxImbalance() + ", first at " + b.firstLabel()
                + " (period " + b.firstPeriod() + ")";
    }
}
