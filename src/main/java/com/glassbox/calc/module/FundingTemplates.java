package com.glassbox.calc.module;

import static com.glassbox.calc.module.TemplateInput.optional;
import static com.glassbox.calc.module.TemplateInput.required;
import static com.glassbox.calc.module.TemplateOutput.of;
import static com.glassbox.calc.namespace.SeriesType.FLOW;
import static com.glassbox.calc.namespace.SeriesType.STOCK;
import static com.glassbox.calc.namespace.SeriesType.STOCK_START;

import java.util.List;

/** Construction funding, reserve accounts (plain and maintenance) and the distributions waterfall. */
final class FundingTemplates {

    private FundingTemplates() {
    }

    static void registerAll(TemplateRegistry r) {
        r.register(new ModuleTemplate("construction_funding",
                "Equity-first construction funding with interest during construction",
                List.of(optional("costsRef", "V1"), required("gstAmountRef"), required("gstReceivedRef"),
                        required("feesRef"), required("constructionFlagRef"), required("sizedDebtRef"),
                        required("interestRatePct"), required("gearingCapPct")),
                b -> constructionFunding()));

        r.register(new ModuleTemplate("reserve_account",
                "Reserve account funded once, drawn under a flag and released at the end",
                List.of(required("fundingAmountRef"), required("fundingFlagRef"), optional("drawdownRef", "0"),
                        optional("drawdownFlagRef", "1"), optional("indexRef", "1"), optional("releaseFlagRef", "0")),
                b -> reserveAccount()));

        r.register(new ModuleTemplate("mra_reserve",
                "Maintenance reserve topped up to a look-forward target of upcoming maintenance",
                List.of(required("maintenanceRef"), optional("reservePeriodMonths", "12"),
                        optional("reservePortion", "100"), required("activeFlagRef"), optional("releaseFlagRef", "0")),
                b -> mraReserve()));

        r.register(new ModuleTemplate("distributions",
                "Shareholder distributions with retained-earnings, NPAT and lock-up tests",
                List.of(required("availableCashRef"), required("minCashReserve"), required("opsFlagRef"),
                        required("npatRef"), required("equityContributedRef"), required("withholdingTaxPct"),
                        required("dscrRef"), required("dscrThreshold"), required("debtServiceRef"),
                        required("quarterEndFlagRef"), required("lockupReleasePeriods"),
                        required("constructionFlagRef")),
                b -> distributions()));
    }

    static List<TemplateOutput> constructionFunding() {
        String cons = "$input.constructionFlagRef";
        return List.of(
                of("period_cost", "Period Cost", FLOW,
                        "MAX(0, $input.costsRef + $input.gstAmountRef - $input.gstReceivedRef + ($input.feesRef - SHIFT($input.feesRef, 1))) * " + cons),
                of("total_uses_ex_idc", "Total Uses (ex-IDC)", STOCK,
                        "CUMSUM($self.period_cost)").describedAs("Cumulative net period costs (GST-netted)"),
                of("equity_target", "Equity Target (ex-IDC)", STOCK,
                        "MAXVAL($self.total_uses_ex_idc) - $input.sizedDebtRef")
                        .describedAs("Total construction uses minus sized debt"),
                of("debt_drawdown", "Debt Drawdown", FLOW,
                        "MAX(0, CUMSUM($self.period_cost) - $self.equity_target) - MAX(0, CUMSUM($self.period_cost) - $self.period_cost - $self.equity_target)"),
                of("equity_drawdown", "Equity Drawdown", FLOW,
                        "($self.period_cost - $self.debt_drawdown) * " + cons),
                of("idc", "IDC (Period)", FLOW,
                        "(CUMSUM($self.debt_drawdown) - $self.debt_drawdown) * $input.interestRatePct / 100 / T.MiY * " + cons),
                of("senior_debt", "Senior Debt", STOCK,
                        "CUMSUM($self.debt_drawdown)"),
                of("equity", "Equity", STOCK,
                        "CUMSUM($self.equity_drawdown) + CUMSUM($self.idc)"),
                of("total_uses_incl_idc", "Total Funding Requirements", STOCK,
                        "$self.total_uses_ex_idc + CUMSUM($self.idc)"),
                of("cumulative_idc", "Cumulative IDC", STOCK,
                        "CUMSUM($self.idc)"),
                of("gearing_pct", "Gearing %", STOCK,
                        "$input.gearingCapPct * (CUMSUM(" + cons + ") > 0)"));
    }

    /**
     * Drawdowns are capped by the balance left after actual earlier drawdowns and
     * releases, and are suspended while the release flag is set. A release pays
     * out whatever is still held, so a release flag spanning several periods
     * releases the balance once.
     */
    static List<TemplateOutput> reserveAccount() {
        String held = "CUMSUM($self.funding) - PREVSUM($self.drawdown) - PREVSUM($self.release)";
        return List.of(
                of("opening", "Opening Balance", STOCK_START,
                        "PREVSUM($self.funding) - PREVSUM($self.drawdown) - PREVSUM($self.release)"),
                of("funding", "Funding", FLOW,
                        "$input.fundingAmountRef * $input.fundingFlagRef"),
                of("drawdown", "Drawdown", FLOW,
                        "MIN(ABS($input.drawdownRef) * $input.indexRef, MAX(0, " + held + ")) * $input.drawdownFlagRef * (1 - $input.releaseFlagRef)"),
                of("release", "Release", FLOW,
                        "MAX(0, CUMSUM($self.funding) - CUMSUM($self.drawdown) - PREVSUM($self.release)) * $input.releaseFlagRef"),
                of("closing", "Closing Balance", STOCK,
                        "CUMSUM($self.funding) - CUMSUM($self.drawdown) - CUMSUM($self.release)"));
    }

    /** Tops the account up to the next window of maintenance spend, then draws the spend from it. */
    static List<TemplateOutput> mraReserve() {
        String live = "$input.activeFlagRef * (1 - $input.releaseFlagRef)";
        return List.of(
                of("opening", "Opening Balance", STOCK_START,
                        "PREVSUM($self.funding) - PREVSUM($self.drawdown) - PREVSUM($self.release)"),
                of("target", "Target Balance", STOCK,
                        "FWDSUM(ABS($input.maintenanceRef), $input.reservePeriodMonths) * $input.reservePortion / 100 * $input.activeFlagRef")
                        .describedAs("Maintenance due over the reserve period, scaled by the reserve portion"),
                of("funding", "Funding/Top-up", FLOW,
                        "MAX(0, $self.target - $self.opening) * " + live),
                of("drawdown", "Drawdown", FLOW,
                        "MIN(ABS($input.maintenanceRef), $self.opening + $self.funding) * " + live),
                of("release", "Release", FLOW,
                        "MAX(0, CUMSUM($self.funding) - CUMSUM($self.drawdown) - PREVSUM($self.release)) * $input.releaseFlagRef"),
                of("closing", "Closing Balance", STOCK,
                        "CUMSUM($self.funding) - CUMSUM($self.drawdown) - CUMSUM($self.release)"));
    }

    static List<TemplateOutput> distributions() {
        String ops = "$input.opsFlagRef";
        String qe = "$input.quarterEndFlagRef";
        return List.of(
                of("cash_available", "Cash Available for Dist", STOCK,
                        "MAX(0, CUMSUM($input.availableCashRef) - PREVSUM($self.total_distributions) - $input.minCashReserve) * " + ops),
                of("re_opening", "RE - Opening", STOCK_START,
                        "PREVSUM($self.re_movement)"),
                of("re_npat", "RE - NPAT", FLOW,
                        "$input.npatRef"),
                of("re_test", "RE Test", STOCK,
                        "($self.re_opening + $self.re_npat > 0)"),
                of("npat_test", "NPAT Test", STOCK,
                        "($self.re_npat > 0)"),
                of("dividend_paid", "Dividend Paid", FLOW,
                        "MIN($self.sc_cash_available, MAX(0, $self.re_npat)) * " + ops
                                + " * $self.re_test * $self.npat_test * (1 - $self.lockup_active)"),
                of("re_movement", "RE - Movement", FLOW,
                        "$self.re_npat - $self.dividend_paid"),
                of("re_closing", "RE - Closing", STOCK,
                        "PREVSUM($self.re_movement) + $self.re_movement"),
                of("sc_opening", "SC - Opening", STOCK_START,
                        "$input.equityContributedRef"),
                of("sc_cash_available", "Post-SC Cash Available", STOCK,
                        "MAX(0, $self.cash_available - $self.sc_repayment)"),
                of("sc_repayment", "SC - Repayment", FLOW,
                        "MIN($self.cash_available, MAX(0, $self.sc_opening - PREVSUM($self.sc_repayment))) * " + ops
                                + " * (1 - $self.lockup_active)"),
                of("sc_closing", "SC - Closing", STOCK,
                        "MAX(0, $self.sc_opening - CUMSUM($self.sc_repayment))"),
                of("total_distributions", "Total Distributions", FLOW,
                        "$self.dividend_paid + $self.sc_repayment"),
                of("withholding_tax", "Withholding Tax", FLOW,
                        "$self.total_distributions * $input.withholdingTaxPct / 100"),
                of("net_to_equity", "Net to Equity", FLOW,
                        "$self.total_distributions - $self.withholding_tax"),
                of("dscr_test", "DSCR Test", STOCK,
                        "MAX(($input.dscrRef >= $input.dscrThreshold), (ABS($input.debtServiceRef) < 0.001)) * " + ops),
                of("adscr_test", "ADSCR Test", STOCK, ops),
                of("dsra_test", "DSRA Test", STOCK, ops),
                of("all_tests_pass", "All Tests Pass", STOCK,
                        "(PREVVAL($self.all_tests_pass) * (1 - " + qe + ") + $self.dscr_test * $self.adscr_test * $self.dsra_test * "
                                + qe + ") * " + ops + " + PREVVAL($self.all_tests_pass) * (1 - " + ops + ") * (CUMSUM("
                                + ops + ") > 0)"),
                of("consec_pass_qtrs", "Consecutive Pass Qtrs", STOCK,
                        "PREVVAL($self.consec_pass_qtrs) * ($self.all_tests_pass * " + qe + " + (1 - " + qe
                                + ")) + $self.all_tests_pass * " + qe),
                of("lockup_active", "Lock-up Active", STOCK,
                        "MAX(($self.consec_pass_qtrs < $input.lockupReleasePeriods) * " + ops
                                + ", $input.constructionFlagRef)"),
                of("cumulative_distributions", "Cumulative Distributions", STOCK,
                        "CUMSUM($self.total_distributions)"),
                of("cumulative_sc_repayment", "Cumulative SC Repayment", STOCK,
                        "CUMSUM($self.sc_repayment)"));
    }
}
