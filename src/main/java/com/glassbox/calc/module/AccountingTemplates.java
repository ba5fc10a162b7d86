package com.glassbox.calc.module;

import static com.glassbox.calc.module.TemplateInput.optional;
import static com.glassbox.calc.module.TemplateInput.required;
import static com.glassbox.calc.module.TemplateOutput.of;
import static com.glassbox.calc.namespace.SeriesType.FLAG;
import static com.glassbox.calc.namespace.SeriesType.FLOW;
import static com.glassbox.calc.namespace.SeriesType.STOCK;
import static com.glassbox.calc.namespace.SeriesType.STOCK_START;

import java.util.List;

/**
 * Depreciation, GST and tax-loss ledgers. Balances are built from running
 * totals of their movements, so none of them needs its own previous value.
 */
final class AccountingTemplates {

    private AccountingTemplates() {
    }

    static void registerAll(TemplateRegistry r) {
        r.register(new ModuleTemplate("straight_line_amortisation",
                "Straight-line amortisation of a capitalised amount over a life in years",
                List.of(required("capitalisedRef"), required("lifeRef"), required("onsetFlag"),
                        optional("additionMode", "one_time"), required("periodicAdditionRef"),
                        required("activeFlag")),
                b -> "periodic".equals(b.get("additionMode")) ? periodicAmortisation() : oneTimeAmortisation()));

        r.register(new ModuleTemplate("depreciation_amortization",
                "Depreciation of the capital spent up to operations start, straight-line or declining balance",
                List.of(required("additionsRef"), required("opsFlagRef"), optional("lifeYears", "25"),
                        optional("method", "straight_line"), optional("dbMultiplier", "2")),
                b -> "declining_balance".equals(b.get("method")) ? decliningBalance() : straightLine()));

        r.register(new ModuleTemplate("gst_receivable",
                "GST paid on a base amount and recovered one period later",
                List.of(required("gstBaseRef"), required("gstRatePct"), required("activeFlagRef"),
                        required("constructionFlagRef"), required("operationsFlagRef")),
                b -> gstReceivable()));

        r.register(new ModuleTemplate("tax_losses",
                "Tax payable with losses carried forward",
                List.of(required("taxableIncomeRef"), required("opsFlagRef"), required("taxRatePct")),
                b -> taxLosses()));
    }

    static List<TemplateOutput> oneTimeAmortisation() {
        return List.of(
                of("addition", "Capital Addition", FLOW,
                        "CUMSUM($input.capitalisedRef) * $input.onsetFlag.Start"),
                of("opening", "Opening Book Value", STOCK_START,
                        "MAX(0, (CUMSUM($self.addition) - $self.addition) - CUMSUM($input.capitalisedRef) / $input.lifeRef / T.MiY * (CUMSUM($input.onsetFlag) - $input.onsetFlag))"),
                of("expense", "Depreciation Expense", FLOW,
                        "MIN($self.opening + $self.addition, CUMSUM($input.capitalisedRef) / $input.lifeRef / T.MiY) * $input.onsetFlag"),
                of("accumulated", "Accumulated Depreciation", STOCK,
                        "CUMSUM($self.expense)"),
                of("closing", "Closing Book Value", STOCK,
                        "MAX(0, CUMSUM($self.addition) - CUMSUM($input.capitalisedRef) / $input.lifeRef / T.MiY * CUMSUM($input.onsetFlag))"));
    }

    static List<TemplateOutput> periodicAmortisation() {
        return List.of(
                of("active_flag", "Active Flag", FLAG,
                        "$input.onsetFlag * (CUMSUM($input.activeFlag) > 0)"),
                of("total_capitalised", "Total Capitalised", STOCK,
                        "CUMSUM($input.periodicAdditionRef)"),
                of("addition", "Addition", FLOW,
                        "$input.periodicAdditionRef"),
                of("opening", "Opening", STOCK_START,
                        "MAX(0, (CUMSUM($self.addition) - $self.addition) - (CUMSUM($self.addition) - $self.addition) / $input.lifeRef / T.MiY * (CUMSUM($self.active_flag) - $self.active_flag))"),
                of("expense", "Depreciation Expense", FLOW,
                        "$self.opening + $self.addition - $self.closing"),
                of("accumulated", "Accumulated", STOCK,
                        "CUMSUM($self.expense)"),
                of("closing", "Closing NBV", STOCK,
                        "MAX(0, CUMSUM($self.addition) - CUMSUM($self.addition) / $input.lifeRef / T.MiY * CUMSUM($self.active_flag))"));
    }

    static List<TemplateOutput> straightLine() {
        String ops = "$input.opsFlagRef";
        String rate = "CUMSUM($self.addition) / $input.lifeYears / T.MiY";
        return List.of(
                of("opening", "Opening Book Value", STOCK_START,
                        "MAX(0, (CUMSUM($self.addition) - $self.addition) - " + rate + " * (CUMSUM(" + ops + ") - " + ops + "))"),
                of("addition", "Capital Addition", FLOW,
                        "CUMSUM($input.additionsRef) * " + ops + ".Start"),
                of("depreciation", "Depreciation Expense", FLOW,
                        "MIN($self.opening + $self.addition, " + rate + ") * " + ops),
                of("accumulated", "Accumulated Depreciation", STOCK,
                        "CUMSUM($self.depreciation)"),
                of("closing", "Closing Book Value", STOCK,
                        "MAX(0, CUMSUM($self.addition) - " + rate + " * CUMSUM(" + ops + "))"));
    }

    /** Closed form: the book value after n operating periods is the capital times (1 - r)^n. */
    static List<TemplateOutput> decliningBalance() {
        String ops = "$input.opsFlagRef";
        String rate = "$input.dbMultiplier / $input.lifeYears / T.MiY";
        return List.of(
                of("opening", "Opening Book Value", STOCK_START,
                        "(CUMSUM($self.addition) - $self.addition) * (1 - " + rate + ") ^ (CUMSUM(" + ops + ") - " + ops + ")"),
                of("addition", "Capital Addition", FLOW,
                        "CUMSUM($input.additionsRef) * " + ops + ".Start"),
                of("depreciation", "Depreciation Expense", FLOW,
                        "MAX(0, ($self.opening + $self.addition) * " + rate + ") * " + ops),
                of("accumulated", "Accumulated Depreciation", STOCK,
                        "CUMSUM($self.depreciation)"),
                of("closing", "Closing Book Value", STOCK,
                        "MAX(0, CUMSUM($self.addition) * (1 - " + rate + ") ^ CUMSUM(" + ops + "))"));
    }

    static List<TemplateOutput> gstReceivable() {
        return List.of(
                of("gst_base", "GST Base Amount", FLOW,
                        "$input.gstBaseRef"),
                of("gst_amount", "GST Amount", FLOW,
                        "$input.gstBaseRef * $input.gstRatePct / 100 * $input.activeFlagRef"),
                of("gst_paid", "GST Paid (Outflow)", FLOW,
                        "-$self.gst_amount"),
                of("receivable_opening", "GST Receivable - Opening", STOCK_START,
                        "(CUMSUM($self.gst_amount) - $self.gst_amount) - (CUMSUM($self.gst_received) - $self.gst_received)"),
                of("gst_received", "GST Received (Inflow)", FLOW,
                        "PREVVAL($self.gst_amount)"),
                of("receivable_closing", "GST Receivable - Closing", STOCK,
                        "CUMSUM($self.gst_amount) - CUMSUM($self.gst_received)"),
                of("net_gst_cashflow", "Net GST Cash Flow", FLOW,
                        "$self.gst_paid + $self.gst_received"),
                of("gst_received_construction", "GST Received (Construction)", FLOW,
                        "$self.gst_received * $input.constructionFlagRef"),
                of("gst_received_operations", "GST Received (Operations)", FLOW,
                        "$self.gst_received * $input.operationsFlagRef"));
    }

    /**
     * The opening balance reads earlier movements through PREVSUM: utilisation
     * depends on the opening balance in the same period.
     */
    static List<TemplateOutput> taxLosses() {
        return List.of(
                of("taxable_income", "Taxable Income Before Losses", FLOW,
                        "$input.taxableIncomeRef"),
                of("losses_opening", "Tax Losses - Opening", STOCK_START,
                        "MAX(0, PREVSUM($self.losses_generated) - PREVSUM($self.losses_utilised))"),
                of("losses_generated", "Tax Losses - Generated", FLOW,
                        "MAX(0, -$self.taxable_income) * $input.opsFlagRef"),
                of("losses_utilised", "Tax Losses - Utilised", FLOW,
                        "MIN($self.losses_opening, MAX(0, $self.taxable_income)) * $input.opsFlagRef"),
                of("losses_closing", "Tax Losses - Closing", STOCK,
                        "MAX(0, CUMSUM($self.losses_generated) - CUMSUM($self.losses_utilised))"),
                of("net_taxable", "Net Taxable Income", FLOW,
                        "MAX(0, $self.taxable_income - $self.losses_utilised) * $input.opsFlagRef"),
                of("tax_payable", "Tax Payable", FLOW,
                        "$self.net_taxable * $input.taxRatePct / 100"));
    }
}
