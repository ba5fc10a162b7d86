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
 * Senior debt sculpting and the debt service reserve facility.
 *
 * <p>
 * Several of these outputs read their own value from the previous period
 * through {@code PREVVAL}, so they schedule as lag clusters and evaluate
 * period by period.
 */
final class DebtTemplates {

    private DebtTemplates() {
    }

    static void registerAll(TemplateRegistry r) {
        r.register(new ModuleTemplate("iterative_debt_sizing",
                "Debt sized against CFADS and target DSCRs, repaid quarterly",
                List.of(required("contractedCfadsRef"), required("contractedDSCR"), required("merchantCfadsRef"),
                        required("merchantDSCR"), required("debtFlagRef"), required("interestRatePct"),
                        required("tenorYears")),
                b -> debtSizing()));

        r.register(new ModuleTemplate("dsrf",
                "Debt service reserve facility with refinancing resets",
                List.of(required("operationsFlagRef"), optional("refiFlagsExpr", "0"), required("debtServiceRef"),
                        required("facilityMonthsRef"), required("refiFeePct"), required("baseMarginPctRef"),
                        required("refiMarginPct"), optional("establishmentFlagRef", "F1"),
                        required("establishmentFeePctRef"), required("commitmentFeePctOfMarginRef"),
                        required("contractedCfadsRef"), required("merchantCfadsRef"), required("debtFlagRef")),
                b -> dsrf()));
    }

    static List<TemplateOutput> debtSizing() {
        String debt = "$input.debtFlagRef";
        return List.of(
                of("sized_debt", "Sized Debt Amount", FLOW, "0").asSolver()
                        .describedAs("Debt amount written back by the sizing solver"),
                of("ds_capacity_monthly", "DS Capacity (Monthly)", FLOW,
                        "($input.contractedCfadsRef / $input.contractedDSCR + $input.merchantCfadsRef / $input.merchantDSCR) * " + debt),
                of("monthly_interest", "Monthly Interest", FLOW,
                        "$self.opening_balance * $input.interestRatePct / 100 / T.MiY * " + debt),
                of("accrued_interest", "Accrued Interest", STOCK,
                        "(PREVVAL($self.accrued_interest) * (1 - PREVVAL(T.QE)) + $self.monthly_interest) * " + debt),
                of("opening_balance", "Opening Balance", STOCK_START,
                        "PREVVAL($self.closing_balance) + M_SELF.1 * $input.debtFlagRef.Start"),
                of("accrued_capacity", "Accrued DS Capacity", STOCK,
                        "(PREVVAL($self.accrued_capacity) * (1 - PREVVAL(T.QE)) + $self.ds_capacity_monthly) * " + debt),
                of("remaining_periods", "Remaining Periods", STOCK,
                        "IF($input.debtFlagRef.Start, $input.tenorYears * T.QiY, MAX(1, PREVVAL($self.remaining_periods) - PREVVAL($self.payment_period_flag))) * " + debt),
                of("interest_payment", "Interest Payment", FLOW,
                        "$self.accrued_interest * $self.payment_period_flag * " + debt),
                of("principal_payment", "Principal Payment", FLOW,
                        "MIN(MAX(0, $self.accrued_capacity - $self.interest_payment), $self.opening_balance / MAX(1, $self.remaining_periods)) * $self.payment_period_flag * " + debt),
                of("debt_service", "Total Debt Service", FLOW,
                        "$self.interest_payment + $self.principal_payment"),
                of("accrued_cfads", "Accrued CFADS", STOCK,
                        "(PREVVAL($self.accrued_cfads) * (1 - PREVVAL(T.QE)) + $input.contractedCfadsRef + $input.merchantCfadsRef) * " + debt),
                of("closing_balance", "Closing Balance", STOCK,
                        "MAX(0, $self.opening_balance - $self.principal_payment)"),
                of("period_dscr", "Period DSCR", STOCK,
                        "$self.accrued_cfads / MAX($self.debt_service, 0.0001) * $self.payment_period_flag * " + debt),
                of("cumulative_principal", "Cumulative Principal", STOCK,
                        "CUMSUM($self.principal_payment)"),
                of("payment_period_flag", "Payment Period Flag", FLAG,
                        "(T.QE + $input.debtFlagRef.End - T.QE * $input.debtFlagRef.End) * " + debt));
    }

    static List<TemplateOutput> dsrf() {
        String ops = "$input.operationsFlagRef";
        return List.of(
                of("recalc_trigger", "Recalc Trigger", FLAG,
                        "$input.operationsFlagRef.Start + $input.refiFlagsExpr"),
                of("facility_limit", "Facility Limit", STOCK,
                        "PREVVAL($self.facility_limit) * (1 - $self.recalc_trigger) + FWDSUM(ABS($input.debtServiceRef), $input.facilityMonthsRef) * $self.recalc_trigger * " + ops),
                of("refi_fees", "Refinancing Fees", FLOW,
                        "$self.facility_limit * ($input.refiFlagsExpr) * $input.refiFeePct / 100"),
                of("effective_margin", "Effective Margin", STOCK,
                        "PREVVAL($self.effective_margin) * (1 - $self.recalc_trigger) + ($input.baseMarginPctRef * $input.operationsFlagRef.Start + $input.refiMarginPct * ($input.refiFlagsExpr)) * $self.recalc_trigger + $input.baseMarginPctRef * (CUMSUM(1) == 1)"),
                of("establishment_fee", "Establishment Fee", FLOW,
                        "MAXVAL($self.facility_limit) * $input.establishmentFeePctRef / 100 * $input.establishmentFlagRef.Start"),
                of("commitment_fee", "Commitment Fee", FLOW,
                        "$self.facility_limit * $self.effective_margin / 100 * $input.commitmentFeePctOfMarginRef / 100 / T.QiY * T.QE * " + ops),
                of("total_dsrf_fees", "Total DSRF Fees", FLOW,
                        "$self.establishment_fee + $self.commitment_fee + $self.refi_fees"),
                of("total_dsrf_fees_cumulative", "Cumulative DSRF Fees", STOCK,
                        "CUMSUM($self.total_dsrf_fees)"),
                of("ds_plus_dsrf", "Debt Service + DSRF Fees", FLOW,
                        "ABS($input.debtServiceRef) + $self.total_dsrf_fees"),
                of("adjusted_dscr", "Adjusted DSCR", STOCK,
                        "($input.contractedCfadsRef + $input.merchantCfadsRef) / MAX($self.ds_plus_dsrf, 0.0001) * $input.debtFlagRef"));
    }
}
