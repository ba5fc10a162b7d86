package com.glassbox.calc.recipe;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/** Post-run checks declared alongside a model. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class ValidationRules {
    private BalanceCheck balanceSheet;
    private BalanceCheck sourcesAndUses;
    private List<CovenantRule> covenants = new ArrayList<>();
    private List<IrrCheck> irr = new ArrayList<>();

    /** The referenced series must stay within tolerance of zero in every period. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class BalanceCheck {
        private String checkRef;
        @JsonAlias("threshold")
        private Double tolerance;
    }

    /**
     * Threshold on the non-zero values of a series. {@code rule} is {@code min}
     * or {@code minValue} (smallest non-zero value at least the threshold), or
     * {@code max}/{@code maxValue}.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class CovenantRule {
        private String name, ref;
        private String rule = "min";
        private double threshold;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class IrrCheck {
        private String name, cashFlowRef;
        /** Optional {@code [low, high]} bounds on the annualised rate. */
        private List<Double> expectedRange;
    }
}
