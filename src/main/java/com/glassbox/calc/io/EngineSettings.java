package com.glassbox.calc.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.glassbox.calc.expr.FormulaLimits;

import lombok.Data;

/**
 * Engine tuning. Every field has a default, so an empty file is valid.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EngineSettings {
    /** Longest formula accepted, in characters. */
    private int maxFormulaLength = 20000;
    private int maxAstNodes = 10000;
    private int maxParseDepth = 256;
    /** Default balance-check tolerance when a rule gives none. */
    private double balanceTolerance = 0.01;
    /** Minimum gap between two logged evaluation failures. */
    private long errorLogIntervalMillis = 1000;
    private int irrMaxIterations = 100;
    private double irrTolerance = 1e-8;

    public FormulaLimits formulaLimits() {
        return new FormulaLimits(maxFormulaLength, maxAstNodes, maxParseDepth);
    }
}
