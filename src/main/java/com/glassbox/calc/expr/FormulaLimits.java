package com.glassbox.calc.expr;

/**
 * Bounds on the size of a formula. Formulas beyond them are rejected before
 * evaluation.
 */
public record FormulaLimits(int maxFormulaLength, int maxAstNodes, int maxParseDepth) {

    public static final FormulaLimits DEFAULT = new FormulaLimits(20_000, 10_000, 256);

    public FormulaLimits {
        if (maxFormulaLength <= 0 || maxAstNodes <= 0 || maxParseDepth <= 0)
            throw new IllegalArgumentException("Formula limits must be positive");
    }
}
