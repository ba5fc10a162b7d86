package com.glassbox.calc.expr;

import java.util.List;

import com.glassbox.calc.util.Diagnostic.Kind;

/** Every reference in a formula that the value source could not resolve. */
public class UnknownReferenceException extends EvaluationException {
    private final List<String> missing;

    public UnknownReferenceException(List<String> missing) {
        super(Kind.UNKNOWN_REFERENCE, "Unknown reference" + (missing.size() > 1 ? "s" : "") + ": "
                + String.join(", ", missing));
        this.missing = List.copyOf(missing);
    }

    public List<String> missing() {
        return missing;
    }
}
