package com.glassbox.calc.expr;

import com.glassbox.calc.util.Diagnostic.Kind;

/** A formula that cannot be parsed, or that exceeds the configured limits. */
public class FormulaSyntaxException extends RuntimeException {
    private final int position;
    private final Kind kind;

    public FormulaSyntaxException(String message, int position) {
        this(message, position, Kind.PARSE_ERROR);
    }

    public FormulaSyntaxException(String message, int position, Kind kind) {
        super(position >= 0 ? message + " at position " + position : message);
        this.position = position;
        this.kind = kind;
    }

    /** Character offset in the formula, or -1 when not tied to a location. */
    public int position() {
        return position;
    }

    public Kind kind() {
        return kind;
    }
}
