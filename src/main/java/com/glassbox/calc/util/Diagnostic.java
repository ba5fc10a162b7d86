package com.glassbox.calc.util;

/**
 * A warning or error attached to a compile or run.
 *
 * @param severity how bad it is
 * @param kind     what went wrong
 * @param subject  the item it concerns ({@code R12}, a key-period name, a module), may be null
 * @param message  human-readable detail
 */
public record Diagnostic(Severity severity, Kind kind, String subject, String message) {

    public enum Severity {
        WARNING, ERROR
    }

    public enum Kind {
        UNKNOWN_REFERENCE,
        CIRCULAR_DEPENDENCY,
        ARITHMETIC_FAULT,
        PARSE_ERROR,
        BUDGET_EXCEEDED,
        UNRESOLVED_PLACEHOLDER,
        UNKNOWN_SYMBOL,
        ANCHOR_UNRESOLVED,
        NAME_COLLISION,
        UPSTREAM_ERROR
    }

    public static Diagnostic warning(Kind kind, String subject, String message) {
        return new Diagnostic(Severity.WARNING, kind, subject, message);
    }

    public static Diagnostic error(Kind kind, String subject, String message) {
        return new Diagnostic(Severity.ERROR, kind, subject, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " " + kind + (subject == null ? "" : " [" + subject + "]") + ": " + message;
    }
}
