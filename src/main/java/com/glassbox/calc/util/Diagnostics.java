package com.glassbox.calc.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.Logger;

import com.glassbox.calc.util.Diagnostic.Kind;

/**
 * Ordered collector of diagnostics. Each entry is also written to the owning
 * component's logger at WARN.
 */
public final class Diagnostics {
    private final Logger log;
    private final List<Diagnostic> entries = new ArrayList<>();

    public Diagnostics(Logger log) {
        this.log = log;
    }

    public void warn(Kind kind, String subject, String message) {
        add(Diagnostic.warning(kind, subject, message));
    }

    public void error(Kind kind, String subject, String message) {
        add(Diagnostic.error(kind, subject, message));
    }

    public void add(Diagnostic d) {
        entries.add(d);
        if (log != null)
            log.warn("{}", d);
    }

    public void addAll(List<Diagnostic> ds) {
        for (Diagnostic d : ds)
            add(d);
    }

    public boolean hasErrors() {
        for (Diagnostic d : entries) {
            if (d.isError())
                return true;
        }
        return false;
    }

    public int size() {
        return entries.size();
    }

    public List<Diagnostic> list() {
        return Collections.unmodifiableList(entries);
    }

    /** Entries of one kind, in order. */
    public List<Diagnostic> ofKind(Kind kind) {
        List<Diagnostic> out = new ArrayList<>();
        for (Diagnostic d : entries) {
            if (d.kind() == kind)
                out.add(d);
        }
        return out;
    }
}
