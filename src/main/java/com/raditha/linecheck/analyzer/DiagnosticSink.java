package com.raditha.linecheck.analyzer;

import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, append-only collection of the diagnostics of one file.
 */
public class DiagnosticSink {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public boolean containsCode(DiagnosticCode code) {
        return diagnostics.stream().anyMatch(d -> d.code() == code);
    }

    public List<Diagnostic> withCode(DiagnosticCode code) {
        return diagnostics.stream().filter(d -> d.code() == code).toList();
    }

    /**
     * Diagnostics whose code is not in {@code codes}, in insertion order.
     */
    public List<Diagnostic> ignoring(Set<DiagnosticCode> codes) {
        return diagnostics.stream().filter(d -> !codes.contains(d.code())).toList();
    }

    /**
     * Codes reported so far, in order of first appearance.
     */
    public Set<DiagnosticCode> distinctCodes() {
        Set<DiagnosticCode> codes = new LinkedHashSet<>();
        for (Diagnostic diagnostic : diagnostics) {
            codes.add(diagnostic.code());
        }
        return Collections.unmodifiableSet(codes);
    }

    public List<Diagnostic> all() {
        return Collections.unmodifiableList(diagnostics);
    }

    public int size() {
        return diagnostics.size();
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }
}
