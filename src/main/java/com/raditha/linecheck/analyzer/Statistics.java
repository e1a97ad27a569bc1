package com.raditha.linecheck.analyzer;

import com.raditha.linecheck.model.DiagnosticCode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-run counters: diagnostics per code plus the number of physical and
 * logical lines seen.
 */
public class Statistics {

    private final Map<DiagnosticCode, Integer> counts = new EnumMap<>(DiagnosticCode.class);
    private int physicalLines;
    private int logicalLines;

    public void record(DiagnosticCode code) {
        counts.merge(code, 1, Integer::sum);
    }

    public void physicalLineSeen() {
        physicalLines++;
    }

    public void logicalLineSeen() {
        logicalLines++;
    }

    /**
     * Add the counters of another run to this one.
     */
    public void merge(Statistics other) {
        other.counts.forEach((code, count) -> counts.merge(code, count, Integer::sum));
        physicalLines += other.physicalLines;
        logicalLines += other.logicalLines;
    }

    public int count(DiagnosticCode code) {
        return counts.getOrDefault(code, 0);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Counts keyed by code, in code order.
     */
    public Map<DiagnosticCode, Integer> counts() {
        return Collections.unmodifiableMap(counts);
    }

    public int getPhysicalLines() {
        return physicalLines;
    }

    public int getLogicalLines() {
        return logicalLines;
    }
}
