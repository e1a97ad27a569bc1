package com.raditha.linecheck.analyzer;

import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.model.Location;
import com.raditha.linecheck.model.StructuralException;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Result of checking one file.
 *
 * @param fileName        Name the file was checked under
 * @param diagnostics     Reported diagnostics in the order they were found
 * @param statistics      Counters for the run
 * @param structuralError Fault that stopped the analysis early, if any
 */
public record CheckReport(
        String fileName,
        List<Diagnostic> diagnostics,
        Statistics statistics,
        @Nullable StructuralException structuralError) {

    public CheckReport {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public boolean hasStructuralError() {
        return structuralError != null;
    }

    /**
     * A file is clean if it has no diagnostics and was analyzed to the end.
     */
    public boolean isClean() {
        return !hasDiagnostics() && !hasStructuralError();
    }

    public List<Diagnostic> getDiagnosticsWithCode(DiagnosticCode code) {
        return diagnostics.stream().filter(d -> d.code() == code).toList();
    }

    /**
     * Render one diagnostic in the classic {@code path:row:col: CODE message} form.
     * The column is printed 1-based.
     */
    public String format(Diagnostic diagnostic) {
        Location location = diagnostic.location();
        return fileName + ":" + location.toDisplayString() + ": " + diagnostic.description();
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        String summary = String.format("%s: %d diagnostics in %d logical lines (%d physical lines)",
                fileName,
                diagnostics.size(),
                statistics.getLogicalLines(),
                statistics.getPhysicalLines());
        if (structuralError != null) {
            summary += ", stopped early: " + structuralError.getMessage();
        }
        return summary;
    }

    /**
     * Get detailed report string.
     */
    public String getDetailedReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(80)).append("\n");
        sb.append("STYLE CHECK REPORT\n");
        sb.append("=".repeat(80)).append("\n\n");

        sb.append("File: ").append(fileName).append("\n\n");
        sb.append(getSummary()).append("\n\n");

        if (diagnostics.isEmpty()) {
            sb.append("No problems found.\n");
        } else {
            sb.append("Diagnostics:\n");
            sb.append("-".repeat(80)).append("\n");
            for (Diagnostic diagnostic : diagnostics) {
                sb.append(format(diagnostic)).append("\n");
            }
            sb.append("\n");
            sb.append("Counts per code:\n");
            for (Map.Entry<DiagnosticCode, Integer> entry : statistics.counts().entrySet()) {
                sb.append(String.format("  %-5d %s %s%n", entry.getValue(), entry.getKey(),
                        entry.getKey().template()));
            }
        }
        if (structuralError != null) {
            sb.append("\nStructural error: ").append(structuralError.getMessage()).append("\n");
        }
        return sb.toString();
    }
}
