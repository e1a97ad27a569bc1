package com.raditha.linecheck.cli;

import com.raditha.linecheck.analyzer.CheckReport;
import com.raditha.linecheck.analyzer.Statistics;
import com.raditha.linecheck.checks.CheckerRegistry;
import com.raditha.linecheck.metrics.MetricsExporter;
import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.model.Location;
import com.raditha.linecheck.model.Position;
import com.raditha.linecheck.util.SourceText;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes check results to the console.
 */
public class ReportPrinter {

    private static final String VERSION = "1.0.0";

    private final PrintWriter out;
    private final CheckerRegistry registry;
    private final boolean showSource;
    private final boolean showDocumentation;
    private final Set<DiagnosticCode> documented = EnumSet.noneOf(DiagnosticCode.class);

    public ReportPrinter(PrintWriter out, CheckerRegistry registry, boolean showSource, boolean showDocumentation) {
        this.out = out;
        this.registry = registry;
        this.showSource = showSource;
        this.showDocumentation = showDocumentation;
    }

    /**
     * Print every diagnostic of a file, one per line.
     *
     * @param report result of checking the file
     * @param lines  physical lines of the file, used for --show-source
     */
    public void printReport(CheckReport report, List<String> lines) {
        for (Diagnostic diagnostic : report.diagnostics()) {
            out.println(report.format(diagnostic));
            if (showSource) {
                printSource(diagnostic.location(), lines);
            }
            if (showDocumentation && documented.add(diagnostic.code())) {
                printDocumentation(diagnostic.code());
            }
        }
        if (report.hasStructuralError()) {
            Position position = report.structuralError().getPosition();
            out.printf("%s:%s: %s%n", report.fileName(), Location.of(position).toDisplayString(),
                    report.structuralError().getMessage());
        }
    }

    /**
     * Print the name of a file that has problems, used by --quiet.
     */
    public void printFileName(CheckReport report) {
        if (!report.isClean()) {
            out.println(report.fileName());
        }
    }

    /**
     * The offending line followed by a caret under the column.
     * Tabs before the column are kept so the caret lines up.
     */
    private void printSource(Location location, List<String> lines) {
        if (location.row() < 1 || location.row() > lines.size()) {
            return;
        }
        String line = SourceText.stripLineTerminators(lines.get(location.row() - 1));
        out.println(line.stripTrailing());
        StringBuilder caret = new StringBuilder();
        for (int i = 0; i < Math.min(location.column(), line.length()); i++) {
            caret.append(Character.isWhitespace(line.charAt(i)) ? line.charAt(i) : ' ');
        }
        out.println(caret.append('^'));
    }

    private void printDocumentation(DiagnosticCode code) {
        registry.descriptorFor(code)
                .map(descriptor -> descriptor.check().documentation())
                .filter(doc -> !doc.isBlank())
                .ifPresent(doc -> doc.lines().forEach(line -> out.println("    " + line)));
    }

    /**
     * Count per code over all files, e.g. {@code 3       E225 missing whitespace around operator}.
     * The message shown is the first one reported for the code.
     */
    public void printStatistics(List<CheckReport> reports) {
        Statistics total = new Statistics();
        Map<DiagnosticCode, String> firstMessage = new EnumMap<>(DiagnosticCode.class);
        for (CheckReport report : reports) {
            total.merge(report.statistics());
            for (Diagnostic diagnostic : report.diagnostics()) {
                firstMessage.putIfAbsent(diagnostic.code(), diagnostic.message());
            }
        }
        for (Map.Entry<DiagnosticCode, String> entry : firstMessage.entrySet()) {
            out.printf("%-7d %s %s%n", total.count(entry.getKey()), entry.getKey(), entry.getValue());
        }
    }

    /**
     * Print all results as one JSON document.
     *
     * @throws IOException if serialization fails
     */
    public void printJson(List<CheckReport> reports, MetricsExporter exporter) throws IOException {
        List<JsonFile> files = new ArrayList<>();
        int total = 0;
        for (CheckReport report : reports) {
            List<JsonDiagnostic> diagnostics = report.diagnostics().stream()
                    .map(JsonDiagnostic::of)
                    .toList();
            total += diagnostics.size();
            String error = report.hasStructuralError() ? report.structuralError().getMessage() : null;
            files.add(new JsonFile(report.fileName(), diagnostics, error));
        }
        out.println(exporter.toJson(new JsonReport(VERSION, reports.size(), total, files)));
    }

    public record JsonReport(String version, int filesChecked, int totalDiagnostics, List<JsonFile> files) {
    }

    public record JsonFile(String path, List<JsonDiagnostic> diagnostics, String structuralError) {
    }

    public record JsonDiagnostic(String code, int row, int column, String message) {

        static JsonDiagnostic of(Diagnostic diagnostic) {
            Location location = diagnostic.location();
            return new JsonDiagnostic(diagnostic.code().name(), location.row(), location.column() + 1,
                    diagnostic.message());
        }
    }
}
