package com.raditha.linecheck.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.linecheck.analyzer.CheckReport;
import com.raditha.linecheck.analyzer.Statistics;
import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exports style metrics to CSV and JSON formats for dashboard integration
 * and historical tracking.
 */
public class MetricsExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Project-level metrics aggregated from all checked files.
     */
    public record ProjectMetrics(
            String projectName,
            LocalDateTime timestamp,
            int totalFiles,
            int totalDiagnostics,
            int filesWithStructuralErrors,
            int totalPhysicalLines,
            int totalLogicalLines,
            Map<String, Integer> countsPerCode,
            List<FileMetrics> files) {
    }

    /**
     * Per-file style metrics.
     */
    public record FileMetrics(
            String fileName,
            int diagnosticCount,
            int physicalLines,
            int logicalLines,
            String structuralError,
            List<String> codes) {
    }

    /**
     * Build aggregated metrics from check reports.
     */
    public ProjectMetrics buildMetrics(List<CheckReport> reports, String projectName) {
        List<FileMetrics> fileMetrics = reports.stream()
                .map(this::buildFileMetrics)
                .toList();

        Statistics total = new Statistics();
        reports.forEach(r -> total.merge(r.statistics()));

        Map<String, Integer> countsPerCode = new LinkedHashMap<>();
        for (Map.Entry<DiagnosticCode, Integer> entry : total.counts().entrySet()) {
            countsPerCode.put(entry.getKey().name(), entry.getValue());
        }

        int filesWithErrors = (int) reports.stream()
                .filter(CheckReport::hasStructuralError)
                .count();

        return new ProjectMetrics(
                projectName,
                LocalDateTime.now(),
                reports.size(),
                total.total(),
                filesWithErrors,
                total.getPhysicalLines(),
                total.getLogicalLines(),
                countsPerCode,
                fileMetrics);
    }

    /**
     * Build metrics for a single file.
     */
    private FileMetrics buildFileMetrics(CheckReport report) {
        List<String> codes = report.diagnostics().stream()
                .map(Diagnostic::code)
                .map(DiagnosticCode::name)
                .distinct()
                .sorted()
                .toList();

        return new FileMetrics(
                report.fileName(),
                report.diagnostics().size(),
                report.statistics().getPhysicalLines(),
                report.statistics().getLogicalLines(),
                report.hasStructuralError() ? report.structuralError().getMessage() : null,
                codes);
    }

    /**
     * Export metrics to CSV format.
     */
    public void exportToCsv(ProjectMetrics metrics, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        // Header - Summary
        csv.append("# Project Summary\n");
        csv.append("timestamp,project,total_files,total_diagnostics,structural_errors,physical_lines,logical_lines\n");
        csv.append(String.format("%s,%s,%d,%d,%d,%d,%d\n",
                metrics.timestamp().format(TIMESTAMP_FORMAT),
                metrics.projectName(),
                metrics.totalFiles(),
                metrics.totalDiagnostics(),
                metrics.filesWithStructuralErrors(),
                metrics.totalPhysicalLines(),
                metrics.totalLogicalLines()));

        csv.append("\n");

        csv.append("# Counts Per Code\n");
        csv.append("code,count\n");
        metrics.countsPerCode().forEach((code, count) -> csv.append(code).append(',').append(count).append('\n'));

        csv.append("\n");

        // Header - Per-file metrics
        csv.append("# Per-File Metrics\n");
        csv.append("file,diagnostics,physical_lines,logical_lines,codes,structural_error\n");

        for (FileMetrics file : metrics.files()) {
            String codes = file.codes().isEmpty() ? "NONE" : String.join(";", file.codes());
            String error = file.structuralError() == null ? "" : quote(file.structuralError());

            csv.append(String.format("%s,%d,%d,%d,%s,%s\n",
                    quote(file.fileName()),
                    file.diagnosticCount(),
                    file.physicalLines(),
                    file.logicalLines(),
                    codes,
                    error));
        }

        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Export metrics to JSON format.
     */
    public void exportToJson(ProjectMetrics metrics, Path outputPath) throws IOException {
        Files.writeString(outputPath, toJson(metrics));
    }

    public String toJson(Object value) throws IOException {
        return mapper.writeValueAsString(value);
    }

    private static String quote(String value) {
        if (value.contains(",") || value.contains("\"")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
