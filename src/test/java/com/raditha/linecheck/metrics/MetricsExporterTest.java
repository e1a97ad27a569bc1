package com.raditha.linecheck.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.linecheck.analyzer.CheckReport;
import com.raditha.linecheck.analyzer.StyleChecker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MetricsExporter - CSV and JSON export functionality.
 */
class MetricsExporterTest {

    @TempDir
    Path tempDir;

    private MetricsExporter exporter;
    private List<CheckReport> reports;

    @BeforeEach
    void setUp() {
        exporter = new MetricsExporter();
        StyleChecker checker = new StyleChecker();
        reports = List.of(
                checker.check("bad.py", List.of("x=1\n", "y = 2 \n")),
                checker.check("good.py", List.of("x = 1\n")),
                checker.check("broken.py", List.of("x = (1,\n")));
    }

    @Test
    void testBuildMetrics() {
        MetricsExporter.ProjectMetrics metrics = exporter.buildMetrics(reports, "test-project");

        assertEquals("test-project", metrics.projectName());
        assertNotNull(metrics.timestamp());
        assertEquals(3, metrics.totalFiles());
        assertEquals(2, metrics.totalDiagnostics());
        assertEquals(1, metrics.filesWithStructuralErrors());
        assertEquals(Map.of("E225", 1, "W291", 1), metrics.countsPerCode());
        assertEquals(4, metrics.totalPhysicalLines());
        assertEquals(3, metrics.totalLogicalLines());

        MetricsExporter.FileMetrics bad = metrics.files().get(0);
        assertEquals("bad.py", bad.fileName());
        assertEquals(List.of("E225", "W291"), bad.codes());
        assertNull(bad.structuralError());
        assertNotNull(metrics.files().get(2).structuralError());
    }

    @Test
    void testExportToCsv() throws IOException {
        MetricsExporter.ProjectMetrics metrics = exporter.buildMetrics(reports, "test-project");
        Path csvFile = tempDir.resolve("metrics.csv");

        exporter.exportToCsv(metrics, csvFile);

        String csv = Files.readString(csvFile);
        assertTrue(csv.contains("# Project Summary"));
        assertTrue(csv.contains("timestamp,project,total_files,total_diagnostics"));
        assertTrue(csv.contains(",test-project,3,2,1,4,3\n"), csv);
        assertTrue(csv.contains("E225,1\n"));
        assertTrue(csv.contains("bad.py,2,2,2,E225;W291,\n"), csv);
        assertTrue(csv.contains("good.py,0,1,1,NONE,\n"), csv);
        assertTrue(csv.contains("broken.py,0,1,0,NONE,\"EOF in multi-line statement at (2, 0)\""), csv);
    }

    @Test
    void testExportToJson() throws IOException {
        MetricsExporter.ProjectMetrics metrics = exporter.buildMetrics(reports, "test-project");
        Path jsonFile = tempDir.resolve("metrics.json");

        exporter.exportToJson(metrics, jsonFile);

        JsonNode root = new ObjectMapper().readTree(jsonFile.toFile());
        assertEquals("test-project", root.get("projectName").asText());
        assertEquals(2, root.get("totalDiagnostics").asInt());
        assertEquals(1, root.get("countsPerCode").get("W291").asInt());
        assertEquals(3, root.get("files").size());
        assertTrue(root.get("timestamp").isTextual(), "dates are written as ISO strings");
    }
}
