package com.raditha.linecheck.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class LineCheckCLITest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine cmd = LineCheckCLI.createCommandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testCleanFile() throws IOException {
        Path file = write("clean.py", "x = 1\n");

        assertEquals(0, run(file.toString()));
        assertEquals("", out.toString());
    }

    @Test
    void testDiagnosticLine() throws IOException {
        Path file = write("bad.py", "x=1\n");

        assertEquals(1, run(file.toString()));
        assertTrue(out.toString().contains(file + ":1:2: E225 missing whitespace around operator"), out.toString());
    }

    @Test
    void testStructuralErrorIsReported() throws IOException {
        Path file = write("broken.py", "x = (1,\n");

        assertEquals(1, run(file.toString()));
        assertTrue(out.toString().contains(file + ":2:1: EOF in multi-line statement"), out.toString());
    }

    @Test
    void testJsonOutput() throws IOException {
        Path file = write("bad.py", "x=1\n");

        assertEquals(1, run("--json", file.toString()));

        JsonNode root = new ObjectMapper().readTree(out.toString());
        assertEquals(1, root.get("filesChecked").asInt());
        assertEquals(1, root.get("totalDiagnostics").asInt());
        JsonNode diagnostic = root.get("files").get(0).get("diagnostics").get(0);
        assertEquals("E225", diagnostic.get("code").asText());
        assertEquals(1, diagnostic.get("row").asInt());
        assertEquals(2, diagnostic.get("column").asInt());
    }

    @Test
    void testStatistics() throws IOException {
        Path file = write("bad.py", "x=1\ny=2\n");

        run("--statistics", file.toString());

        assertTrue(out.toString().contains("2       E225 missing whitespace around operator"), out.toString());
    }

    @Test
    void testCountGoesToStandardError() throws IOException {
        Path file = write("bad.py", "x=1\ny = 2 \n");

        run("--count", file.toString());

        assertEquals("2", err.toString().strip());
    }

    @Test
    void testQuietPrintsOnlyFileNames() throws IOException {
        Path bad = write("bad.py", "x=1\n");
        Path clean = write("clean.py", "x = 1\n");

        assertEquals(1, run("--quiet", bad.toString(), clean.toString()));
        assertEquals(bad + System.lineSeparator(), out.toString());
    }

    @Test
    void testShowSource() throws IOException {
        Path file = write("bad.py", "x=1\n");

        run("--show-source", file.toString());

        String[] lines = out.toString().split("\\R");
        assertEquals("x=1", lines[1]);
        assertEquals(" ^", lines[2]);
    }

    @Test
    void testShowPep8PrintsDocumentationOncePerCode() throws IOException {
        Path file = write("bad.py", "x=1\ny=2\n");

        run("--show-pep8", file.toString());

        String[] lines = out.toString().split("\\R");
        long documentation = Arrays.stream(lines).filter(l -> l.startsWith("    ")).count();
        assertTrue(documentation > 0, out.toString());
        assertTrue(lines[lines.length - 1].contains("E225"), "second E225 is printed without documentation");
    }

    @Test
    void testDiff() throws IOException {
        Path file = write("bad.py", "x = 1   \ny = 2");

        run("--diff", file.toString());

        String output = out.toString();
        assertTrue(output.contains("+++ b/" + file), output);
        assertTrue(output.contains("-x = 1   "), output);
        assertTrue(output.contains("+x = 1"), output);
    }

    @Test
    void testExportCsv() throws IOException {
        Path file = write("bad.py", "x=1\n");
        Path outputDir = tempDir.resolve("reports");

        run("--export", "csv", "--output", outputDir.toString(), file.toString());

        assertTrue(Files.exists(outputDir.resolve("linecheck-metrics.csv")));
        assertFalse(Files.exists(outputDir.resolve("linecheck-metrics.json")));
        assertTrue(err.toString().contains("Metrics exported to:"));
    }

    @Test
    void testExportBoth() throws IOException {
        Path file = write("bad.py", "x=1\n");
        Path outputDir = tempDir.resolve("reports");

        run("--export", "BOTH", "--output", outputDir.toString(), file.toString());

        assertTrue(Files.exists(outputDir.resolve("linecheck-metrics.csv")));
        assertTrue(Files.exists(outputDir.resolve("linecheck-metrics.json")));
    }

    @Test
    void testMissingPath() {
        assertEquals(2, run(tempDir.resolve("missing.py").toString()));
        assertTrue(err.toString().contains("Configuration error: Path not found"), err.toString());
    }

    @Test
    void testJsonAndQuietConflict() throws IOException {
        Path file = write("clean.py", "x = 1\n");

        assertEquals(2, run("--json", "--quiet", file.toString()));
    }

    @Test
    void testNegativeMaxLineLength() throws IOException {
        Path file = write("clean.py", "x = 1\n");

        assertEquals(2, run("--max-line-length=-1", file.toString()));
    }

    @Test
    void testZeroMaxLineLength() throws IOException {
        Path file = write("clean.py", "x = 1\n");

        assertEquals(2, run("--max-line-length", "0", file.toString()));
        assertTrue(err.toString().contains("Max-line-length must be positive, got: 0"), err.toString());
    }

    @Test
    void testInvalidExportFormat() throws IOException {
        Path file = write("clean.py", "x = 1\n");

        assertEquals(2, run("--export", "xml", file.toString()));
    }

    @Test
    void testNoArguments() {
        assertEquals(2, run());
    }

    @Test
    void testHelp() {
        assertEquals(0, run("--help"));
        assertTrue(out.toString().contains("--max-line-length"));
    }

    @Test
    void testMaxLineLengthOption() throws IOException {
        Path file = write("long.py", "x = 1234567890\n");

        assertEquals(0, run(file.toString()));
        assertEquals(1, run("--max-line-length", "10", file.toString()));
        assertTrue(out.toString().contains("E501 line too long (14 characters)"), out.toString());
    }

    @Test
    void testConfigFile() throws IOException {
        Path config = write("custom.yml", "linecheck:\n  max_line_length: 10\n  ignore: [E2]\n");
        Path file = write("long.py", "x=1234567890\n");

        assertEquals(1, run("--config-file", config.toString(), file.toString()));
        assertTrue(out.toString().contains("E501"));
        assertFalse(out.toString().contains("E225"), out.toString());
    }

    @Test
    void testCommandLineOverridesConfigFile() throws IOException {
        Path config = write("custom.yml", "linecheck:\n  max_line_length: 10\n");
        Path file = write("long.py", "x = 1234567890\n");

        assertEquals(0, run("--config-file", config.toString(), "--max-line-length", "20", file.toString()));
    }

    @Test
    void testMissingConfigFile() throws IOException {
        Path file = write("clean.py", "x = 1\n");

        assertEquals(2, run("--config-file", tempDir.resolve("none.yml").toString(), file.toString()));
        assertTrue(err.toString().contains("Config file not found"));
    }

    @Test
    void testSelectOverridesDefaultIgnore() throws IOException {
        Path file = write("tabs.py", "if True:\n\tpass\n");

        assertEquals(0, run(file.toString()));
        assertEquals(1, run("--select", "W191", file.toString()));
        assertTrue(out.toString().contains("W191"));
    }

    @Test
    void testDirectoryWalk() throws IOException {
        write("pkg/mod.py", "x = 1\n");
        write("pkg/.git/hook.py", "x=1\n");
        write("pkg/README.txt", "x=1\n");

        assertEquals(0, run(tempDir.resolve("pkg").toString()));
    }

    @Test
    void testFilenameOption() throws IOException {
        write("pkg/mod.py", "x = 1\n");
        write("pkg/script.pyw", "x=1\n");

        assertEquals(1, run("--filename", "*.py,*.pyw", tempDir.resolve("pkg").toString()));
        assertTrue(out.toString().contains("script.pyw"));
    }

    @Property(tries = 50)
    void maxLineLengthIsParsed(@ForAll @IntRange(min = 1, max = 500) int maxLineLength) {
        CommandLine commandLine = new CommandLine(new LineCheckCLI());

        CommandLine.ParseResult result = commandLine.parseArgs(
                "--max-line-length", String.valueOf(maxLineLength), "module.py");

        assertEquals(maxLineLength, (int) result.matchedOptionValue("--max-line-length", 0));
    }

    @Property(tries = 20)
    void exportFormatIsCaseInsensitive(@ForAll("exportFormats") String format) {
        CommandLine commandLine = new CommandLine(new LineCheckCLI());

        CommandLine.ParseResult result = commandLine.parseArgs("--export", format, "module.py");

        ExportFormat parsed = result.matchedOptionValue("--export", null);
        assertEquals(format.toUpperCase(), parsed.name());
    }

    @Provide
    Arbitrary<String> exportFormats() {
        return Arbitraries.of("csv", "json", "both")
                .flatMap(f -> Arbitraries.of(f, f.toUpperCase(),
                        Character.toUpperCase(f.charAt(0)) + f.substring(1)));
    }
}
