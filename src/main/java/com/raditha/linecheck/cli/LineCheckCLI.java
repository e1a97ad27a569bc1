package com.raditha.linecheck.cli;

import com.raditha.linecheck.analyzer.CheckReport;
import com.raditha.linecheck.analyzer.StyleChecker;
import com.raditha.linecheck.config.CheckerConfig;
import com.raditha.linecheck.config.CheckerSettings;
import com.raditha.linecheck.fix.DiffGenerator;
import com.raditha.linecheck.fix.WhitespaceFixer;
import com.raditha.linecheck.metrics.MetricsExporter;
import com.raditha.linecheck.model.Document;
import com.raditha.linecheck.util.SourceText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for linecheck.
 * <p>
 * Usage:
 * java -jar linecheck.jar [options] <file-or-directory>...
 * <p>
 * Configuration priority: CLI arguments > linecheck.yml > defaults
 * <p>
 * Exit codes: 0 when every file is clean, 1 when diagnostics or structural
 * errors were found, 2 for configuration errors and 3 for I/O errors.
 */
@Command(name = "linecheck", mixinStandardHelpOptions = true, version = "linecheck v1.0.0",
        description = "Python source style checker")
public class LineCheckCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(LineCheckCLI.class);

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "<path>", description = "Files or directories to check")
    private List<Path> paths = new ArrayList<>();

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--max-line-length", description = "Maximum allowed line length (default: 79)", paramLabel = "<n>")
    private Integer maxLineLength; // null = use YAML/default

    @Option(names = "--ignore", description = "Skip codes starting with these prefixes (default: E24,W191)",
            paramLabel = "<codes>")
    private String ignore;

    @Option(names = "--select", description = "Report codes starting with these prefixes even if ignored",
            paramLabel = "<codes>")
    private String select;

    @Option(names = "--exclude", description = "Skip files or directories matching these patterns "
            + "(default: .svn,CVS,.bzr,.hg,.git)", paramLabel = "<patterns>")
    private String exclude;

    @Option(names = "--filename", description = "Check only files matching these patterns (default: *.py)",
            paramLabel = "<patterns>")
    private String filename;

    @Option(names = "--show-source", description = "Show the source line and a caret for each diagnostic")
    private boolean showSource = false;

    @Option(names = "--show-pep8", description = "Show the rule text for each reported code")
    private boolean showPep8 = false;

    @Option(names = "--statistics", description = "Count diagnostics per code")
    private boolean statistics = false;

    @Option(names = "--count", description = "Print the total number of diagnostics to standard error")
    private boolean count = false;

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    @Option(names = "--quiet", description = "Only print the names of files with problems")
    private boolean quiet = false;

    @Option(names = "--diff", description = "Print a unified diff fixing trailing whitespace and final newlines")
    private boolean diff = false;

    @Option(names = "--export", description = "Export metrics (csv, json, or both)", paramLabel = "<format>",
            converter = ExportFormatConverter.class)
    private ExportFormat exportFormat;

    @Option(names = "--output", description = "Directory for exported metrics", paramLabel = "<path>")
    private String outputPath;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 when clean, 1 when problems were found)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        CheckerConfig config = CheckerSettings.loadConfig(configFile, new CheckerSettings.Overrides(
                maxLineLength != null ? maxLineLength : 0,
                CheckerSettings.splitList(ignore),
                CheckerSettings.splitList(select),
                CheckerSettings.splitList(exclude),
                CheckerSettings.splitList(filename)));

        List<Path> files = new SourceFileCollector(config).collect(paths);
        StyleChecker checker = new StyleChecker(config);
        List<CheckedFile> results = new ArrayList<>();
        for (Path file : files) {
            List<String> lines = readLines(file);
            results.add(new CheckedFile(checker.check(file.toString(), lines), lines));
        }
        List<CheckReport> reports = results.stream().map(CheckedFile::report).toList();

        PrintWriter out = spec.commandLine().getOut();
        ReportPrinter printer = new ReportPrinter(out, checker.getRegistry(), showSource, showPep8);
        if (jsonOutput) {
            printer.printJson(reports, new MetricsExporter());
        } else {
            for (CheckedFile result : results) {
                if (quiet) {
                    printer.printFileName(result.report());
                } else {
                    printer.printReport(result.report(), result.lines());
                }
            }
            if (statistics) {
                printer.printStatistics(reports);
            }
        }

        if (diff) {
            printDiffs(config, results);
        }

        int totalDiagnostics = reports.stream().mapToInt(r -> r.diagnostics().size()).sum();
        if (count) {
            spec.commandLine().getErr().println(totalDiagnostics);
        }

        if (exportFormat != null) {
            exportMetrics(reports);
        }

        out.flush();
        logger.info("Checked {} files, {} diagnostics", reports.size(), totalDiagnostics);
        return reports.stream().allMatch(CheckReport::isClean) ? 0 : 1;
    }

    /**
     * Create the command line with the exit code mapping used by {@link #main}.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new LineCheckCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (maxLineLength != null && maxLineLength < 1) {
            throw new IllegalArgumentException("Max-line-length must be positive, got: " + maxLineLength);
        }

        if (jsonOutput && quiet) {
            throw new IllegalArgumentException("Cannot use both --json and --quiet simultaneously");
        }

        if (configFile != null && !Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        if (outputPath != null) {
            Path outputDir = Paths.get(outputPath);
            if (Files.exists(outputDir) && !Files.isDirectory(outputDir)) {
                throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
            }
        }
    }

    private static List<String> readLines(Path file) throws IOException {
        return SourceText.splitLines(Files.readString(file, StandardCharsets.ISO_8859_1));
    }

    private void printDiffs(CheckerConfig config, List<CheckedFile> results) {
        WhitespaceFixer fixer = new WhitespaceFixer(config);
        DiffGenerator generator = new DiffGenerator();
        PrintWriter out = spec.commandLine().getOut();
        for (CheckedFile result : results) {
            List<String> fixed = fixer.fix(Document.of(result.lines()));
            out.print(generator.generateUnifiedDiff(result.report().fileName(), result.lines(), fixed));
        }
    }

    /**
     * Export metrics to CSV/JSON files.
     */
    private void exportMetrics(List<CheckReport> reports) throws IOException {
        MetricsExporter exporter = new MetricsExporter();
        Path outputDir = outputPath != null ? Paths.get(outputPath) : Paths.get(".");
        Files.createDirectories(outputDir);

        Path projectPath = paths.get(0).toAbsolutePath().normalize().getFileName();
        String projectName = projectPath != null ? projectPath.toString() : "project";
        MetricsExporter.ProjectMetrics metrics = exporter.buildMetrics(reports, projectName);

        PrintWriter err = spec.commandLine().getErr();
        if (exportFormat.includesCsv()) {
            Path csvPath = outputDir.resolve("linecheck-metrics.csv");
            exporter.exportToCsv(metrics, csvPath);
            err.println("Metrics exported to: " + csvPath.toAbsolutePath());
        }

        if (exportFormat.includesJson()) {
            Path jsonPath = outputDir.resolve("linecheck-metrics.json");
            exporter.exportToJson(metrics, jsonPath);
            err.println("Metrics exported to: " + jsonPath.toAbsolutePath());
        }
    }

    /**
     * A checked file with the lines it was checked from.
     */
    private record CheckedFile(CheckReport report, List<String> lines) {
    }

    /**
     * Custom converter for ExportFormat enum to handle CLI string values.
     */
    public static class ExportFormatConverter implements ITypeConverter<ExportFormat> {
        @Override
        public ExportFormat convert(String value) throws Exception {
            return ExportFormat.fromString(value);
        }
    }
}
