package com.raditha.linecheck.analyzer;

import com.raditha.linecheck.checks.CheckerContext;
import com.raditha.linecheck.checks.CheckerDescriptor;
import com.raditha.linecheck.checks.CheckerRegistry;
import com.raditha.linecheck.config.CheckerConfig;
import com.raditha.linecheck.detection.LogicalLineBuilder;
import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.Document;
import com.raditha.linecheck.model.LogicalLine;
import com.raditha.linecheck.model.PhysicalLine;
import com.raditha.linecheck.model.SourceLine;
import com.raditha.linecheck.model.StructuralException;
import com.raditha.linecheck.tokenize.PythonTokenizer;
import com.raditha.linecheck.util.SourceText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Main orchestrator for style checking.
 * <p>
 * A single pass over the file: the tokenizer pulls physical lines through a
 * callback that runs the physical checks on each line as it is read, tokens
 * are grouped into statements and every completed statement is handed to
 * the logical checks together with the statement before it.
 * </p>
 * The checker itself is stateless; each call works on a fresh run, so one
 * instance may check many files.
 */
public class StyleChecker {

    private static final Logger logger = LoggerFactory.getLogger(StyleChecker.class);

    private final CheckerConfig config;
    private final CheckerRegistry registry;

    /**
     * Create checker with default configuration.
     */
    public StyleChecker() {
        this(CheckerConfig.defaults());
    }

    public StyleChecker(CheckerConfig config) {
        this(config, CheckerRegistry.defaultRegistry());
    }

    public StyleChecker(CheckerConfig config, CheckerRegistry registry) {
        this.config = config;
        this.registry = registry;
    }

    /**
     * Check a file on disk. The file is read as ISO-8859-1 so that any byte
     * sequence can be analyzed.
     *
     * @throws IOException if the file cannot be read
     */
    public CheckReport check(Path file) throws IOException {
        String source = Files.readString(file, StandardCharsets.ISO_8859_1);
        return check(file.toString(), SourceText.splitLines(source));
    }

    /**
     * Check source text that is already in memory.
     */
    public CheckReport checkSource(String source) {
        return check("stdin", SourceText.splitLines(source));
    }

    /**
     * Check lines that keep their terminators.
     *
     * @param fileName name used in the report
     * @param lines    physical lines of the file
     */
    public CheckReport check(String fileName, List<String> lines) {
        return new Run(fileName, Document.of(lines)).execute();
    }

    public CheckerConfig getConfig() {
        return config;
    }

    public CheckerRegistry getRegistry() {
        return registry;
    }

    /**
     * State of checking one file.
     */
    private final class Run {
        private final String fileName;
        private final Document document;
        private final CheckerContext context;
        private final DiagnosticSink sink = new DiagnosticSink();
        private final Statistics statistics = new Statistics();
        private int cursor;
        private LogicalLine previous;

        Run(String fileName, Document document) {
            this.fileName = fileName;
            this.document = document;
            this.context = new CheckerContext(document, config, null);
        }

        CheckReport execute() {
            PythonTokenizer tokenizer = new PythonTokenizer(this::readLine);
            StatementSegmenter segmenter = new StatementSegmenter(new LogicalLineBuilder(document.lines()));
            StructuralException structuralError = null;
            try {
                while (tokenizer.hasNext()) {
                    segmenter.accept(tokenizer.next()).ifPresent(this::checkLogicalLine);
                }
            } catch (StructuralException e) {
                logger.warn("{}: analysis stopped: {}", fileName, e.getMessage());
                structuralError = e;
            }
            logger.debug("{}: {} physical lines, {} logical lines, {} diagnostics",
                    fileName, statistics.getPhysicalLines(), statistics.getLogicalLines(), sink.size());
            return new CheckReport(fileName, sink.all(), statistics, structuralError);
        }

        /**
         * Hand the next physical line to the tokenizer after running the physical checks on it.
         */
        private String readLine() {
            if (cursor >= document.lineCount()) {
                return "";
            }
            String text = document.lines().get(cursor);
            cursor++;
            statistics.physicalLineSeen();
            PhysicalLine line = new PhysicalLine(text, cursor);
            for (CheckerDescriptor<PhysicalLine> descriptor : registry.physicalCheckers()) {
                runCheck(descriptor, line, context);
            }
            return text;
        }

        private void checkLogicalLine(LogicalLine line) {
            statistics.logicalLineSeen();
            if (logger.isDebugEnabled()) {
                logger.debug("{}:{} logical line '{}'", fileName, line.lineNumber(), line.text());
            }
            CheckerContext logicalContext = context.withPrevious(previous);
            for (CheckerDescriptor<LogicalLine> descriptor : registry.logicalCheckers()) {
                runCheck(descriptor, line, logicalContext);
            }
            previous = line;
        }

        private <L extends SourceLine> void runCheck(CheckerDescriptor<L> descriptor, L line,
                                                     CheckerContext checkerContext) {
            Optional<Diagnostic> result;
            try {
                result = descriptor.check().check(line, checkerContext);
            } catch (RuntimeException e) {
                logger.warn("{}:{} checker {} failed: {}", fileName, line.lineNumber(), descriptor.id(),
                        e.getMessage());
                return;
            }
            result.ifPresent(this::report);
        }

        private void report(Diagnostic diagnostic) {
            if (config.isSuppressed(diagnostic.code().name())) {
                return;
            }
            sink.add(diagnostic);
            statistics.record(diagnostic.code());
        }
    }
}
