package com.raditha.linecheck.fix;

import com.raditha.linecheck.checks.CheckerContext;
import com.raditha.linecheck.checks.CheckerRegistry;
import com.raditha.linecheck.checks.PhysicalLineFix;
import com.raditha.linecheck.config.CheckerConfig;
import com.raditha.linecheck.model.Document;
import com.raditha.linecheck.model.PhysicalLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Repairs the whitespace problems that can be fixed line by line: trailing
 * whitespace and a missing newline at the end of the file.
 * Only fixes whose codes are not suppressed are applied.
 */
public class WhitespaceFixer {

    private static final Logger logger = LoggerFactory.getLogger(WhitespaceFixer.class);

    private final CheckerConfig config;
    private final List<PhysicalLineFix> fixes;

    public WhitespaceFixer(CheckerConfig config) {
        this(config, CheckerRegistry.defaultRegistry());
    }

    public WhitespaceFixer(CheckerConfig config, CheckerRegistry registry) {
        this.config = config;
        this.fixes = new ArrayList<>();
        registry.physicalCheckers().stream()
                .filter(d -> d.check() instanceof PhysicalLineFix)
                .filter(d -> d.codes().stream().anyMatch(code -> !config.isSuppressed(code.name())))
                .forEach(d -> fixes.add((PhysicalLineFix) d.check()));
    }

    /**
     * Return the lines of the document with every applicable fix applied.
     * Fixes run in registry order, each one seeing the output of the previous.
     */
    public List<String> fix(Document document) {
        CheckerContext context = new CheckerContext(document, config, null);
        List<String> fixed = new ArrayList<>(document.lineCount());
        int changed = 0;
        for (int i = 0; i < document.lineCount(); i++) {
            String original = document.lines().get(i);
            String text = original;
            for (PhysicalLineFix fix : fixes) {
                text = fix.fix(new PhysicalLine(text, i + 1), context);
            }
            if (!text.equals(original)) {
                changed++;
            }
            fixed.add(text);
        }
        logger.debug("Fixed {} of {} lines", changed, document.lineCount());
        return fixed;
    }

    /**
     * Number of fixes that will be applied to each line.
     */
    public int getFixCount() {
        return fixes.size();
    }
}
