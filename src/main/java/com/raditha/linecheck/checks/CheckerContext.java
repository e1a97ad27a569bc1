package com.raditha.linecheck.checks;

import com.raditha.linecheck.config.CheckerConfig;
import com.raditha.linecheck.model.Document;
import com.raditha.linecheck.model.LogicalLine;
import org.jspecify.annotations.Nullable;

/**
 * Everything a rule may consult besides the line it is given.
 *
 * @param document            the file being analyzed
 * @param config              active configuration
 * @param previousLogicalLine the statement before the current one, null for the first
 */
public record CheckerContext(
        Document document,
        CheckerConfig config,
        @Nullable LogicalLine previousLogicalLine) {

    public CheckerContext withPrevious(@Nullable LogicalLine previous) {
        return new CheckerContext(document, config, previous);
    }
}
