package com.raditha.linecheck.checks;

import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.SourceLine;

import java.util.Optional;

/**
 * A single style rule applied to one line at a time.
 * <p>
 * Implementations must be free of side effects: the same line and context
 * always produce the same result. A rule that cannot evaluate its
 * precondition returns empty rather than throwing.
 * </p>
 *
 * @param <L> kind of line the rule inspects
 */
public interface LineCheck<L extends SourceLine> {

    /**
     * Inspect a line and report the first violation found on it.
     */
    Optional<Diagnostic> check(L line, CheckerContext context);

    /**
     * Human readable description of the rule, printed by {@code --show-pep8}.
     */
    default String documentation() {
        return "";
    }
}
