package com.raditha.linecheck.checks.physical;

import com.raditha.linecheck.checks.CheckerContext;
import com.raditha.linecheck.checks.PhysicalLineCheck;
import com.raditha.linecheck.checks.PhysicalLineFix;
import com.raditha.linecheck.model.Column;
import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.model.PhysicalLine;

import java.util.Optional;

/**
 * The last line should have a newline.
 * <p>
 * Only a line whose content does not end in whitespace is reported; a line
 * ending in spaces is left to the trailing whitespace rule.
 * </p>
 */
public class MissingNewline implements PhysicalLineCheck, PhysicalLineFix {

    @Override
    public Optional<Diagnostic> check(PhysicalLine line, CheckerContext context) {
        String text = line.text();
        if (!text.isEmpty() && text.stripTrailing().equals(text)) {
            return Optional.of(Diagnostic.of(DiagnosticCode.W292, Column.offset(text.length()), line));
        }
        return Optional.empty();
    }

    @Override
    public String fix(PhysicalLine line, CheckerContext context) {
        if (check(line, context).isEmpty()) {
            return line.text();
        }
        return line.text() + context.document().lineEnding().orElse("\n");
    }

    @Override
    public String documentation() {
        return """
                The last line should have a newline.

                Okay: spam(1)\\n
                W292: spam(1)
                """;
    }
}
