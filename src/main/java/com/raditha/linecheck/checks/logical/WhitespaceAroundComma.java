package com.raditha.linecheck.checks.logical;

import com.raditha.linecheck.checks.CheckerContext;
import com.raditha.linecheck.checks.LogicalLineCheck;
import com.raditha.linecheck.model.Column;
import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.model.LogicalLine;

import java.util.Optional;

/**
 * Avoid more than one space or a tab after a comma, semicolon or colon.
 * <p>
 * Ignored by default because aligning values in tables is common practice.
 * </p>
 */
public class WhitespaceAroundComma implements LogicalLineCheck {

    private static final String SEPARATORS = ",;:";

    /**
     * Separators are tried in turn; the first one with offending whitespace
     * anywhere on the line wins, two spaces before a tab.
     */
    @Override
    public Optional<Diagnostic> check(LogicalLine line, CheckerContext context) {
        String text = line.text();
        for (char separator : SEPARATORS.toCharArray()) {
            int found = text.indexOf(separator + "  ");
            if (found >= 0) {
                return report(DiagnosticCode.E241, found, separator, line);
            }
            found = text.indexOf(separator + "\t");
            if (found >= 0) {
                return report(DiagnosticCode.E242, found, separator, line);
            }
        }
        return Optional.empty();
    }

    private static Optional<Diagnostic> report(DiagnosticCode code, int found, char separator, LogicalLine line) {
        return Optional.of(Diagnostic.of(code, Column.offset(found + 1), line, "separator",
                String.valueOf(separator)));
    }

    @Override
    public String documentation() {
        return """
                Avoid extraneous whitespace after a comma or a colon.

                Note: these checks are disabled by default

                Okay: a = (1, 2)
                E241: a = (1,  2)
                E242: a = (1,\\t2)
                """;
    }
}
