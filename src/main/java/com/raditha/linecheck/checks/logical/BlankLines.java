package com.raditha.linecheck.checks.logical;

import com.raditha.linecheck.checks.CheckerContext;
import com.raditha.linecheck.checks.LogicalLineCheck;
import com.raditha.linecheck.model.Column;
import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.model.LogicalLine;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Separate top-level function and class definitions with two blank lines.
 * <p>
 * Method definitions inside a class are separated by a single blank line.
 * Extra blank lines may be used sparingly to separate groups of related
 * functions. Comment blocks between definitions do not reset the count:
 * the larger of the runs before and after the comments is used.
 * </p>
 */
public class BlankLines implements LogicalLineCheck {

    private static final Pattern DOCSTRING = Pattern.compile("u?r?[\"']");

    @Override
    public Optional<Diagnostic> check(LogicalLine line, CheckerContext context) {
        LogicalLine previous = context.previousLogicalLine();
        if (line.lineNumber() == 1 || previous == null) {
            return Optional.empty();
        }
        int blankLines = line.maxBlankLines();
        int indentLevel = line.indentLevel();
        String text = line.dedentedText();
        String previousText = previous.dedentedText();

        if (previousText.startsWith("@")) {
            if (blankLines > 0) {
                return report(DiagnosticCode.E304, line);
            }
        } else if (blankLines > 2 || (indentLevel > 0 && blankLines == 2)) {
            return Optional.of(Diagnostic.of(DiagnosticCode.E303, Column.offset(0), line,
                    "blank_lines", blankLines));
        } else if (startsDefinition(text)) {
            if (indentLevel > 0) {
                boolean firstInBlock = previous.indentLevel() < indentLevel;
                boolean afterDocstring = DOCSTRING.matcher(previousText).lookingAt();
                if (blankLines == 0 && !firstInBlock && !afterDocstring) {
                    return report(DiagnosticCode.E301, line);
                }
            } else if (blankLines != 2) {
                return Optional.of(Diagnostic.of(DiagnosticCode.E302, Column.offset(0), line,
                        "blank_lines", blankLines));
            }
        }
        return Optional.empty();
    }

    private static boolean startsDefinition(String text) {
        return text.startsWith("def ") || text.startsWith("class ") || text.startsWith("@");
    }

    private static Optional<Diagnostic> report(DiagnosticCode code, LogicalLine line) {
        return Optional.of(Diagnostic.of(code, Column.offset(0), line));
    }

    @Override
    public String documentation() {
        return """
                Separate top-level function and class definitions with two blank lines.

                Method definitions inside a class are separated by a single blank line.

                Okay: def a():\\n    pass\\n\\n\\ndef b():\\n    pass
                Okay: default = 1\\nfoo = 1
                E301: class Foo:\\n    b = 0\\n    def bar():\\n        pass
                E302: def a():\\n    pass\\n\\ndef b(n):\\n    pass
                E303: def a():\\n    pass\\n\\n\\n\\ndef b(n):\\n    pass
                E303: def a():\\n\\n\\n\\n    pass
                E304: @decorator\\n\\ndef a():\\n    pass
                """;
    }
}
