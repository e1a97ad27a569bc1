package com.raditha.linecheck.checks.logical;

import com.raditha.linecheck.checks.CheckerContext;
import com.raditha.linecheck.checks.LogicalLineCheck;
import com.raditha.linecheck.model.Column;
import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.model.LogicalLine;

import java.util.Optional;

/**
 * Use 4 spaces per indentation level, indent after a colon and only there.
 */
public class Indentation implements LogicalLineCheck {

    @Override
    public Optional<Diagnostic> check(LogicalLine line, CheckerContext context) {
        int indentLevel = line.indentLevel();
        LogicalLine previous = context.previousLogicalLine();
        int previousIndentLevel = previous == null ? 0 : previous.indentLevel();
        boolean indentExpected = previous != null && previous.text().endsWith(":");

        if (context.document().indentChar() == ' ' && indentLevel % 4 != 0) {
            return Optional.of(Diagnostic.of(DiagnosticCode.E111, Column.offset(0), line));
        }
        if (indentExpected && indentLevel <= previousIndentLevel) {
            return Optional.of(Diagnostic.of(DiagnosticCode.E112, Column.offset(0), line));
        }
        if (indentLevel > previousIndentLevel && !indentExpected) {
            return Optional.of(Diagnostic.of(DiagnosticCode.E113, Column.offset(0), line));
        }
        return Optional.empty();
    }

    @Override
    public String documentation() {
        return """
                Use 4 spaces per indentation level.

                For really old code that you don't want to mess up, you can continue
                to use 8-space tabs.

                Okay: a = 1
                Okay: if a == 0:\\n    a = 1
                E111:   a = 1

                Okay: for item in items:\\n    pass
                E112: for item in items:\\npass

                Okay: a = 1\\nb = 2
                E113: a = 1\\n    b = 2
                """;
    }
}
