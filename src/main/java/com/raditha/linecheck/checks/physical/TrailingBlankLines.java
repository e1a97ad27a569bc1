package com.raditha.linecheck.checks.physical;

import com.raditha.linecheck.checks.CheckerContext;
import com.raditha.linecheck.checks.PhysicalLineCheck;
import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.model.PhysicalLine;
import com.raditha.linecheck.util.SourceText;

import java.util.Optional;

public class TrailingBlankLines implements PhysicalLineCheck {

    @Override
    public Optional<Diagnostic> check(PhysicalLine line, CheckerContext context) {
        if (SourceText.isBlank(line.text()) && line.lineNumber() == context.document().lineCount()) {
            return Optional.of(Diagnostic.of(DiagnosticCode.W391, line));
        }
        return Optional.empty();
    }

    @Override
    public String documentation() {
        return """
                Trailing blank lines are superfluous.

                Okay: spam(1)
                W391: spam(1)\\n
                """;
    }
}
