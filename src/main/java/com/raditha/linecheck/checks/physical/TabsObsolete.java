package com.raditha.linecheck.checks.physical;

import com.raditha.linecheck.checks.CheckerContext;
import com.raditha.linecheck.checks.PhysicalLineCheck;
import com.raditha.linecheck.model.Column;
import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.model.PhysicalLine;
import com.raditha.linecheck.util.SourceText;

import java.util.Optional;

/**
 * Flags any tab in the leading indentation. Ignored unless selected.
 */
public class TabsObsolete implements PhysicalLineCheck {

    @Override
    public Optional<Diagnostic> check(PhysicalLine line, CheckerContext context) {
        int tab = SourceText.leadingIndentation(line.text()).indexOf('\t');
        if (tab >= 0) {
            return Optional.of(Diagnostic.of(DiagnosticCode.W191, Column.offset(tab), line));
        }
        return Optional.empty();
    }

    @Override
    public String documentation() {
        return """
                For new projects, spaces-only are strongly recommended over tabs.

                Okay: if True:\\n    return
                W191: if True:\\n\\treturn
                """;
    }
}
