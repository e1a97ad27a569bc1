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
 * Flags indentation that mixes the file's indent character with the other one.
 */
public class TabsOrSpaces implements PhysicalLineCheck {

    @Override
    public Optional<Diagnostic> check(PhysicalLine line, CheckerContext context) {
        char indentChar = context.document().indentChar();
        String indent = SourceText.leadingIndentation(line.text());
        for (int offset = 0; offset < indent.length(); offset++) {
            if (indent.charAt(offset) != indentChar) {
                return Optional.of(Diagnostic.of(DiagnosticCode.E101, Column.offset(offset), line));
            }
        }
        return Optional.empty();
    }

    @Override
    public String documentation() {
        return """
                Never mix tabs and spaces.

                The most popular way of indenting Python is with spaces only. The
                second-most popular way is with tabs only. Code indented with a
                mixture of tabs and spaces should be converted to using spaces
                exclusively.

                Okay: if a == 0:\\n        a = 1\\n        b = 1
                E101: if a == 0:\\n        a = 1\\n\\tb = 1
                """;
    }
}
