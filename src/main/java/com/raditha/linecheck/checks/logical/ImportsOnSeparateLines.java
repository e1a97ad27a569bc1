package com.raditha.linecheck.checks.logical;

import com.raditha.linecheck.checks.CheckerContext;
import com.raditha.linecheck.checks.LogicalLineCheck;
import com.raditha.linecheck.model.Column;
import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.model.LogicalLine;

import java.util.Optional;

/**
 * Imports should usually be on separate lines.
 */
public class ImportsOnSeparateLines implements LogicalLineCheck {

    @Override
    public Optional<Diagnostic> check(LogicalLine line, CheckerContext context) {
        String text = line.dedentedText();
        if (text.startsWith("import ")) {
            int found = text.indexOf(',');
            if (found >= 0) {
                int indent = line.indentation().length();
                return Optional.of(Diagnostic.of(DiagnosticCode.E401, Column.offset(indent + found), line));
            }
        }
        return Optional.empty();
    }

    @Override
    public String documentation() {
        return """
                Imports should usually be on separate lines.

                Okay: import os\\nimport sys
                E401: import sys, os

                Okay: from subprocess import Popen, PIPE
                Okay: from myclas import MyClass
                Okay: from foo.bar.yourclass import YourClass
                Okay: import myclass
                Okay: import foo.bar.yourclass
                """;
    }
}
