package com.raditha.linecheck.checks.logical;

import java.util.HashSet;
import java.util.Set;

/**
 * Operator tables shared by the operator spacing rules.
 */
final class Operators {

    static final Set<String> BINARY_OPERATORS = Set.of(
            "**=", "*=", "+=", "-=", "!=", "<>",
            "%=", "^=", "&=", "|=", "==", "/=", "//=", "<=", ">=", "<<=", ">>=",
            "%", "^", "&", "|", "=", "/", "//", "<", ">", "<<");

    /**
     * Operators that may also be used in unary position: signs, argument
     * unpacking and the print chevron.
     */
    static final Set<String> UNARY_OPERATORS = Set.of(">>", "**", "*", "+", "-");

    static final Set<String> OPERATORS = union(BINARY_OPERATORS, UNARY_OPERATORS);

    private Operators() {
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> all = new HashSet<>(a);
        all.addAll(b);
        return Set.copyOf(all);
    }
}
