package com.raditha.linecheck.checks;

import com.raditha.linecheck.checks.logical.BlankLines;
import com.raditha.linecheck.checks.logical.CompoundStatements;
import com.raditha.linecheck.checks.logical.DeprecatedSyntax;
import com.raditha.linecheck.checks.logical.ExtraneousWhitespace;
import com.raditha.linecheck.checks.logical.ImportsOnSeparateLines;
import com.raditha.linecheck.checks.logical.Indentation;
import com.raditha.linecheck.checks.logical.MissingWhitespaceAfterSeparator;
import com.raditha.linecheck.checks.logical.MissingWhitespaceAroundOperator;
import com.raditha.linecheck.checks.logical.WhitespaceAroundComma;
import com.raditha.linecheck.checks.logical.WhitespaceAroundInlineComment;
import com.raditha.linecheck.checks.logical.WhitespaceAroundNamedParameterEquals;
import com.raditha.linecheck.checks.logical.WhitespaceAroundOperator;
import com.raditha.linecheck.checks.logical.WhitespaceBeforeParameters;
import com.raditha.linecheck.checks.physical.MaximumLineLength;
import com.raditha.linecheck.checks.physical.MissingNewline;
import com.raditha.linecheck.checks.physical.TabsObsolete;
import com.raditha.linecheck.checks.physical.TabsOrSpaces;
import com.raditha.linecheck.checks.physical.TrailingBlankLines;
import com.raditha.linecheck.checks.physical.TrailingWhitespace;
import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.model.LogicalLine;
import com.raditha.linecheck.model.PhysicalLine;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import static com.raditha.linecheck.model.DiagnosticCode.*;

/**
 * Immutable table of the checkers to run, split by the kind of line they
 * inspect. Checkers run in registration order.
 */
public final class CheckerRegistry {

    private static final CheckerRegistry DEFAULT = createDefault();

    private final List<CheckerDescriptor<PhysicalLine>> physicalCheckers;
    private final List<CheckerDescriptor<LogicalLine>> logicalCheckers;

    private CheckerRegistry(List<CheckerDescriptor<PhysicalLine>> physicalCheckers,
                            List<CheckerDescriptor<LogicalLine>> logicalCheckers) {
        this.physicalCheckers = List.copyOf(physicalCheckers);
        this.logicalCheckers = List.copyOf(logicalCheckers);
    }

    /**
     * The registry holding every built-in rule.
     */
    public static CheckerRegistry defaultRegistry() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static CheckerRegistry createDefault() {
        return builder()
                .physical("tabs-or-spaces", EnumSet.of(E101), new TabsOrSpaces())
                .physical("tabs-obsolete", EnumSet.of(W191), new TabsObsolete())
                .physical("trailing-whitespace", EnumSet.of(W291, W293), new TrailingWhitespace())
                .physical("trailing-blank-lines", EnumSet.of(W391), new TrailingBlankLines())
                .physical("missing-newline", EnumSet.of(W292), new MissingNewline())
                .physical("maximum-line-length", EnumSet.of(E501), new MaximumLineLength())
                .logical("blank-lines", EnumSet.of(E301, E302, E303, E304), new BlankLines())
                .logical("extraneous-whitespace", EnumSet.of(E201, E202, E203), new ExtraneousWhitespace())
                .logical("whitespace-before-parameters", EnumSet.of(E211), new WhitespaceBeforeParameters())
                .logical("missing-whitespace", EnumSet.of(E231), new MissingWhitespaceAfterSeparator())
                .logical("indentation", EnumSet.of(E111, E112, E113), new Indentation())
                .logical("whitespace-around-operator", EnumSet.of(E221, E222, E223, E224),
                        new WhitespaceAroundOperator())
                .logical("missing-whitespace-around-operator", EnumSet.of(E225),
                        new MissingWhitespaceAroundOperator())
                .logical("whitespace-around-comma", EnumSet.of(E241, E242), new WhitespaceAroundComma())
                .logical("whitespace-around-default-equals", EnumSet.of(E251),
                        new WhitespaceAroundNamedParameterEquals())
                .logical("whitespace-before-inline-comment", EnumSet.of(E261, E262),
                        new WhitespaceAroundInlineComment())
                .logical("imports-on-separate-lines", EnumSet.of(E401), new ImportsOnSeparateLines())
                .logical("compound-statements", EnumSet.of(E701, E702), new CompoundStatements())
                .logical("deprecated-has-key", EnumSet.of(W601), new DeprecatedSyntax.HasKey())
                .logical("deprecated-raise-comma", EnumSet.of(W602), new DeprecatedSyntax.RaiseComma())
                .logical("deprecated-not-equal", EnumSet.of(W603), new DeprecatedSyntax.NotEqual())
                .logical("deprecated-backticks", EnumSet.of(W604), new DeprecatedSyntax.Backticks())
                .build();
    }

    public List<CheckerDescriptor<PhysicalLine>> physicalCheckers() {
        return physicalCheckers;
    }

    public List<CheckerDescriptor<LogicalLine>> logicalCheckers() {
        return logicalCheckers;
    }

    /**
     * Every checker, physical ones first.
     */
    public List<CheckerDescriptor<?>> allCheckers() {
        return Stream.<CheckerDescriptor<?>>concat(physicalCheckers.stream(), logicalCheckers.stream())
                .toList();
    }

    public Optional<CheckerDescriptor<?>> find(String id) {
        return allCheckers().stream().filter(d -> d.id().equals(id)).findFirst();
    }

    /**
     * The checker that emits a code, if any.
     */
    public Optional<CheckerDescriptor<?>> descriptorFor(DiagnosticCode code) {
        return allCheckers().stream().filter(d -> d.emits(code)).findFirst();
    }

    public int size() {
        return physicalCheckers.size() + logicalCheckers.size();
    }

    /**
     * Collects descriptors and rejects duplicate ids.
     */
    public static final class Builder {
        private final List<CheckerDescriptor<PhysicalLine>> physical = new ArrayList<>();
        private final List<CheckerDescriptor<LogicalLine>> logical = new ArrayList<>();
        private final Set<String> ids = new HashSet<>();

        private Builder() {
        }

        public Builder physical(String id, Set<DiagnosticCode> codes, PhysicalLineCheck check) {
            register(id);
            physical.add(new CheckerDescriptor<>(id, LineScope.PHYSICAL, codes, check));
            return this;
        }

        public Builder logical(String id, Set<DiagnosticCode> codes, LogicalLineCheck check) {
            register(id);
            logical.add(new CheckerDescriptor<>(id, LineScope.LOGICAL, codes, check));
            return this;
        }

        private void register(String id) {
            if (!ids.add(id)) {
                throw new IllegalArgumentException("Duplicate checker id: " + id);
            }
        }

        public CheckerRegistry build() {
            return new CheckerRegistry(physical, logical);
        }
    }
}
