package com.raditha.linecheck.model;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stable diagnostic codes with their message templates.
 * The first letter is the severity class (E error, W warning), the first
 * digit the category. Templates use {name} placeholders filled from the
 * diagnostic context.
 */
public enum DiagnosticCode {
    E101("indentation contains mixed spaces and tabs"),
    E111("indentation is not a multiple of four"),
    E112("expected an indented block"),
    E113("unexpected indentation"),
    W191("indentation contains tabs"),

    E201("whitespace after '{char}'"),
    E202("whitespace before '{char}'"),
    E203("whitespace before '{char}'"),
    E211("whitespace before '{char}'"),
    E221("multiple spaces before operator"),
    E222("multiple spaces after operator"),
    E223("tab before operator"),
    E224("tab after operator"),
    E225("missing whitespace around operator"),
    E231("missing whitespace after '{char}'"),
    E241("multiple spaces after '{separator}'"),
    E242("tab after '{separator}'"),
    E251("no spaces around keyword / parameter equals"),
    E261("at least two spaces before inline comment"),
    E262("inline comment should start with '# '"),
    W291("trailing whitespace"),
    W292("no newline at end of file"),
    W293("blank line contains whitespace"),

    E301("expected 1 blank line, found 0"),
    E302("expected 2 blank lines, found {blank_lines}"),
    E303("too many blank lines ({blank_lines})"),
    E304("blank lines found after function decorator"),
    W391("blank line at end of file"),

    E401("multiple imports on one line"),

    E501("line too long ({length} characters)"),

    W601(".has_key() is deprecated, use 'in'"),
    W602("deprecated form of raising exception"),
    W603("'<>' is deprecated, use '!='"),
    W604("backticks are deprecated, use 'repr()'"),

    E701("multiple statements on one line (colon)"),
    E702("multiple statements on one line (semicolon)");

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

    private final String template;

    DiagnosticCode(String template) {
        this.template = template;
    }

    public String template() {
        return template;
    }

    public Severity severity() {
        return name().charAt(0) == 'W' ? Severity.WARNING : Severity.ERROR;
    }

    public Category category() {
        return Category.fromDigit(name().charAt(1));
    }

    /**
     * Render the message template with the given context values.
     *
     * @throws IllegalArgumentException if a placeholder has no value
     */
    public String render(Map<String, Object> context) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            Object value = context.get(matcher.group(1));
            if (value == null) {
                throw new IllegalArgumentException(
                        "Missing value for '" + matcher.group(1) + "' in message of " + name());
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value.toString()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Whether this code starts with the given prefix, e.g. "E2" or "W60".
     */
    public boolean matchesPrefix(String prefix) {
        return !prefix.isEmpty() && name().startsWith(prefix);
    }

    public enum Severity {
        ERROR,
        WARNING
    }

    public enum Category {
        INDENTATION('1'),
        WHITESPACE('2'),
        BLANK_LINES('3'),
        IMPORTS('4'),
        LINE_LENGTH('5'),
        DEPRECATION('6'),
        STATEMENTS('7');

        private final char digit;

        Category(char digit) {
            this.digit = digit;
        }

        static Category fromDigit(char digit) {
            for (Category category : values()) {
                if (category.digit == digit) {
                    return category;
                }
            }
            throw new IllegalArgumentException("No category for digit " + digit);
        }
    }
}
