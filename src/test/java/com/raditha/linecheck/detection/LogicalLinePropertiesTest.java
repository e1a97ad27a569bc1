package com.raditha.linecheck.detection;

import com.raditha.linecheck.model.Column;
import com.raditha.linecheck.model.Location;
import com.raditha.linecheck.model.LogicalLine;
import com.raditha.linecheck.model.OffsetMapping;
import com.raditha.linecheck.testing.LogicalLines;
import com.raditha.linecheck.util.SourceText;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties of logical line reconstruction over generated statements.
 */
class LogicalLinePropertiesTest {

    @Property(tries = 200)
    void textIsOneLineWithoutSurroundingWhitespace(@ForAll("statements") String statement) {
        LogicalLine line = LogicalLines.single(statement);

        assertFalse(line.text().contains("\n"), line.text());
        assertEquals(line.text().strip(), line.text());
        assertTrue(line.text().startsWith("result = call("), line.text());
    }

    @Property(tries = 200)
    void offsetsStrictlyIncrease(@ForAll("statements") String statement) {
        List<OffsetMapping> mapping = LogicalLines.single(statement).tokenOffsetMapping();

        for (int i = 1; i < mapping.size(); i++) {
            assertTrue(mapping.get(i - 1).offset() < mapping.get(i).offset(), statement);
        }
    }

    @Property(tries = 200)
    void tokenOffsetsLocateTokenStarts(@ForAll("statements") String statement) {
        LogicalLine line = LogicalLines.single(statement);

        for (OffsetMapping entry : line.tokenOffsetMapping()) {
            assertEquals(Location.of(entry.token().start()), line.locate(Column.offset(entry.offset())), statement);
        }
    }

    @Property(tries = 100)
    void muteKeepsLengthAndIsIdempotent(@ForAll("stringLiterals") String literal) {
        String muted = StringMuter.mute(literal);

        assertEquals(literal.length(), muted.length());
        assertEquals(muted, StringMuter.mute(muted));
        assertEquals(literal.charAt(literal.length() - 1), muted.charAt(muted.length() - 1));
    }

    @Property(tries = 100)
    void tabAdvancesToNextMultipleOfEight(@ForAll("indentations") String indentation) {
        int level = SourceText.indentationLevel(indentation + "pass");
        int withTab = SourceText.indentationLevel(indentation + "\tpass");
        int withSpace = SourceText.indentationLevel(indentation + " pass");

        assertEquals(level, SourceText.indentationLevel(indentation));
        assertEquals(0, withTab % 8);
        assertTrue(withTab > level && withTab - level <= 8);
        assertEquals(level + 1, withSpace);
    }

    @Property(tries = 50)
    void indentationOfSpacesIsItsLength(@ForAll @IntRange(min = 0, max = 40) int spaces) {
        assertEquals(spaces, SourceText.indentationLevel(" ".repeat(spaces) + "x = 1"));
    }

    @Provide
    Arbitrary<String> statements() {
        Arbitrary<String> names = Arbitraries.of("alpha", "beta", "gamma", "spam_2");
        Arbitrary<String> numbers = Arbitraries.integers().between(0, 999).map(String::valueOf);
        Arbitrary<String> atoms = Arbitraries.oneOf(names, numbers, stringLiterals());
        Arbitrary<String> separators = Arbitraries.of(" + ", "+", ", ", " ,  ", ",\n    ", " *\n  ", "  -  ");

        return Combinators.combine(atoms.list().ofMinSize(1).ofMaxSize(6), separators.list().ofSize(6))
                .as((atomList, separatorList) -> {
                    StringBuilder body = new StringBuilder(atomList.get(0));
                    for (int i = 1; i < atomList.size(); i++) {
                        body.append(separatorList.get(i)).append(atomList.get(i));
                    }
                    return "result = call(" + body + ")\n";
                });
    }

    @Provide
    Arbitrary<String> stringLiterals() {
        Arbitrary<String> prefixes = Arbitraries.of("", "r", "b", "u");
        Arbitrary<String> quotes = Arbitraries.of("'", "\"", "'''", "\"\"\"");
        Arbitrary<String> contents = Arbitraries.strings().withCharRange('a', 'z').withChars(' ', ',', '(')
                .ofMaxLength(8);
        return Combinators.combine(prefixes, quotes, contents)
                .as((prefix, quote, content) -> prefix + quote + content + quote);
    }

    @Provide
    Arbitrary<String> indentations() {
        return Arbitraries.strings().withChars(' ', '\t').ofMaxLength(12);
    }
}
