package com.raditha.linecheck.checks.physical;

import com.raditha.linecheck.checks.CheckerContext;
import com.raditha.linecheck.checks.PhysicalLineCheck;
import com.raditha.linecheck.model.Column;
import com.raditha.linecheck.model.Diagnostic;
import com.raditha.linecheck.model.DiagnosticCode;
import com.raditha.linecheck.model.PhysicalLine;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Limit all lines to a maximum of 79 characters, or the configured maximum.
 * <p>
 * Files are read as ISO-8859-1, so a UTF-8 encoded line arrives as one
 * character per byte. When such a line is over the limit it is re-decoded as
 * UTF-8 and measured in code points; if it is not valid UTF-8 its byte length
 * is used.
 * </p>
 */
public class MaximumLineLength implements PhysicalLineCheck {

    @Override
    public Optional<Diagnostic> check(PhysicalLine line, CheckerContext context) {
        int maxLineLength = context.config().maxLineLength();
        String content = line.text().stripTrailing();
        int length = content.length();
        if (length > maxLineLength) {
            length = measure(content);
        }
        if (length > maxLineLength) {
            return Optional.of(Diagnostic.of(DiagnosticCode.E501, Column.offset(maxLineLength), line,
                    "length", length));
        }
        return Optional.empty();
    }

    /**
     * Width of a line in characters as the user sees them.
     */
    static int measure(String content) {
        if (!isSingleByte(content)) {
            return content.codePointCount(0, content.length());
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            CharBuffer decoded = decoder.decode(ByteBuffer.wrap(content.getBytes(StandardCharsets.ISO_8859_1)));
            String text = decoded.toString();
            return text.codePointCount(0, text.length());
        } catch (CharacterCodingException e) {
            return content.length();
        }
    }

    private static boolean isSingleByte(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) > 0xFF) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String documentation() {
        return """
                Limit all lines to a maximum of 79 characters.

                There are still many devices around that are limited to 80 character
                lines; plus, limiting windows to 80 characters makes it possible to
                have several windows side-by-side. The default wrapping on such
                devices looks ugly. Therefore, please limit all lines to a maximum
                of 79 characters. For flowing long blocks of text (docstrings or
                comments), limiting the length to 72 characters is recommended.
                """;
    }
}
