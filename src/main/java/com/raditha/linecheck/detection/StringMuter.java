package com.raditha.linecheck.detection;

/**
 * Replaces the contents of string literals with "xxx" so that checkers
 * never mistake string contents for code.
 */
public final class StringMuter {

    private StringMuter() {
    }

    /**
     * Replace contents with 'xxx' to prevent syntax matching.
     * <p>
     * The string prefix and the quotes are preserved and the result has the
     * same length as the input. Muting an already muted literal returns it
     * unchanged.
     * </p>
     * <pre>
     * mute("\"abc\"")       == "\"xxx\""
     * mute("'''abc'''")     == "'''xxx'''"
     * mute("r'abc'")        == "r'xxx'"
     * </pre>
     */
    public static String mute(String text) {
        if (text.isEmpty()) {
            return text;
        }
        char quote = text.charAt(text.length() - 1);
        int start = text.indexOf(quote) + 1;
        int end = text.length() - 1;
        if (text.length() >= 6 && text.endsWith(String.valueOf(quote).repeat(3))
                && text.startsWith(String.valueOf(quote).repeat(3), start - 1)) {
            start += 2;
            end -= 2;
        }
        if (start >= end) {
            return text;
        }
        return text.substring(0, start) + "x".repeat(end - start) + text.substring(end);
    }
}
