package com.raditha.linecheck.fix;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import com.raditha.linecheck.util.SourceText;

import java.util.ArrayList;
import java.util.List;

/**
 * Generates unified diffs for whitespace fix previews.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    static final String NO_NEWLINE_MARKER = "\\ No newline at end of file";

    /**
     * Generate a unified diff between original and fixed lines.
     *
     * @param fileName name shown in the diff header
     * @param original lines before fixing, terminators included
     * @param fixed    lines after fixing, terminators included
     * @return unified diff, or "" if nothing changed
     */
    public String generateUnifiedDiff(String fileName, List<String> original, List<String> fixed) {
        return generateUnifiedDiff(fileName, original, fixed, 3);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(String fileName, List<String> original, List<String> fixed,
                                      int contextLines) {
        List<String> before = comparable(original);
        List<String> after = comparable(fixed);

        Patch<String> patch = DiffUtils.diff(before, after);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                before,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff) + "\n";
    }

    /**
     * Lines without their terminators. A last line that has no terminator
     * carries the marker diff tools print for it, so adding the missing
     * newline shows up as a change.
     */
    private static List<String> comparable(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            String content = stripNewline(line);
            if (!SourceText.endsWithLineTerminator(line)) {
                content = content + "\n" + NO_NEWLINE_MARKER;
            }
            result.add(content);
        }
        return result;
    }

    private static String stripNewline(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }
}
