package com.raditha.luaforge.workflow;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.Arrays;
import java.util.List;

/**
 * Unified diffs between a source file and its processed form, for dry runs.
 */
public class DiffGenerator {

    private static final int CONTEXT_LINES = 3;

    public String generateUnifiedDiff(String fileName, String original, String revised) {
        return generateUnifiedDiff(fileName, original, revised, CONTEXT_LINES);
    }

    public String generateUnifiedDiff(String fileName, String original, String revised, int contextLines) {
        List<String> originalLines = lines(original);
        List<String> revisedLines = lines(revised);
        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                originalLines,
                patch,
                contextLines);
        return String.join("\n", unifiedDiff);
    }

    private static List<String> lines(String text) {
        return Arrays.asList(text.split("\r?\n", -1));
    }
}
