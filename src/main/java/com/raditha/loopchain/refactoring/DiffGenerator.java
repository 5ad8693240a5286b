package com.raditha.loopchain.refactoring;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Generates unified diffs for conversion previews.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    private static final int DEFAULT_CONTEXT_LINES = 3;

    /**
     * Generate a unified diff between the file on disk and the converted code.
     *
     * @param originalFile  Path to original file
     * @param convertedCode Converted code as string
     * @return Unified diff as string, empty when nothing changed
     */
    public String generateUnifiedDiff(Path originalFile, String convertedCode) throws IOException {
        return generateUnifiedDiff(originalFile, convertedCode, DEFAULT_CONTEXT_LINES);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(Path originalFile, String convertedCode, int contextLines)
            throws IOException {
        List<String> original = Files.readAllLines(originalFile);
        return generateUnifiedDiff(originalFile.getFileName().toString(), original, convertedCode, contextLines);
    }

    String generateUnifiedDiff(String fileName, List<String> original, String convertedCode, int contextLines) {
        List<String> revised = Arrays.asList(convertedCode.split("\\R", -1));
        // a final line break does not start another line
        if (!revised.isEmpty() && revised.get(revised.size() - 1).isEmpty()) {
            revised = revised.subList(0, revised.size() - 1);
        }

        Patch<String> patch = DiffUtils.diff(original, revised);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                original,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }
}
