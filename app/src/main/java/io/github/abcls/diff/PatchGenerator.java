package io.github.abcls.diff;

import java.util.Comparator;
import java.util.List;

/**
 * Renders changes as patch expressions of the form {@code src | :L:C-C |= ```abc ... ```} with 1-based,
 * end-inclusive coordinates. Patches are ordered last-in-document first so that applying them in sequence never
 * shifts the coordinates of a patch still to come.
 */
public final class PatchGenerator {
    private static final String FENCE = "```";
    private static final String ESCAPED_FENCE = "\\`\\`\\`";

    private PatchGenerator() {
        // utility
    }

    public static List<String> generatePatches(String sourceExpr, String oldText, String newText) {
        return generatePatches(sourceExpr, oldText, CharDiff.diff(oldText, newText));
    }

    public static List<String> generatePatches(String sourceExpr, String oldText, List<Change> changes) {
        var index = new LineIndex(oldText);
        return changes.stream()
                .sorted(Comparator.comparingInt(Change::startOffset).reversed())
                .map(change -> render(sourceExpr, index, change))
                .toList();
    }

    private static String render(String sourceExpr, LineIndex index, Change change) {
        int startLine = index.line(change.startOffset()) + 1;
        int startColumn = index.column(change.startOffset()) + 1;
        String selector;
        if (change.kind() == Change.Kind.INSERT) {
            selector = ":" + startLine + ":" + startColumn;
        } else {
            int endLine = index.line(change.endOffsetInclusive()) + 1;
            int endColumn = index.column(change.endOffsetInclusive()) + 1;
            selector = endLine == startLine
                    ? ":" + startLine + ":" + startColumn + "-" + endColumn
                    : ":" + startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
        }
        var content = change.newContent().replace(FENCE, ESCAPED_FENCE);
        return sourceExpr + " | " + selector + " |= " + FENCE + "abc\n" + content + "\n" + FENCE;
    }
}
