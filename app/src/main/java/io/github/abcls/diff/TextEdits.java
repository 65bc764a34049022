package io.github.abcls.diff;

import java.util.ArrayList;
import java.util.List;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;

/** Converts {@link Change}s into editor text edits with 0-based, end-exclusive ranges. */
public final class TextEdits {
    private TextEdits() {
        // utility
    }

    /**
     * One edit per change, in document order. A run ending in a newline ends at column 0 of the following line,
     * never one column past the end of its own line.
     */
    public static List<TextEdit> toTextEdits(String oldText, List<Change> changes) {
        var index = new LineIndex(oldText);
        var edits = new ArrayList<TextEdit>(changes.size());
        for (var change : changes) {
            var start = position(index, change.startOffset());
            var end = change.kind() == Change.Kind.INSERT ? start : endPosition(oldText, index, change);
            edits.add(new TextEdit(new Range(start, end), change.newContent()));
        }
        return edits;
    }

    private static Position endPosition(String oldText, LineIndex index, Change change) {
        int last = change.endOffsetInclusive();
        if (oldText.charAt(last) == '\n') {
            return new Position(index.line(last) + 1, 0);
        }
        return new Position(index.line(last), index.column(last) + 1);
    }

    private static Position position(LineIndex index, int offset) {
        return new Position(index.line(offset), index.column(offset));
    }
}
