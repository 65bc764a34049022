package io.github.abcls.selectors;

import io.github.abcls.selection.ScopedWalk;
import io.github.abcls.selection.Selection;
import io.github.abcls.selection.SourceRange;
import io.github.abcls.selection.Spans;
import java.util.ArrayList;
import java.util.Set;

/**
 * Geometric selector. Emits the topmost in-scope nodes whose span lies entirely inside the half-open range
 * {@code [start, end)}; a node that starts at the exclusive end is never selected.
 */
public final class RangeSelector {
    private RangeSelector() {
        // utility
    }

    public static Selection selectRange(
            Selection selection, int startLine, int startColumn, int endLine, int endColumn) {
        return selectRange(selection, new SourceRange(startLine, startColumn, endLine, endColumn));
    }

    public static Selection selectRange(Selection selection, SourceRange range) {
        var cursors = new ArrayList<Set<Integer>>();
        if (range.startLine() > range.endLine()) {
            return selection.withCursors(cursors);
        }
        for (var cursor : selection.cursors()) {
            ScopedWalk.walk(selection.root(), cursor, (node, inScope, enclosing) -> {
                if (!inScope) {
                    return true;
                }
                var span = Spans.spanOf(node);
                if (span != null && range.contains(span)) {
                    cursors.add(Set.of(node.id()));
                    return false;
                }
                return true;
            });
        }
        return selection.withCursors(cursors);
    }
}
