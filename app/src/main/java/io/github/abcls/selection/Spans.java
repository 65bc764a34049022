package io.github.abcls.selection;

import io.github.abcls.cstree.CSNode;
import io.github.abcls.cstree.TokenData;
import io.github.abcls.cstree.TreeWalk;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Source spans of nodes and selections, computed from their leftmost and rightmost tokens. */
public final class Spans {
    private Spans() {
        // utility
    }

    /** Span of {@code node}, or {@code null} when it has no positioned token. */
    public static @Nullable SourceRange spanOf(CSNode node) {
        var first = TreeWalk.firstTokenData(node);
        var last = TreeWalk.lastTokenData(node);
        if (first == null || last == null || first.line() < 0 || last.line() < 0) {
            return null;
        }
        if (last.lexeme().endsWith("\n")) {
            return new SourceRange(first.line(), first.column(), last.line() + 1, 0);
        }
        return new SourceRange(first.line(), first.column(), last.line(), endColumn(last));
    }

    private static int endColumn(TokenData token) {
        return token.column() + token.lexeme().length();
    }

    /**
     * One range per cursor, from the earliest start to the latest end among the cursor's nodes. Cursors whose nodes
     * have no position are skipped.
     */
    public static List<SourceRange> resolve(Selection selection) {
        var idMap = TreeWalk.buildIdMap(selection.root());
        var result = new ArrayList<SourceRange>();
        for (var cursor : selection.cursors()) {
            SourceRange merged = null;
            for (int id : cursor) {
                var node = idMap.get(id);
                var span = node == null ? null : spanOf(node);
                if (span == null) {
                    continue;
                }
                merged = merged == null ? span : union(merged, span);
            }
            if (merged != null) {
                result.add(merged);
            }
        }
        return result;
    }

    private static SourceRange union(SourceRange a, SourceRange b) {
        boolean aStartsFirst =
                TreeWalk.comparePositions(a.startLine(), a.startColumn(), b.startLine(), b.startColumn()) <= 0;
        boolean aEndsLast = TreeWalk.comparePositions(a.endLine(), a.endColumn(), b.endLine(), b.endColumn()) >= 0;
        return new SourceRange(
                aStartsFirst ? a.startLine() : b.startLine(),
                aStartsFirst ? a.startColumn() : b.startColumn(),
                aEndsLast ? a.endLine() : b.endLine(),
                aEndsLast ? a.endColumn() : b.endColumn());
    }
}
