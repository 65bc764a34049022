package io.github.abcls.selectors;

import io.github.abcls.cstree.CSNode;
import io.github.abcls.cstree.Tag;
import io.github.abcls.parser.TT;
import io.github.abcls.selection.ScopedWalk;
import io.github.abcls.selection.Selection;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Helpers for selectors that work on the top-level children of tune bodies rather than on single nodes. A body
 * child is touched by a selection when the whole body is in scope, or when the child or one of its descendants is
 * named by some cursor.
 */
final class BodyScan {
    private BodyScan() {
        // utility
    }

    @FunctionalInterface
    interface BodyVisitor {
        void visit(CSNode body, boolean inScope);
    }

    /** Calls {@code visitor} for every tune body, in document order, against the union of all cursors. */
    static void forEachBody(Selection selection, BodyVisitor visitor) {
        ScopedWalk.walk(selection.root(), selection.allIds(), (node, inScope, enclosing) -> {
            if (node.is(Tag.TUNE_BODY)) {
                visitor.visit(node, inScope);
                return false;
            }
            return true;
        });
    }

    static boolean touches(CSNode node, Set<Integer> ids) {
        if (ids.contains(node.id())) {
            return true;
        }
        for (var child = node.firstChild(); child != null; child = child.nextSibling()) {
            if (touches(child, ids)) {
                return true;
            }
        }
        return false;
    }

    /** Whitespace and line ends: present in the body but never part of a cursor built here. */
    static boolean isLayout(CSNode node) {
        return node.isTokenOf(TT.WS) || node.isTokenOf(TT.EOL);
    }

    /** Body children split into source lines; each line keeps its trailing EOL token. */
    static List<List<CSNode>> lines(CSNode body) {
        var lines = new ArrayList<List<CSNode>>();
        var current = new ArrayList<CSNode>();
        for (var child = body.firstChild(); child != null; child = child.nextSibling()) {
            current.add(child);
            if (child.isTokenOf(TT.EOL)) {
                lines.add(current);
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            lines.add(current);
        }
        return lines;
    }
}
