package io.github.abcls.selectors;

import io.github.abcls.cstree.CSNode;
import io.github.abcls.selection.ScopedWalk;
import io.github.abcls.selection.Selection;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Selects the nearest enclosing bracketed construct of each cursor ("around"), or its contents without the
 * delimiters ("inside").
 *
 * <p>While walking, a node of the target tag becomes the enclosing node for its subtree. The first in-scope node
 * found under an enclosing node produces one result for it; each input cursor yields at most one result per
 * enclosing node, and nothing when it lies outside every instance of the construct. Once an enclosing node has
 * produced a result its subtree is not searched further, so nested constructs of the same kind are reached only
 * through a cursor that starts inside them.
 */
public final class DelimiterSelectors {
    private DelimiterSelectors() {
        // utility
    }

    public static Selection selectAround(Selection selection, Delimiter delimiter) {
        return search(selection, delimiter, false);
    }

    public static Selection selectInside(Selection selection, Delimiter delimiter) {
        return search(selection, delimiter, true);
    }

    public static Selection selectInsideChord(Selection selection) {
        return selectInside(selection, Delimiter.CHORD);
    }

    public static Selection selectAroundChord(Selection selection) {
        return selectAround(selection, Delimiter.CHORD);
    }

    public static Selection selectInsideGraceGroup(Selection selection) {
        return selectInside(selection, Delimiter.GRACE_GROUP);
    }

    public static Selection selectAroundGraceGroup(Selection selection) {
        return selectAround(selection, Delimiter.GRACE_GROUP);
    }

    public static Selection selectInsideInlineField(Selection selection) {
        return selectInside(selection, Delimiter.INLINE_FIELD);
    }

    public static Selection selectAroundInlineField(Selection selection) {
        return selectAround(selection, Delimiter.INLINE_FIELD);
    }

    public static Selection selectInsideGrouping(Selection selection) {
        return selectInside(selection, Delimiter.GROUPING);
    }

    public static Selection selectAroundGrouping(Selection selection) {
        return selectAround(selection, Delimiter.GROUPING);
    }

    private static Selection search(Selection selection, Delimiter delimiter, boolean inside) {
        var cursors = new ArrayList<Set<Integer>>();
        for (var cursor : selection.cursors()) {
            if (cursor.isEmpty()) {
                continue;
            }
            var seen = new HashSet<Integer>();
            ScopedWalk.walk(selection.root(), cursor, delimiter.tag(), (node, inScope, enclosing) -> {
                if (!inScope || enclosing == null) {
                    return true;
                }
                if (seen.add(enclosing.id())) {
                    if (inside) {
                        var contents = contentsBetweenDelimiters(enclosing, delimiter);
                        if (!contents.isEmpty()) {
                            cursors.add(contents);
                        }
                    } else {
                        cursors.add(Set.of(enclosing.id()));
                    }
                }
                return false;
            });
        }
        return selection.withCursors(cursors);
    }

    /**
     * Ids of the direct children strictly between the first opening and the last closing delimiter. Empty when
     * either delimiter is missing or they are out of order.
     */
    static Set<Integer> contentsBetweenDelimiters(CSNode enclosing, Delimiter delimiter) {
        List<CSNode> children = enclosing.children();
        int open = -1;
        int close = -1;
        for (int i = 0; i < children.size(); i++) {
            var child = children.get(i);
            if (open < 0 && child.isTokenOf(delimiter.open())) {
                open = i;
            }
            if (child.isTokenOf(delimiter.close())) {
                close = i;
            }
        }
        var ids = new LinkedHashSet<Integer>();
        if (open < 0 || close <= open) {
            return ids;
        }
        for (int i = open + 1; i < close; i++) {
            ids.add(children.get(i).id());
        }
        return ids;
    }
}
