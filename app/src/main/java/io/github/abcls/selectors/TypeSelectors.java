package io.github.abcls.selectors;

import io.github.abcls.cstree.CSNode;
import io.github.abcls.cstree.Tag;
import io.github.abcls.selection.ScopedWalk;
import io.github.abcls.selection.Selection;
import java.util.ArrayList;
import java.util.Set;
import java.util.function.Predicate;

/** Fan-out selectors: one singleton cursor per matching node in scope of each input cursor. */
public final class TypeSelectors {
    private TypeSelectors() {
        // utility
    }

    public static Selection selectChords(Selection selection) {
        return fanOut(selection, node -> node.is(Tag.CHORD));
    }

    public static Selection selectNotes(Selection selection) {
        return fanOut(selection, node -> node.is(Tag.NOTE));
    }

    public static Selection selectRests(Selection selection) {
        return fanOut(selection, node -> node.is(Tag.REST));
    }

    /** Notes that are not part of a chord. */
    public static Selection selectNonChordNotes(Selection selection) {
        return fanOutByChord(selection, false);
    }

    /** Notes written inside a chord. */
    public static Selection selectChordNotes(Selection selection) {
        return fanOutByChord(selection, true);
    }

    static Selection fanOut(Selection selection, Predicate<CSNode> predicate) {
        var cursors = new ArrayList<Set<Integer>>();
        for (var cursor : selection.cursors()) {
            ScopedWalk.walk(selection.root(), cursor, (node, inScope, enclosing) -> {
                if (inScope && predicate.test(node)) {
                    cursors.add(Set.of(node.id()));
                }
                return true;
            });
        }
        return selection.withCursors(cursors);
    }

    private static Selection fanOutByChord(Selection selection, boolean insideChord) {
        var cursors = new ArrayList<Set<Integer>>();
        for (var cursor : selection.cursors()) {
            ScopedWalk.walk(selection.root(), cursor, Tag.CHORD, (node, inScope, chord) -> {
                if (inScope && node.is(Tag.NOTE) && (chord != null) == insideChord) {
                    cursors.add(Set.of(node.id()));
                }
                return true;
            });
        }
        return selection.withCursors(cursors);
    }
}
