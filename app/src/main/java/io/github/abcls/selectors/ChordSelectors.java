package io.github.abcls.selectors;

import io.github.abcls.cstree.CSNode;
import io.github.abcls.cstree.Tag;
import io.github.abcls.selection.ScopedWalk;
import io.github.abcls.selection.Selection;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Note selectors over chords already in scope. A chord's notes are taken in source order: the top note is the last
 * one written, the bottom note the first. Pitch is not consulted.
 */
public final class ChordSelectors {
    private ChordSelectors() {
        // utility
    }

    public static Selection selectTop(Selection selection) {
        return selectNthFromTop(selection, 0);
    }

    public static Selection selectBottom(Selection selection) {
        return perChord(selection, notes -> notes.isEmpty() ? List.of() : List.of(notes.get(0)));
    }

    /** {@code n = 0} is the top note; out-of-range {@code n} selects nothing for that chord. */
    public static Selection selectNthFromTop(Selection selection, int n) {
        return perChord(selection, notes -> {
            int index = notes.size() - 1 - n;
            return n < 0 || index < 0 ? List.of() : List.of(notes.get(index));
        });
    }

    public static Selection selectAllButTop(Selection selection) {
        return perChord(selection, notes -> notes.isEmpty() ? List.of() : notes.subList(0, notes.size() - 1));
    }

    public static Selection selectAllButBottom(Selection selection) {
        return perChord(selection, notes -> notes.isEmpty() ? List.of() : notes.subList(1, notes.size()));
    }

    private static Selection perChord(Selection selection, Function<List<CSNode>, List<CSNode>> pick) {
        var cursors = new ArrayList<Set<Integer>>();
        for (var cursor : selection.cursors()) {
            ScopedWalk.walk(selection.root(), cursor, (node, inScope, enclosing) -> {
                if (inScope && node.is(Tag.CHORD)) {
                    for (var note : pick.apply(chordNotes(node))) {
                        cursors.add(Set.of(note.id()));
                    }
                    return false;
                }
                return true;
            });
        }
        return selection.withCursors(cursors);
    }

    /** Direct Note children of {@code chord}, in source order. */
    static List<CSNode> chordNotes(CSNode chord) {
        var notes = new ArrayList<CSNode>();
        for (var child = chord.firstChild(); child != null; child = child.nextSibling()) {
            if (child.is(Tag.NOTE)) {
                notes.add(child);
            }
        }
        return notes;
    }
}
