package io.github.abcls.reconcile;

import io.github.abcls.cstree.CSNode;
import io.github.abcls.cstree.Tag;
import io.github.abcls.cstree.TreeWalk;
import io.github.abcls.selection.Selection;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Carries cursors across an edit. Identities that left the tree are dropped; the rest are moved onto a freshly
 * parsed tree by ordinal position.
 *
 * <p>Notes, chords and rests share one ordinal sequence, so a note turned into a rest keeps its place. Other
 * interior nodes are matched within their own tag; tokens are not carried. The mapping is only exact when the
 * edit keeps the number and order of elements, which holds for every transform except {@code remove}.
 */
public final class CursorPreservation {
    private CursorPreservation() {
        // utility
    }

    /** Cursors intersected with the identities still reachable from the root; empty cursors are dropped. */
    public static List<Set<Integer>> collectSurvivingCursorIds(Selection selection) {
        return selection.retainIds(TreeWalk.collectAllIds(selection.root())).cursors();
    }

    /**
     * Maps surviving identities of {@code oldRoot} onto {@code freshRoot}. Identities with no counterpart are
     * dropped, and so are cursors left empty.
     */
    public static List<Set<Integer>> remapCursors(CSNode oldRoot, List<Set<Integer>> cursors, CSNode freshRoot) {
        var oldSlots = slots(oldRoot);
        var freshIds = invert(slots(freshRoot));
        var remapped = new ArrayList<Set<Integer>>();
        for (var cursor : cursors) {
            var mapped = new LinkedHashSet<Integer>();
            for (int id : cursor) {
                var slot = oldSlots.get(id);
                var freshId = slot == null ? null : freshIds.get(slot);
                if (freshId != null) {
                    mapped.add(freshId);
                }
            }
            if (!mapped.isEmpty()) {
                remapped.add(mapped);
            }
        }
        return remapped;
    }

    /** Kind of ordinal sequence a node belongs to, paired with its position in that sequence. */
    private record Slot(String sequence, int ordinal) {}

    private static Map<Integer, Slot> slots(CSNode root) {
        var slots = new HashMap<Integer, Slot>();
        assignSlots(root, false, new HashMap<>(), slots);
        return slots;
    }

    private static void assignSlots(
            CSNode node, boolean insideChord, Map<String, Integer> counters, Map<Integer, Slot> slots) {
        if (node.isToken()) {
            return;
        }
        var sequence = sequenceOf(node, insideChord);
        int ordinal = counters.merge(sequence, 1, Integer::sum) - 1;
        slots.put(node.id(), new Slot(sequence, ordinal));
        boolean childrenInsideChord = insideChord || node.is(Tag.CHORD);
        for (var child = node.firstChild(); child != null; child = child.nextSibling()) {
            assignSlots(child, childrenInsideChord, counters, slots);
        }
    }

    // Chord members get their own sequence so that collapsing a chord does not shift later elements.
    private static String sequenceOf(CSNode node, boolean insideChord) {
        if (insideChord) {
            return "chord:" + node.tag().name();
        }
        if (node.is(Tag.NOTE) || node.is(Tag.CHORD) || node.is(Tag.REST)) {
            return "music";
        }
        return node.tag().name();
    }

    private static Map<Slot, Integer> invert(Map<Integer, Slot> slots) {
        var inverted = new HashMap<Slot, Integer>();
        slots.forEach((id, slot) -> inverted.put(slot, id));
        return inverted;
    }
}
