package io.github.abcls.transforms;

import io.github.abcls.cstree.CSNode;
import io.github.abcls.cstree.Tag;
import io.github.abcls.cstree.TreeUtils;
import io.github.abcls.selection.Selection;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/** Read-only measurements over a selection. Nothing here touches the tree. */
public final class Queries {
    private Queries() {
        // utility
    }

    /** Total duration per cursor; {@code 0} for a cursor with no notes, chords or rests in scope. */
    public static List<Rational> sumRhythm(Selection selection) {
        var sums = new ArrayList<Rational>(selection.cursors().size());
        for (var cursor : selection.cursors()) {
            var total = Rational.ZERO;
            for (var node : TransformTargets.timedElements(single(selection, cursor))) {
                total = total.add(Rhythms.getNodeRhythm(node));
            }
            sums.add(total);
        }
        return sums;
    }

    /** MIDI pitches in document order. A chord reports its last written note; rests report nothing. */
    public static List<Integer> pitch(Selection selection) {
        var pitches = new ArrayList<Integer>();
        for (var node : TransformTargets.soundingElements(selection)) {
            var note = node.is(Tag.CHORD) ? lastNote(node) : node;
            if (note == null) {
                continue;
            }
            var pitch = TreeUtils.findChildByTag(note, Tag.PITCH);
            if (pitch != null) {
                pitches.add(PitchTransforms.midiOf(pitch.node()));
            }
        }
        return pitches;
    }

    private static Selection single(Selection selection, Set<Integer> cursor) {
        return selection.withCursors(List.of(cursor));
    }

    private static @Nullable CSNode lastNote(CSNode chord) {
        CSNode last = null;
        for (var child = chord.firstChild(); child != null; child = child.nextSibling()) {
            if (child.is(Tag.NOTE)) {
                last = child;
            }
        }
        return last;
    }
}
