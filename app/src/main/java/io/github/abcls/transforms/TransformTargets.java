package io.github.abcls.transforms;

import io.github.abcls.cstree.CSNode;
import io.github.abcls.cstree.Tag;
import io.github.abcls.selection.ScopedWalk;
import io.github.abcls.selection.Selection;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Finds the nodes a transform acts on. Each node is reported once even if several cursors reach it. */
final class TransformTargets {
    private TransformTargets() {
        // utility
    }

    /** Every note in scope, including notes written inside chords and grace groups. */
    static List<CSNode> notes(Selection selection) {
        return collect(selection, Set.of(Tag.NOTE), false, false);
    }

    /**
     * Notes, chords and rests in scope. A chord is one unit: its own notes are not reported separately. Grace notes
     * are left out unless the cursor names the grace group or something inside it.
     */
    static List<CSNode> timedElements(Selection selection) {
        return collect(selection, Set.of(Tag.NOTE, Tag.CHORD, Tag.REST), true, true);
    }

    /** Notes and chords in scope, chords as units, grace notes as in {@link #timedElements}. */
    static List<CSNode> soundingElements(Selection selection) {
        return collect(selection, Set.of(Tag.NOTE, Tag.CHORD), true, true);
    }

    static List<CSNode> chords(Selection selection) {
        return collect(selection, Set.of(Tag.CHORD), true, true);
    }

    static List<CSNode> rests(Selection selection) {
        return collect(selection, Set.of(Tag.REST), true, true);
    }

    private static List<CSNode> collect(
            Selection selection, Set<Tag> tags, boolean stopAtMatch, boolean skipGraceGroups) {
        var seen = new HashSet<Integer>();
        var result = new ArrayList<CSNode>();
        for (var cursor : selection.cursors()) {
            ScopedWalk.walk(selection.root(), cursor, (node, inScope, enclosing) -> {
                // a grace group reached only through an enclosing selection
                if (skipGraceGroups && inScope && node.is(Tag.GRACE_GROUP) && !cursor.contains(node.id())) {
                    return false;
                }
                if (!inScope || !tags.contains(node.tag())) {
                    return true;
                }
                if (seen.add(node.id())) {
                    result.add(node);
                }
                return !stopAtMatch;
            });
        }
        return result;
    }
}
