package io.github.abcls.transforms;

import io.github.abcls.cstree.CSNode;
import io.github.abcls.cstree.Tag;
import io.github.abcls.cstree.TreeUtils;
import io.github.abcls.cstree.TreeWalk;
import io.github.abcls.parser.AbcContext;
import io.github.abcls.parser.TT;
import io.github.abcls.selection.Selection;
import java.util.ArrayList;
import org.jetbrains.annotations.Nullable;

/** Transforms that change the shape of the tree rather than token values. */
public final class StructuralTransforms {
    private StructuralTransforms() {
        // utility
    }

    /**
     * Turns notes and chords in scope into rests of the same duration. The element keeps its identity; ties are
     * dropped. A chord without a rhythm of its own takes its first note's rhythm.
     */
    public static Selection toRest(Selection selection, AbcContext ctx) {
        for (var node : TransformTargets.soundingElements(selection)) {
            var rhythm = node.is(Tag.CHORD) ? chordRhythm(node) : rhythmOf(node);
            var children = new ArrayList<CSNode>();
            children.add(CSNode.token(ctx, TT.REST, "z"));
            if (rhythm != null) {
                children.add(rhythm);
            }
            node.retag(Tag.REST);
            node.linkChildren(children);
        }
        return selection;
    }

    private static @Nullable CSNode chordRhythm(CSNode chord) {
        var own = rhythmOf(chord);
        if (own != null) {
            return own;
        }
        var firstNote = TreeUtils.findChildByTag(chord, Tag.NOTE);
        return firstNote == null ? null : rhythmOf(firstNote.node());
    }

    private static @Nullable CSNode rhythmOf(CSNode node) {
        var lookup = TreeUtils.findRhythmChild(node);
        return lookup == null ? null : lookup.node();
    }

    /**
     * Replaces each chord in scope that holds exactly one note by a bare note. The chord's identity survives under
     * the {@link Tag#NOTE} tag. The chord's rhythm and tie win over the note's own.
     */
    public static Selection unwrapSingle(Selection selection, AbcContext ctx) {
        for (var chord : TransformTargets.chords(selection)) {
            var notes = TreeUtils.collectChildren(chord).stream()
                    .filter(child -> child.is(Tag.NOTE))
                    .toList();
            if (notes.size() != 1) {
                continue;
            }
            var note = notes.get(0);
            var pitch = TreeUtils.findChildByTag(note, Tag.PITCH);
            if (pitch == null) {
                continue;
            }
            var chordRhythm = TreeUtils.findRhythmChild(chord);
            var chordTie = TreeUtils.findTieChild(chord);
            var rhythm = chordRhythm != null ? chordRhythm : TreeUtils.findRhythmChild(note);
            var tie = chordTie != null ? chordTie : TreeUtils.findTieChild(note);

            var children = new ArrayList<CSNode>();
            children.add(pitch.node());
            if (rhythm != null) {
                children.add(rhythm.node());
            }
            if (tie != null) {
                children.add(tie.node());
            }
            chord.retag(Tag.NOTE);
            chord.linkChildren(children);
        }
        return selection;
    }

    /**
     * Detaches every node named by a cursor from its parent. The returned selection keeps only identities still in
     * the tree; cursors left empty are dropped.
     */
    public static Selection remove(Selection selection) {
        var root = selection.root();
        for (var id : selection.allIds()) {
            if (id == root.id()) {
                continue;
            }
            var node = TreeWalk.findNodeById(root, id);
            if (node == null) {
                continue;
            }
            var parent = TreeUtils.findParent(root, node);
            if (parent != null) {
                TreeUtils.removeChild(parent, node);
            }
        }
        return selection.retainIds(TreeWalk.collectAllIds(root));
    }
}
