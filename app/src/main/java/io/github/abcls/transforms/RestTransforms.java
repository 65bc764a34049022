package io.github.abcls.transforms;

import io.github.abcls.cstree.CSNode;
import io.github.abcls.cstree.CsTreeSerializer;
import io.github.abcls.cstree.Tag;
import io.github.abcls.cstree.TreeUtils;
import io.github.abcls.cstree.TreeWalk;
import io.github.abcls.cstree.VoiceMarkers;
import io.github.abcls.parser.AbcContext;
import io.github.abcls.parser.TT;
import io.github.abcls.selection.ScopedWalk;
import io.github.abcls.selection.Selection;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;

/**
 * Transforms that merge rests into each other or fill them with sound. Both only merge neighbours of equal length
 * whose sum is a power of two, so the result never needs a dotted or tied rhythm.
 */
public final class RestTransforms {
    private RestTransforms() {
        // utility
    }

    /**
     * Merges each rest in scope with the next one written after it when both are in scope, of the same kind
     * ({@code z} or {@code x}) and of equal length, and their sum is a power of two. Whitespace between merged rests
     * goes with them. Repeats until nothing merges, so {@code z z z z} becomes {@code z4}.
     */
    public static Selection consolidateRests(Selection selection, AbcContext ctx) {
        var rests = TransformTargets.rests(selection);
        var inScope = rests.stream().map(CSNode::id).collect(Collectors.toSet());
        var merged = new HashSet<Integer>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (var rest : rests) {
                if (merged.contains(rest.id())) {
                    continue;
                }
                var next = nextContent(rest);
                if (next == null || !next.is(Tag.REST) || !inScope.contains(next.id())) {
                    continue;
                }
                if (!restKind(rest).equals(restKind(next)) || isBroken(rest) || isBroken(next)) {
                    continue;
                }
                var sum = mergedLength(rest, next);
                if (sum == null) {
                    continue;
                }
                Rhythms.setNodeRhythm(rest, sum, ctx);
                rest.setNextSibling(next.nextSibling());
                merged.add(next.id());
                changed = true;
            }
        }
        return selection.retainIds(TreeWalk.collectAllIds(selection.root()));
    }

    /**
     * Fills rests and spacers in scope with tied copies of the note or chord before them, so each sound lasts until
     * the next one starts. A copy takes the length of the rest it replaces. Voice markers and multi-measure rests
     * break the chain. Tied copies of one pitch are then merged the way {@link #consolidateRests} merges rests,
     * stopping at bar lines, and a tie left dangling on the last filled element is removed.
     */
    public static Selection legato(Selection selection, AbcContext ctx) {
        var root = selection.root();
        var filled = new HashSet<Integer>();
        var cursors = new ArrayList<Set<Integer>>();
        for (var cursor : selection.cursors()) {
            var replacements = new ArrayList<CSNode[]>();
            var source = new CSNode[1];
            ScopedWalk.walk(root, cursor, (node, inScope, enclosing) -> {
                if (!inScope) {
                    return true;
                }
                if (VoiceMarkers.isVoiceMarker(node) || node.is(Tag.MULTI_MEASURE_REST)) {
                    source[0] = null;
                    return false;
                }
                if (node.is(Tag.NOTE) || node.is(Tag.CHORD)) {
                    source[0] = node;
                    return false;
                }
                if ((node.is(Tag.REST) || node.is(Tag.Y_SPACER)) && source[0] != null) {
                    var copy = TreeUtils.copy(source[0], ctx);
                    Rhythms.setNodeRhythm(copy, Rhythms.getNodeRhythm(node), ctx);
                    addTie(source[0], ctx);
                    replacements.add(new CSNode[] {node, copy});
                    filled.add(source[0].id());
                    filled.add(copy.id());
                    source[0] = copy;
                    return false;
                }
                return !node.is(Tag.GRACE_GROUP);
            });

            var updated = new LinkedHashSet<>(cursor);
            for (var replacement : replacements) {
                var parent = TreeUtils.findParent(root, replacement[0]);
                if (parent != null) {
                    TreeUtils.replaceChild(parent, replacement[0], replacement[1]);
                    if (updated.remove(replacement[0].id())) {
                        updated.add(replacement[1].id());
                    }
                }
            }
            cursors.add(updated);
        }

        var result = selection.withCursors(cursors);
        consolidateTies(result, ctx, filled);
        removeTrailingTie(result, filled);
        return result.retainIds(TreeWalk.collectAllIds(root));
    }

    /**
     * Merges tied neighbours of one pitch where at least one side took part in filling. {@code filled} follows the
     * survivor of each merge.
     */
    private static void consolidateTies(Selection selection, AbcContext ctx, Set<Integer> filled) {
        var elements = TransformTargets.soundingElements(selection);
        var inScope = elements.stream().map(CSNode::id).collect(Collectors.toSet());
        var merged = new HashSet<Integer>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (var node : elements) {
                if (merged.contains(node.id()) || TreeUtils.findTieChild(node) == null) {
                    continue;
                }
                var next = nextContent(node);
                if (next == null || next.tag() != node.tag() || !inScope.contains(next.id())) {
                    continue;
                }
                if (!filled.contains(node.id()) && !filled.contains(next.id())) {
                    continue;
                }
                if (!pitchKey(node).equals(pitchKey(next))) {
                    continue;
                }
                var sum = mergedLength(node, next);
                if (sum == null) {
                    continue;
                }
                Rhythms.setNodeRhythm(node, sum, ctx);
                if (TreeUtils.findTieChild(next) == null) {
                    removeTie(node);
                }
                node.setNextSibling(next.nextSibling());
                merged.add(next.id());
                if (filled.contains(next.id())) {
                    filled.add(node.id());
                }
                changed = true;
            }
        }
    }

    private static void removeTrailingTie(Selection selection, Set<Integer> filled) {
        var elements = TransformTargets.soundingElements(selection);
        if (elements.isEmpty()) {
            return;
        }
        var last = elements.get(elements.size() - 1);
        if (filled.contains(last.id())) {
            removeTie(last);
        }
    }

    /** Next sibling that is not whitespace. */
    private static @Nullable CSNode nextContent(CSNode node) {
        var next = node.nextSibling();
        while (next != null && next.isTokenOf(TT.WS)) {
            next = next.nextSibling();
        }
        return next;
    }

    /** Sum of two equal lengths when it is a power of two, else {@code null}. */
    private static @Nullable Rational mergedLength(CSNode first, CSNode second) {
        var a = Rhythms.getNodeRhythm(first);
        if (!a.equals(Rhythms.getNodeRhythm(second))) {
            return null;
        }
        var sum = a.add(a);
        return isPowerOfTwo(sum) ? sum : null;
    }

    static boolean isPowerOfTwo(Rational value) {
        int n = value.numerator();
        int d = value.denominator();
        if (n <= 0) {
            return false;
        }
        return (n == 1 && Integer.bitCount(d) == 1) || (d == 1 && Integer.bitCount(n) == 1);
    }

    private static String restKind(CSNode rest) {
        var token = TreeUtils.findChildByTokenType(rest, TT.REST);
        return token == null ? "" : token.node().tokenData().lexeme();
    }

    private static boolean isBroken(CSNode node) {
        var rhythm = TreeUtils.findRhythmChild(node);
        return rhythm != null && TreeUtils.findChildByTokenType(rhythm.node(), TT.RHY_BRKN) != null;
    }

    /** The written pitches of a note, or the sorted pitches of a chord. */
    private static List<String> pitchKey(CSNode node) {
        var pitches = new ArrayList<String>();
        if (node.is(Tag.NOTE)) {
            var pitch = TreeUtils.findChildByTag(node, Tag.PITCH);
            if (pitch != null) {
                pitches.add(CsTreeSerializer.serialize(pitch.node()));
            }
            return pitches;
        }
        for (var child = node.firstChild(); child != null; child = child.nextSibling()) {
            if (child.is(Tag.NOTE)) {
                pitches.addAll(pitchKey(child));
            }
        }
        pitches.sort(null);
        return pitches;
    }

    private static void addTie(CSNode node, AbcContext ctx) {
        if (TreeUtils.findTieChild(node) == null) {
            TreeUtils.appendChild(node, CSNode.token(ctx, TT.TIE, "-"));
        }
    }

    private static void removeTie(CSNode node) {
        var tie = TreeUtils.findTieChild(node);
        if (tie != null) {
            TreeUtils.removeChild(node, tie.node());
        }
    }
}
