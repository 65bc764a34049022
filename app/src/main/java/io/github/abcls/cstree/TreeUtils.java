package io.github.abcls.cstree;

import io.github.abcls.parser.AbcContext;
import io.github.abcls.parser.TT;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Sibling-chain edits. Since nodes have no parent pointer, every edit takes the parent explicitly and finds the
 * previous sibling itself.
 */
public final class TreeUtils {
    private TreeUtils() {
        // utility
    }

    /** A child together with its previous sibling ({@code null} when it is the first child). */
    public record ChildLookup(CSNode node, @Nullable CSNode prev) {}

    public static @Nullable ChildLookup findChildByTag(CSNode parent, Tag tag) {
        CSNode prev = null;
        for (var child = parent.firstChild(); child != null; child = child.nextSibling()) {
            if (child.is(tag)) {
                return new ChildLookup(child, prev);
            }
            prev = child;
        }
        return null;
    }

    public static @Nullable ChildLookup findChildByTokenType(CSNode parent, TT type) {
        CSNode prev = null;
        for (var child = parent.firstChild(); child != null; child = child.nextSibling()) {
            if (child.isTokenOf(type)) {
                return new ChildLookup(child, prev);
            }
            prev = child;
        }
        return null;
    }

    public static List<CSNode> collectChildren(CSNode parent) {
        return parent.children();
    }

    public static void removeChild(CSNode parent, CSNode child) {
        var prev = previousSibling(parent, child);
        if (prev == null) {
            parent.setFirstChild(child.nextSibling());
        } else {
            prev.setNextSibling(child.nextSibling());
        }
        child.setNextSibling(null);
    }

    public static void replaceChild(CSNode parent, CSNode oldChild, CSNode newChild) {
        var prev = previousSibling(parent, oldChild);
        newChild.setNextSibling(oldChild.nextSibling());
        if (prev == null) {
            parent.setFirstChild(newChild);
        } else {
            prev.setNextSibling(newChild);
        }
        oldChild.setNextSibling(null);
    }

    public static void insertBefore(CSNode parent, CSNode ref, CSNode newChild) {
        var prev = previousSibling(parent, ref);
        newChild.setNextSibling(ref);
        if (prev == null) {
            parent.setFirstChild(newChild);
        } else {
            prev.setNextSibling(newChild);
        }
    }

    public static void appendChild(CSNode parent, CSNode child) {
        child.setNextSibling(null);
        var last = parent.firstChild();
        if (last == null) {
            parent.setFirstChild(child);
            return;
        }
        while (last.nextSibling() != null) {
            last = last.nextSibling();
        }
        last.setNextSibling(child);
    }

    /** Deep copy of {@code node} with fresh identities. Copied tokens have no source position. */
    public static CSNode copy(CSNode node, AbcContext ctx) {
        if (node.isToken()) {
            var data = node.tokenData();
            return CSNode.token(ctx, data.tokenType(), data.lexeme());
        }
        var children = new ArrayList<CSNode>();
        for (var child = node.firstChild(); child != null; child = child.nextSibling()) {
            children.add(copy(child, ctx));
        }
        return CSNode.interior(ctx, node.tag(), children);
    }

    /** Inserts {@code newChild} directly after {@code ref}, which may be the last child. */
    public static void insertAfter(CSNode ref, CSNode newChild) {
        newChild.setNextSibling(ref.nextSibling());
        ref.setNextSibling(newChild);
    }

    /**
     * Previous sibling of {@code child} under {@code parent}; {@code null} if it is the first child.
     *
     * @throws IllegalArgumentException if {@code child} is not a child of {@code parent}
     */
    private static @Nullable CSNode previousSibling(CSNode parent, CSNode child) {
        CSNode prev = null;
        for (var current = parent.firstChild(); current != null; current = current.nextSibling()) {
            if (current == child) {
                return prev;
            }
            prev = current;
        }
        throw new IllegalArgumentException(child + " is not a child of " + parent);
    }

    /** Parent of {@code target} within {@code root}; {@code null} for the root itself or a node not in the tree. */
    public static @Nullable CSNode findParent(CSNode root, CSNode target) {
        for (var child = root.firstChild(); child != null; child = child.nextSibling()) {
            if (child == target) {
                return root;
            }
            var found = findParent(child, target);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    public static @Nullable ChildLookup findRhythmChild(CSNode node) {
        return findChildByTag(node, Tag.RHYTHM);
    }

    public static @Nullable ChildLookup findTieChild(CSNode node) {
        return findChildByTokenType(node, TT.TIE);
    }

    /**
     * Sets the rhythm of a note, chord or rest. A {@code null} rhythm removes the existing one; a new rhythm goes
     * before the tie if there is one, else at the end.
     */
    public static void replaceRhythm(CSNode node, @Nullable CSNode newRhythm) {
        var existing = findRhythmChild(node);
        if (existing != null) {
            if (newRhythm == null) {
                removeChild(node, existing.node());
            } else {
                replaceChild(node, existing.node(), newRhythm);
            }
            return;
        }
        if (newRhythm == null) {
            return;
        }
        var tie = findTieChild(node);
        if (tie != null) {
            insertBefore(node, tie.node(), newRhythm);
        } else {
            appendChild(node, newRhythm);
        }
    }
}
