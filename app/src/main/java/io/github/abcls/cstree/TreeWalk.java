package io.github.abcls.cstree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/** Read-only traversals over a {@link CSNode} subtree. All walks are depth-first, children before siblings. */
public final class TreeWalk {
    private TreeWalk() {
        // utility
    }

    /** Leftmost token under {@code node}, or {@code node} itself if it is a token. */
    public static @Nullable TokenData firstTokenData(CSNode node) {
        if (node.isToken()) {
            return node.data();
        }
        for (var child = node.firstChild(); child != null; child = child.nextSibling()) {
            var found = firstTokenData(child);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /** Rightmost token under {@code node}, or {@code node} itself if it is a token. */
    public static @Nullable TokenData lastTokenData(CSNode node) {
        if (node.isToken()) {
            return node.data();
        }
        TokenData last = null;
        for (var child = node.firstChild(); child != null; child = child.nextSibling()) {
            var found = lastTokenData(child);
            if (found != null) {
                last = found;
            }
        }
        return last;
    }

    /** Orders two source positions by line, then column. */
    public static int comparePositions(int lineA, int columnA, int lineB, int columnB) {
        if (lineA != lineB) {
            return Integer.compare(lineA, lineB);
        }
        return Integer.compare(columnA, columnB);
    }

    public static Map<Integer, CSNode> buildIdMap(CSNode root) {
        var map = new HashMap<Integer, CSNode>();
        visit(root, node -> map.put(node.id(), node));
        return map;
    }

    public static @Nullable CSNode findNodeById(CSNode root, int id) {
        if (root.id() == id) {
            return root;
        }
        for (var child = root.firstChild(); child != null; child = child.nextSibling()) {
            var found = findNodeById(child, id);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /** All nodes tagged {@code tag} under {@code root}, in document order. */
    public static List<CSNode> findByTag(CSNode root, Tag tag) {
        var result = new ArrayList<CSNode>();
        visit(root, node -> {
            if (node.is(tag)) {
                result.add(node);
            }
        });
        return result;
    }

    public static @Nullable CSNode findFirstByTag(CSNode root, Tag tag) {
        if (root.is(tag)) {
            return root;
        }
        for (var child = root.firstChild(); child != null; child = child.nextSibling()) {
            var found = findFirstByTag(child, tag);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /** Nearest proper ancestor of the node with {@code targetId} that is tagged {@code tag}. */
    public static @Nullable CSNode findAncestorByTag(CSNode root, int targetId, Tag tag) {
        var ancestors = new ArrayDeque<CSNode>();
        return findAncestor(root, targetId, tag, ancestors);
    }

    private static @Nullable CSNode findAncestor(CSNode node, int targetId, Tag tag, Deque<CSNode> ancestors) {
        if (node.id() == targetId) {
            for (var ancestor : ancestors) {
                if (ancestor.is(tag)) {
                    return ancestor;
                }
            }
            return null;
        }
        ancestors.push(node);
        try {
            for (var child = node.firstChild(); child != null; child = child.nextSibling()) {
                var found = findAncestor(child, targetId, tag, ancestors);
                if (found != null) {
                    return found;
                }
            }
            return null;
        } finally {
            ancestors.pop();
        }
    }

    public static Set<Integer> collectAllIds(CSNode root) {
        var ids = new HashSet<Integer>();
        visit(root, node -> ids.add(node.id()));
        return ids;
    }

    /** Pre-order visit of {@code root} and its descendants. */
    public static void visit(CSNode root, NodeConsumer consumer) {
        consumer.accept(root);
        for (var child = root.firstChild(); child != null; child = child.nextSibling()) {
            visit(child, consumer);
        }
    }

    @FunctionalInterface
    public interface NodeConsumer {
        void accept(CSNode node);
    }
}
