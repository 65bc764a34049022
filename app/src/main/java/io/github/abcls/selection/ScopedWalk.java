package io.github.abcls.selection;

import io.github.abcls.cstree.CSNode;
import io.github.abcls.cstree.Tag;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Depth-first walk that tracks scope. A node is in scope when its own identity is in the cursor or an ancestor's
 * is. The nearest enclosing node of a given tag is threaded down the recursion as well; a node of that tag is its
 * own enclosing node.
 */
public final class ScopedWalk {
    private ScopedWalk() {
        // utility
    }

    @FunctionalInterface
    public interface Visitor {
        /**
         * Called for every node. Returning {@code false} skips the node's descendants.
         *
         * @param enclosing nearest node (self included) tagged with the walk's enclosing tag, if any
         */
        boolean visit(CSNode node, boolean inScope, @Nullable CSNode enclosing);
    }

    public static void walk(CSNode root, Set<Integer> cursor, Visitor visitor) {
        walk(root, cursor, null, visitor);
    }

    public static void walk(CSNode root, Set<Integer> cursor, @Nullable Tag enclosingTag, Visitor visitor) {
        visitNode(root, cursor, enclosingTag, false, null, visitor);
    }

    private static void visitNode(
            CSNode node,
            Set<Integer> cursor,
            @Nullable Tag enclosingTag,
            boolean parentInScope,
            @Nullable CSNode parentEnclosing,
            Visitor visitor) {
        boolean inScope = parentInScope || cursor.contains(node.id());
        var enclosing = enclosingTag != null && node.is(enclosingTag) ? node : parentEnclosing;
        if (!visitor.visit(node, inScope, enclosing)) {
            return;
        }
        for (var child = node.firstChild(); child != null; child = child.nextSibling()) {
            visitNode(child, cursor, enclosingTag, inScope, enclosing, visitor);
        }
    }
}
