package io.github.abcls.selection;

import io.github.abcls.cstree.CSNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A tree plus zero or more cursors. Each cursor is a set of node identities forming one logical selection unit.
 * Selections are values: selectors return new cursor lists over the same {@code root}.
 */
public record Selection(CSNode root, List<Set<Integer>> cursors) {

    public Selection {
        var copied = new ArrayList<Set<Integer>>(cursors.size());
        for (var cursor : cursors) {
            copied.add(Collections.unmodifiableSet(new LinkedHashSet<>(cursor)));
        }
        cursors = Collections.unmodifiableList(copied);
    }

    /** The initial selection: one cursor holding the root. */
    public static Selection of(CSNode root) {
        return new Selection(root, List.of(Set.of(root.id())));
    }

    public Selection withCursors(List<Set<Integer>> newCursors) {
        return new Selection(root, newCursors);
    }

    public boolean isEmpty() {
        return cursors.isEmpty();
    }

    /** Union of all cursor identities, in cursor order. */
    public Set<Integer> allIds() {
        var ids = new LinkedHashSet<Integer>();
        cursors.forEach(ids::addAll);
        return ids;
    }

    /** This selection with each cursor narrowed to {@code ids}; cursors left empty are dropped. */
    public Selection retainIds(Set<Integer> ids) {
        var narrowed = new ArrayList<Set<Integer>>();
        for (var cursor : cursors) {
            var kept = new LinkedHashSet<Integer>(cursor);
            kept.retainAll(ids);
            if (!kept.isEmpty()) {
                narrowed.add(kept);
            }
        }
        return withCursors(narrowed);
    }
}
