package io.github.abcls.selectors;

import io.github.abcls.cstree.CSNode;
import io.github.abcls.cstree.Tag;
import io.github.abcls.selection.Selection;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/** Selectors for the large-scale units of a file: tunes, systems and measures. */
public final class StructuralSelectors {
    private StructuralSelectors() {
        // utility
    }

    private enum LineKind {
        BLANK,
        COMMENT,
        HEADER,
        LYRICS,
        MUSIC
    }

    public static Selection selectTune(Selection selection) {
        return TypeSelectors.fanOut(selection, node -> node.is(Tag.TUNE));
    }

    /**
     * One cursor per system the selection touches. A system is a line of music together with the info lines and
     * directives written right before it and the lyric lines written after it; a trailing line continuation joins
     * the next music line to the same system. Comment lines belong to no system. Line ends are not part of the
     * cursor. When no system is touched the selection is returned as it is.
     */
    public static Selection selectSystem(Selection selection) {
        var ids = selection.allIds();
        var cursors = new ArrayList<Set<Integer>>();
        BodyScan.forEachBody(selection, (body, inScope) -> {
            for (var system : systems(body)) {
                if (!inScope && system.stream().noneMatch(node -> BodyScan.touches(node, ids))) {
                    continue;
                }
                var cursor = new LinkedHashSet<Integer>();
                for (var node : system) {
                    if (!BodyScan.isLayout(node)) {
                        cursor.add(node.id());
                    }
                }
                if (!cursor.isEmpty()) {
                    cursors.add(cursor);
                }
            }
        });
        return cursors.isEmpty() ? selection : selection.withCursors(cursors);
    }

    static List<List<CSNode>> systems(CSNode body) {
        var systems = new ArrayList<List<CSNode>>();
        var pending = new ArrayList<CSNode>();
        List<CSNode> continued = null;
        for (var line : BodyScan.lines(body)) {
            switch (kindOf(line)) {
                case HEADER -> pending.addAll(line);
                case LYRICS -> {
                    if (systems.isEmpty()) {
                        pending.addAll(line);
                    } else {
                        systems.get(systems.size() - 1).addAll(line);
                    }
                }
                case MUSIC -> {
                    var system = continued;
                    if (system == null) {
                        system = new ArrayList<>();
                        systems.add(system);
                    }
                    system.addAll(pending);
                    system.addAll(line);
                    pending.clear();
                    continued = endsWithContinuation(line) ? system : null;
                }
                default -> {
                    // blank and comment lines
                }
            }
        }
        if (!pending.isEmpty()) {
            systems.add(pending);
        }
        return systems;
    }

    private static LineKind kindOf(List<CSNode> line) {
        var first = firstContent(line);
        if (first == null) {
            return LineKind.BLANK;
        }
        if (first.is(Tag.COMMENT)) {
            return LineKind.COMMENT;
        }
        if (first.is(Tag.INFO_LINE) || first.is(Tag.DIRECTIVE)) {
            return LineKind.HEADER;
        }
        return first.is(Tag.LYRIC_LINE) ? LineKind.LYRICS : LineKind.MUSIC;
    }

    private static @Nullable CSNode firstContent(List<CSNode> line) {
        for (var node : line) {
            if (!BodyScan.isLayout(node)) {
                return node;
            }
        }
        return null;
    }

    private static boolean endsWithContinuation(List<CSNode> line) {
        for (int i = line.size() - 1; i >= 0; i--) {
            var node = line.get(i);
            if (BodyScan.isLayout(node) || node.is(Tag.COMMENT)) {
                continue;
            }
            return node.is(Tag.LINE_CONTINUATION);
        }
        return false;
    }

    /** Every measure the selection touches. */
    public static Selection selectMeasures(Selection selection) {
        return selectMeasures(selection, 1, Integer.MAX_VALUE);
    }

    /**
     * One cursor per measure numbered {@code start} to {@code end} (inclusive) that the selection touches. Measures
     * are counted from 1 in each tune; every bar line written in the tune body starts a new one. A cursor holds the
     * touched elements of its measure: bar lines, comments, info lines, directives and lyric lines are left out, and
     * measures with nothing left are skipped.
     *
     * @throws IllegalArgumentException if {@code start} or {@code end} is below 1, or {@code start > end}
     */
    public static Selection selectMeasures(Selection selection, int start, int end) {
        if (start < 1 || end < 1) {
            throw new IllegalArgumentException("Measure numbers start at 1, got " + start + ".." + end);
        }
        if (start > end) {
            throw new IllegalArgumentException("Measure range is reversed: " + start + ".." + end);
        }
        var ids = selection.allIds();
        var cursors = new ArrayList<Set<Integer>>();
        BodyScan.forEachBody(selection, (body, inScope) -> {
            int measure = 1;
            var cursor = new LinkedHashSet<Integer>();
            for (var child = body.firstChild(); child != null; child = child.nextSibling()) {
                if (child.is(Tag.BAR_LINE)) {
                    flush(cursor, cursors);
                    measure++;
                    continue;
                }
                if (measure < start || measure > end || !isMeasureContent(child)) {
                    continue;
                }
                if (inScope || BodyScan.touches(child, ids)) {
                    cursor.add(child.id());
                }
            }
            flush(cursor, cursors);
        });
        return selection.withCursors(cursors);
    }

    private static boolean isMeasureContent(CSNode node) {
        return !node.isToken()
                && !node.is(Tag.COMMENT)
                && !node.is(Tag.INFO_LINE)
                && !node.is(Tag.DIRECTIVE)
                && !node.is(Tag.LYRIC_LINE);
    }

    private static void flush(Set<Integer> cursor, List<Set<Integer>> cursors) {
        if (!cursor.isEmpty()) {
            cursors.add(new LinkedHashSet<>(cursor));
            cursor.clear();
        }
    }
}
