package io.github.abcls.selection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.abcls.cstree.CSNode;
import io.github.abcls.cstree.ParsedTree;
import io.github.abcls.cstree.Tag;
import io.github.abcls.cstree.TreeWalk;
import io.github.abcls.parser.AbcContext;
import io.github.abcls.parser.TT;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SpansTest {

    @Test
    void spanEndingInNewlineEndsAtNextLine() {
        var root = ParsedTree.parse("X:1\nK:C\nCDE|\n").root();
        var body = TreeWalk.findFirstByTag(root, Tag.TUNE_BODY);
        assertEquals(new SourceRange(2, 0, 3, 0), Spans.spanOf(body));
    }

    @Test
    void syntheticNodesHaveNoSpan() {
        var ctx = new AbcContext();
        assertNull(Spans.spanOf(CSNode.token(ctx, TT.NOTE_LETTER, "C")));
    }

    @Test
    void cursorRangeCoversAllItsNodes() {
        var root = ParsedTree.parse("X:1\nK:C\nC D E|\n").root();
        var notes = TreeWalk.findByTag(root, Tag.NOTE);
        var cursor = Set.of(notes.get(2).id(), notes.get(0).id());
        var ranges = Spans.resolve(new Selection(root, List.of(cursor)));
        assertEquals(List.of(new SourceRange(2, 0, 2, 5)), ranges);
    }

    @Test
    void scopeIncludesDescendantsOfCursorNodes() {
        var root = ParsedTree.parse("X:1\nK:C\n[CE] G|\n").root();
        var chord = TreeWalk.findFirstByTag(root, Tag.CHORD);
        var inScope = new ArrayList<Integer>();
        ScopedWalk.walk(root, Set.of(chord.id()), (node, scoped, enclosing) -> {
            if (scoped && node.is(Tag.NOTE)) {
                inScope.add(node.id());
            }
            return true;
        });
        assertEquals(2, inScope.size());
        assertTrue(Selection.of(root).retainIds(Set.of()).isEmpty());
    }
}
