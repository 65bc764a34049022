package io.github.abcls.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.abcls.cstree.TreeWalk;
import java.util.HashSet;
import org.junit.jupiter.api.Test;

class DocumentRegistryTest {
    private static final String URI = "file:///tmp/song.abc";
    private static final String TUNE = "X:1\nK:C\nCDE|\n";

    @Test
    void reparsingIdenticalTextGivesDisjointIds() {
        var documents = new DocumentRegistry();
        documents.open(URI, TUNE);
        var first = TreeWalk.collectAllIds(documents.get(URI).orElseThrow().root());
        documents.update(URI, TUNE);
        var second = TreeWalk.collectAllIds(documents.get(URI).orElseThrow().root());

        var overlap = new HashSet<>(first);
        overlap.retainAll(second);
        assertTrue(overlap.isEmpty(), "ids shared between parses: " + overlap);
        assertEquals(first.size(), second.size());
    }

    @Test
    void documentsShareOneIdSpace() {
        var documents = new DocumentRegistry();
        documents.open(URI, TUNE);
        documents.open("file:///tmp/other.abc", TUNE);
        var ids = new HashSet<>(TreeWalk.collectAllIds(documents.get(URI).orElseThrow().root()));
        ids.retainAll(TreeWalk.collectAllIds(documents.get("file:///tmp/other.abc").orElseThrow().root()));
        assertTrue(ids.isEmpty());
    }

    @Test
    void closeForgetsTheDocument() {
        var documents = new DocumentRegistry();
        documents.open(URI, TUNE);
        documents.close(URI);
        assertFalse(documents.get(URI).isPresent());
        assertEquals(0, documents.size());
    }
}
