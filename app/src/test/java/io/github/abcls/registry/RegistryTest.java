package io.github.abcls.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.abcls.cstree.CsTreeSerializer;
import io.github.abcls.cstree.ParsedTree;
import io.github.abcls.selection.Selection;
import io.github.abcls.transforms.Rational;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RegistryTest {

    @Test
    void everySelectorIsRegistered() {
        assertEquals(22, SelectorRegistry.names().size());
        assertTrue(SelectorRegistry.lookup("selectMeasures").isPresent());
        assertTrue(SelectorRegistry.lookup("selectNthFromTop").isPresent());
        assertTrue(SelectorRegistry.lookup("selectEverything").isEmpty());
    }

    @Test
    void transformNamesInRegistrationOrder() {
        assertEquals(
                List.of(
                        "transpose",
                        "octave",
                        "enharmonize",
                        "harmonize",
                        "setRhythm",
                        "addToRhythm",
                        "multiplyRhythm",
                        "divideRhythm",
                        "toRest",
                        "unwrapSingle",
                        "remove",
                        "consolidateRests",
                        "legato",
                        "addVoice"),
                List.copyOf(TransformRegistry.names()));
    }

    @Test
    void selectorArityIsChecked() {
        var sel = Selection.of(ParsedTree.parse("X:1\nK:C\n[CE]|\n").root());
        var nth = SelectorRegistry.lookup("selectNthFromTop").orElseThrow();
        assertThrows(IllegalArgumentException.class, () -> nth.invoke(sel, List.of()));
        var notes = SelectorRegistry.lookup("selectNotes").orElseThrow();
        assertThrows(IllegalArgumentException.class, () -> notes.invoke(sel, List.of(1)));
        assertEquals(2, notes.invoke(sel, List.of()).cursors().size());
    }

    @Test
    void transformArgumentsAreCoerced() {
        var tree = ParsedTree.parse("X:1\nK:C\nC|\n");
        var transpose = TransformRegistry.lookup("transpose").orElseThrow();
        transpose.invoke(Selection.of(tree.root()), tree.ctx(), List.of(2.0));
        transpose.invoke(Selection.of(tree.root()), tree.ctx(), List.of("1"));
        assertEquals("X:1\nK:C\n^D|\n", CsTreeSerializer.serialize(tree.root()));
    }

    @ParameterizedTest
    @ValueSource(strings = {"up", "1.5"})
    void nonIntegralArgumentsAreRejected(String arg) {
        var tree = ParsedTree.parse("X:1\nK:C\nC|\n");
        var transpose = TransformRegistry.lookup("transpose").orElseThrow();
        assertThrows(
                IllegalArgumentException.class,
                () -> transpose.invoke(Selection.of(tree.root()), tree.ctx(), List.of(arg)));
    }

    @Test
    void rationalArgumentForms() {
        assertEquals(Rational.of(1, 2), Args.rationalArg(List.of(1, 2), "r"));
        assertEquals(Rational.of(3, 4), Args.rationalArg(List.of("3/4"), "r"));
        assertEquals(Rational.of(2), Args.rationalArg(List.of(2.0), "r"));
        assertThrows(IllegalArgumentException.class, () -> Args.rationalArg(List.of(1, 0), "r"));
    }

    @Test
    void addVoiceTakesPropertiesAsPairs() {
        var tree = ParsedTree.parse("X:1\nK:C\nCDE|\n");
        var addVoice = TransformRegistry.lookup("addVoice").orElseThrow();
        addVoice.invoke(Selection.of(tree.root()), tree.ctx(), List.of("T1", "clef=bass"));
        assertEquals("X:1\nV:T1 clef=bass\nK:C\nCDE|\n", CsTreeSerializer.serialize(tree.root()));
        assertThrows(
                IllegalArgumentException.class,
                () -> addVoice.invoke(Selection.of(tree.root()), tree.ctx(), List.of()));
    }

    @Test
    void measureSelectorTakesOptionalRange() {
        var sel = Selection.of(ParsedTree.parse("X:1\nK:C\nC|D|E|\n").root());
        var measures = SelectorRegistry.lookup("selectMeasures").orElseThrow();
        assertEquals(3, measures.invoke(sel, List.of()).cursors().size());
        assertEquals(1, measures.invoke(sel, List.of(2)).cursors().size());
        assertEquals(2, measures.invoke(sel, List.of(2, "3")).cursors().size());
        assertThrows(IllegalArgumentException.class, () -> measures.invoke(sel, List.of(3, 2)));
        assertThrows(IllegalArgumentException.class, () -> measures.invoke(sel, List.of(1, 2, 3)));
    }

    @Test
    void voiceSelectorNeedsAnId() {
        var sel = Selection.of(ParsedTree.parse("X:1\nK:C\nV:1\nC|\n").root());
        var voices = SelectorRegistry.lookup("selectVoices").orElseThrow();
        assertEquals(1, voices.invoke(sel, List.of(1)).cursors().size());
        assertThrows(IllegalArgumentException.class, () -> voices.invoke(sel, List.of()));
    }

    @Test
    void harmonizeTakesSteps() {
        var tree = ParsedTree.parse("X:1\nK:C\nC|\n");
        var harmonize = TransformRegistry.lookup("harmonize").orElseThrow();
        harmonize.invoke(Selection.of(tree.root()), tree.ctx(), List.of("2"));
        assertEquals("X:1\nK:C\n[CE]|\n", CsTreeSerializer.serialize(tree.root()));
        assertThrows(
                IllegalArgumentException.class,
                () -> harmonize.invoke(Selection.of(tree.root()), tree.ctx(), List.of()));
    }
}
