package io.github.abcls.transforms;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.abcls.cstree.CsTreeSerializer;
import io.github.abcls.cstree.ParsedTree;
import io.github.abcls.cstree.Tag;
import io.github.abcls.cstree.TreeWalk;
import io.github.abcls.parser.AbcContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RationalTest {

    @Test
    void alwaysReducedWithPositiveDenominator() {
        assertEquals(new Rational(1, 2), Rational.of(2, 4));
        assertEquals(new Rational(-3, 4), Rational.of(3, -4));
        assertEquals("3/4", Rational.of(6, 8).toString());
        assertEquals("2", Rational.of(4, 2).toString());
        assertThrows(IllegalArgumentException.class, () -> Rational.of(1, 0));
    }

    @Test
    void arithmetic() {
        assertEquals(Rational.of(5, 6), Rational.of(1, 2).add(Rational.of(1, 3)));
        assertEquals(Rational.of(3, 8), Rational.of(3, 4).multiply(Rational.of(1, 2)));
        assertEquals(Rational.of(3, 2), Rational.of(3, 4).divide(Rational.of(1, 2)));
        assertThrows(ArithmeticException.class, () -> Rational.ONE.divide(Rational.ZERO));
        assertTrue(Rational.of(1, 3).compareTo(Rational.of(1, 2)) < 0);
    }

    @Test
    void parseAcceptsFractionsAndIntegers() {
        assertEquals(Rational.of(3, 4), Rational.parse("3/4"));
        assertEquals(Rational.of(2), Rational.parse(" 2 "));
        assertEquals(Rational.of(-1, 2), Rational.parse("-1/2"));
        assertThrows(IllegalArgumentException.class, () -> Rational.parse("half"));
        assertThrows(IllegalArgumentException.class, () -> Rational.parse("1/0"));
    }

    @ParameterizedTest
    @CsvSource({"C2, 2", "C/, 1/2", "C//, 1/4", "C3/4, 3/4", "C/4, 1/4", "C3//, 3/4", "C, 1"})
    void rhythmText(String note, String expected) {
        var root = ParsedTree.parse("X:1\nK:C\n" + note + "|\n").root();
        var node = TreeWalk.findFirstByTag(root, Tag.NOTE);
        assertEquals(Rational.parse(expected), Rhythms.getNodeRhythm(node));
    }

    @ParameterizedTest
    @CsvSource({"C99999999999", "C1/99999999999", "C////////////////////////////////"})
    void oversizedRhythmIsRejected(String note) {
        var root = ParsedTree.parse("X:1\nK:C\n" + note + "|\n").root();
        var node = TreeWalk.findFirstByTag(root, Tag.NOTE);
        var e = assertThrows(IllegalArgumentException.class, () -> Rhythms.getNodeRhythm(node));
        assertTrue(e.getMessage().contains("out of range"), e.getMessage());
    }

    @Test
    void unitRhythmHasNoText() {
        assertNull(Rhythms.rationalToRhythm(Rational.ONE, null, new AbcContext()));
        assertNull(Rhythms.rationalToRhythm(Rational.ZERO, null, new AbcContext()));
    }

    @Test
    void renderingUsesShortHalf() {
        var ctx = new AbcContext();
        assertEquals("/", CsTreeSerializer.serialize(Rhythms.rationalToRhythm(Rational.of(1, 2), null, ctx)));
        assertEquals("3/2", CsTreeSerializer.serialize(Rhythms.rationalToRhythm(Rational.of(3, 2), null, ctx)));
        assertEquals("/8", CsTreeSerializer.serialize(Rhythms.rationalToRhythm(Rational.of(1, 8), null, ctx)));
        assertEquals("4", CsTreeSerializer.serialize(Rhythms.rationalToRhythm(Rational.of(4), null, ctx)));
    }

    @Test
    void brokenMarkerSurvivesRewrite() {
        var tree = ParsedTree.parse("X:1\nK:C\nC>D|\n");
        var note = TreeWalk.findFirstByTag(tree.root(), Tag.NOTE);
        Rhythms.setNodeRhythm(note, Rational.of(2), tree.ctx());
        assertEquals("C2>", CsTreeSerializer.serialize(note));
    }
}
