package io.github.abcls.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.abcls.parser.Expr.Beam;
import io.github.abcls.parser.Expr.Binary;
import io.github.abcls.parser.Expr.Chord;
import io.github.abcls.parser.Expr.FileStructure;
import io.github.abcls.parser.Expr.Grouping;
import io.github.abcls.parser.Expr.InfoLine;
import io.github.abcls.parser.Expr.Kv;
import io.github.abcls.parser.Expr.Note;
import io.github.abcls.parser.Expr.Tune;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

class AbcParserTest {

    static Stream<String> sources() {
        return Stream.of(
                "",
                "X:1\nK:C\nCDE|\n",
                "X:1\nT:Test\nM:4/4\nL:1/8\nK:G\n|:GABc d2e2|[1 f4 z4:|[2 g8|]\n",
                "X:1\nK:C\n[CEG]2 C2 D2|\n",
                "X:1\nK:C\n{/g}A2 (3ABc !trill!d2 \"Am\"e2 \"^above\"f|\n",
                "X:1\nM:(2+3)/8\nV:T1 name=\"Trumpet\" clef=treble middle=c'\nK:C % key\n[V:T1] C>D E<F|\nw: la la\n",
                "%abc-2.1\n%%scale 0.8\n\nX:1\nK:C\nC\n\nX:2\nK:G\nG\n",
                "X:1\nK:C\r\nC D E|\r\n",
                "X:1\nK:C\nC#D?E|\n",
                "X:1\nK:C\n[CE\n",
                "X:1\nK:C\nZ4 | x2 y z// ^^C __D =E C,, c'' & \\\n$ A-|\n",
                "some free text\n\nmore\n");
    }

    @ParameterizedTest
    @MethodSource("sources")
    void parseIsLossless(String source) {
        var ast = AbcParser.parse(source, new AbcContext());
        assertEquals(source, AbcFormatter.stringify(ast));
    }

    @Test
    void headerEndsAtKeyLine() {
        var ast = AbcParser.parse("X:1\nT:Test\nK:C\nT:Body title\nCDE|\n", new AbcContext());
        var tune = assertInstanceOf(Tune.class, ast.contents().get(0));
        long infoLines = tune.header().infoLines().stream()
                .filter(n -> n instanceof InfoLine)
                .count();
        assertEquals(3, infoLines);
        assertNotNull(tune.body());
        assertEquals(2, tune.body().sequence().size());
    }

    @Test
    void headerWithoutKeyEndsAtMusic() {
        var ast = AbcParser.parse("X:1\nT:Test\nCDE|\n", new AbcContext());
        var tune = (Tune) ast.contents().get(0);
        assertEquals("X:1\nT:Test\n", AbcFormatter.stringify(tune.header()));
        assertEquals("CDE|\n", AbcFormatter.stringify(tune.body()));
    }

    @Test
    void adjacentNotesFormBeam() {
        var ast = AbcParser.parse("X:1\nK:C\nCDE F|\n", new AbcContext());
        var body = ((Tune) ast.contents().get(0)).body();
        var firstLine = body.sequence().get(0);
        var beam = assertInstanceOf(Beam.class, firstLine.get(0));
        assertEquals(3, beam.contents().size());
        assertInstanceOf(Note.class, firstLine.get(2));
    }

    @Test
    void chordKeepsSourceOrderAndRhythm() {
        var ast = AbcParser.parse("X:1\nK:C\n[GEC]2-\n", new AbcContext());
        var chord = (Chord) ((Tune) ast.contents().get(0)).body().sequence().get(0).get(0);
        assertEquals(3, chord.contents().size());
        assertEquals("G", ((Note) chord.contents().get(0)).pitch().noteLetter().lexeme());
        assertNotNull(chord.rhythm());
        assertEquals("2", chord.rhythm().numerator().lexeme());
        assertNotNull(chord.tie());
    }

    @Test
    void unterminatedChordHasNoRightBracket() {
        var ast = AbcParser.parse("X:1\nK:C\n[CE\n", new AbcContext());
        var chord = (Chord) ((Tune) ast.contents().get(0)).body().sequence().get(0).get(0);
        assertNull(chord.rightBracket());
    }

    @Test
    void infoValuesFoldIntoExpressions() {
        var ast = AbcParser.parse("X:1\nM:(2+3)/8\nV:T1 clef=treble\nK:C\n", new AbcContext());
        var header = ((Tune) ast.contents().get(0)).header();
        var meter = (InfoLine) header.infoLines().get(2);
        var binary = assertInstanceOf(Binary.class, meter.value().get(0));
        var grouping = assertInstanceOf(Grouping.class, binary.left());
        assertInstanceOf(Binary.class, grouping.expression());

        var voice = (InfoLine) header.infoLines().get(4);
        assertTrue(voice.value().stream().anyMatch(n -> n instanceof Kv));
    }

    @Test
    void tokenPositionsAreZeroBased() {
        FileStructure ast = AbcParser.parse("X:1\nK:C\nC D|\n", new AbcContext());
        var body = ((Tune) ast.contents().get(0)).body();
        var d = (Note) body.sequence().get(0).get(2);
        assertEquals(2, d.pitch().noteLetter().line());
        assertEquals(2, d.pitch().noteLetter().position());
    }

    @Test
    void blankLineSeparatesTunes() {
        var ast = AbcParser.parse("X:1\nK:C\nC\n\nX:2\nK:G\nG\n", new AbcContext());
        assertEquals(3, ast.contents().size());
        var sectionBreak = assertInstanceOf(Token.class, ast.contents().get(1));
        assertEquals(TT.SCT_BRK, sectionBreak.type());
    }
}
