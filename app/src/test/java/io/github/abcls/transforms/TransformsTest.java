package io.github.abcls.transforms;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.abcls.cstree.CsTreeSerializer;
import io.github.abcls.cstree.ParsedTree;
import io.github.abcls.parser.AbcContext;
import io.github.abcls.selection.Selection;
import io.github.abcls.selectors.TypeSelectors;
import java.util.List;
import java.util.function.BiFunction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TransformsTest {

    /** Parses {@code body} as a one-line tune, applies {@code transform} to the whole file and returns the body. */
    private static String applyToBody(String body, BiFunction<Selection, AbcContext, Selection> transform) {
        var tree = ParsedTree.parse("X:1\nK:C\n" + body + "\n");
        var result = transform.apply(Selection.of(tree.root()), tree.ctx());
        var text = CsTreeSerializer.serialize(result.root());
        return text.substring("X:1\nK:C\n".length(), text.length() - 1);
    }

    @Test
    void transposeRespellsWithSharps() {
        assertEquals("DE^F|", applyToBody("CDE|", (sel, ctx) -> PitchTransforms.transpose(sel, ctx, 2)));
    }

    @Test
    void transposeKeepsRhythmAndTie() {
        assertEquals("D2- ^F/|", applyToBody("C2- E/|", (sel, ctx) -> PitchTransforms.transpose(sel, ctx, 2)));
    }

    @Test
    void transposeThenInverseRestoresPitches() {
        var tree = ParsedTree.parse("X:1\nK:C\n^C,D [EGc]2 b'|\n");
        var sel = Selection.of(tree.root());
        var before = Queries.pitch(TypeSelectors.selectNotes(sel));
        PitchTransforms.transpose(sel, tree.ctx(), 5);
        PitchTransforms.transpose(sel, tree.ctx(), -5);
        assertEquals(before, Queries.pitch(TypeSelectors.selectNotes(sel)));
    }

    @Test
    void transposeByZeroLeavesTextAlone() {
        assertEquals("_B,2c|", applyToBody("_B,2c|", (sel, ctx) -> PitchTransforms.transpose(sel, ctx, 0)));
    }

    @Test
    void octaveMovesByTwelve() {
        assertEquals("c' c|", applyToBody("c C|", (sel, ctx) -> PitchTransforms.octave(sel, ctx, 1)));
        assertEquals("C,|", applyToBody("C|", (sel, ctx) -> PitchTransforms.octave(sel, ctx, -1)));
    }

    @Test
    void transposeOnlyTouchesNotesInScope() {
        var tree = ParsedTree.parse("X:1\nK:C\nC D E|\n");
        var sel = TypeSelectors.selectNotes(Selection.of(tree.root()));
        var middle = sel.withCursors(List.of(sel.cursors().get(1)));
        PitchTransforms.transpose(middle, tree.ctx(), 1);
        assertEquals("X:1\nK:C\nC ^D E|\n", CsTreeSerializer.serialize(tree.root()));
    }

    @Test
    void enharmonizeSwapsAccidentalAndKeepsPitch() {
        assertEquals("_D _E ^F C|", applyToBody("^C ^D _G C|", PitchTransforms::enharmonize));

        var tree = ParsedTree.parse("X:1\nK:C\n^C [^F_B]|\n");
        var sel = Selection.of(tree.root());
        var before = Queries.pitch(TypeSelectors.selectNotes(sel));
        PitchTransforms.enharmonize(sel, tree.ctx());
        assertEquals(before, Queries.pitch(TypeSelectors.selectNotes(sel)));
    }

    @Test
    void enharmonizeDoubleAccidentals() {
        assertEquals("D _G|", applyToBody("^^C ^^E|", PitchTransforms::enharmonize));
    }

    @Test
    void enharmonizeKeepsRhythmAndTie() {
        assertEquals("_D2-|", applyToBody("^C2-|", PitchTransforms::enharmonize));
    }

    @ParameterizedTest
    @CsvSource({
        "a, a2",
        "a/, a",
        "a//, a/",
        "a///, a/4",
        "[CEG]/, [CEG]",
        "z/, z",
        "a3/2, a3",
    })
    void multiplyRhythmDoubles(String before, String after) {
        var result = applyToBody(before + "|", (sel, ctx) -> RhythmTransforms.multiplyRhythm(sel, ctx, 2));
        assertEquals(after + "|", result);
    }

    @ParameterizedTest
    @CsvSource({
        "a, a/",
        "a/, a/4",
        "a//, a/8",
        "a2, a",
        "^a''3, ^a''3/2",
    })
    void divideRhythmHalves(String before, String after) {
        var result = applyToBody(before + "|", (sel, ctx) -> RhythmTransforms.divideRhythm(sel, ctx, 2));
        assertEquals(after + "|", result);
    }

    @Test
    void setAndAddRhythm() {
        var half = Rational.of(1, 2);
        assertEquals("C/ D/|", applyToBody("C D2|", (sel, ctx) -> RhythmTransforms.setRhythm(sel, ctx, half)));
        assertEquals("C3/2 D5/2|", applyToBody("C D2|", (sel, ctx) -> RhythmTransforms.addToRhythm(sel, ctx, half)));
        assertEquals("C D|", applyToBody("C D|", (sel, ctx) -> RhythmTransforms.setRhythm(sel, ctx, Rational.ONE)));
    }

    @Test
    void nonPositiveDurationsClampToOne() {
        assertEquals("C|", applyToBody("C2|", (sel, ctx) -> RhythmTransforms.addToRhythm(sel, ctx, Rational.of(-3))));
    }

    @Test
    void rhythmFactorMustBePositive() {
        var tree = ParsedTree.parse("X:1\nK:C\nC|\n");
        var sel = Selection.of(tree.root());
        assertThrows(IllegalArgumentException.class, () -> RhythmTransforms.multiplyRhythm(sel, tree.ctx(), 0));
        assertThrows(IllegalArgumentException.class, () -> RhythmTransforms.divideRhythm(sel, tree.ctx(), -2));
    }

    @Test
    void toRestKeepsDuration() {
        assertEquals("z2 z z/|", applyToBody("[CE]2 C- D/|", StructuralTransforms::toRest));
        assertEquals("z2|", applyToBody("[C2E2]|", StructuralTransforms::toRest));
    }

    @Test
    void graceNotesStayNotesUnderWholeTuneTransforms() {
        assertEquals("{g}z2|", applyToBody("{g}A2|", StructuralTransforms::toRest));
        assertEquals("{g}A2|", applyToBody("{g}A|", (sel, ctx) -> RhythmTransforms.multiplyRhythm(sel, ctx, 2)));
        assertEquals(
                List.of(Rational.of(2)),
                Queries.sumRhythm(Selection.of(ParsedTree.parse("X:1\nK:C\n{gf}A2|\n").root())));
    }

    @Test
    void graceNotesChangeWhenSelectedDirectly() {
        var tree = ParsedTree.parse("X:1\nK:C\n{g}A|\n");
        var notes = TypeSelectors.selectNotes(Selection.of(tree.root()));
        var grace = notes.withCursors(List.of(notes.cursors().get(0)));
        RhythmTransforms.multiplyRhythm(grace, tree.ctx(), 2);
        assertEquals("X:1\nK:C\n{g2}A|\n", CsTreeSerializer.serialize(tree.root()));
    }

    @Test
    void unwrapSingleNoteChords() {
        assertEquals("C2 [CE]|", applyToBody("[C]2 [CE]|", StructuralTransforms::unwrapSingle));
        assertEquals("C2|", applyToBody("[C2]|", StructuralTransforms::unwrapSingle));
    }

    @Test
    void removeDetachesSelectedNodes() {
        var tree = ParsedTree.parse("X:1\nK:C\nC D E|\n");
        var notes = TypeSelectors.selectNotes(Selection.of(tree.root()));
        var second = notes.withCursors(List.of(notes.cursors().get(1)));
        var after = StructuralTransforms.remove(second);
        assertEquals("X:1\nK:C\nC  E|\n", CsTreeSerializer.serialize(tree.root()));
        assertTrue(after.isEmpty());
    }

    @Test
    void removeNeverDetachesRoot() {
        var tree = ParsedTree.parse("X:1\nK:C\nC|\n");
        var after = StructuralTransforms.remove(Selection.of(tree.root()));
        assertEquals("X:1\nK:C\nC|\n", CsTreeSerializer.serialize(tree.root()));
        assertEquals(1, after.cursors().size());
    }

    @Test
    void addVoiceGoesBeforeKeyLine() {
        var tree = ParsedTree.parse("X:1\nT:Song\nK:C\nC|\n");
        var params = VoiceParams.parse(List.of("name=Trumpet", "clef=treble"));
        AddVoice.addVoice(Selection.of(tree.root()), tree.ctx(), "T1", params);
        assertEquals(
                "X:1\nT:Song\nV:T1 name=\"Trumpet\" clef=treble\nK:C\nC|\n",
                CsTreeSerializer.serialize(tree.root()));
    }

    @Test
    void bareVoiceIdWithoutProperties() {
        var tree = ParsedTree.parse("X:1\nK:C\nCDE|\n");
        AddVoice.addVoice(Selection.of(tree.root()), tree.ctx(), "T1", VoiceParams.NONE);
        assertEquals("X:1\nV:T1\nK:C\nCDE|\n", CsTreeSerializer.serialize(tree.root()));
    }

    @Test
    void consecutiveVoicesKeepTheirOrder() {
        var tree = ParsedTree.parse("X:1\nK:C\n");
        AddVoice.addVoice(Selection.of(tree.root()), tree.ctx(), "V1", VoiceParams.NONE);
        AddVoice.addVoice(Selection.of(tree.root()), tree.ctx(), "V2", VoiceParams.NONE);
        assertEquals("X:1\nV:V1\nV:V2\nK:C\n", CsTreeSerializer.serialize(tree.root()));
    }

    @Test
    void voiceGoesAfterHeaderWithoutKeyLine() {
        var tree = ParsedTree.parse("X:1\nT:Test\nCDE|\n");
        AddVoice.addVoice(Selection.of(tree.root()), tree.ctx(), "V1", VoiceParams.NONE);
        assertEquals("X:1\nT:Test\nV:V1\nCDE|\n", CsTreeSerializer.serialize(tree.root()));
    }

    @Test
    void addVoiceReachesTuneFromNoteInside() {
        var tree = ParsedTree.parse("X:1\nK:C\nC|\n\nX:2\nK:G\nG|\n");
        var notes = TypeSelectors.selectNotes(Selection.of(tree.root()));
        var secondTune = notes.withCursors(List.of(notes.cursors().get(1)));
        AddVoice.addVoice(secondTune, tree.ctx(), "B", new VoiceParams(null, null, -2));
        assertEquals("X:1\nK:C\nC|\n\nX:2\nV:B transpose=-2\nK:G\nG|\n", CsTreeSerializer.serialize(tree.root()));
    }

    @Test
    void addVoiceRejectsBadArguments() {
        var tree = ParsedTree.parse("X:1\nK:C\nC|\n");
        var sel = Selection.of(tree.root());
        assertThrows(IllegalArgumentException.class, () -> AddVoice.addVoice(sel, tree.ctx(), " ", VoiceParams.NONE));
        assertThrows(IllegalArgumentException.class, () -> VoiceParams.parse(List.of("colour=red")));
        assertThrows(IllegalArgumentException.class, () -> VoiceParams.parse(List.of("transpose=up")));
        assertThrows(IllegalArgumentException.class, () -> VoiceParams.parse(List.of("treble")));
        assertThrows(IllegalArgumentException.class, () -> VoiceParams.parse(List.of("name=Big \"Horn\"")));
        assertThrows(IllegalArgumentException.class, () -> new VoiceParams("Horn\nK:D", null, null));
        assertThrows(IllegalArgumentException.class, () -> VoiceParams.parse(List.of("clef=treble 8")));
    }

    @Test
    void sumRhythmPerCursor() {
        var tree = ParsedTree.parse("X:1\nK:C\nC2 D/ z [CE]3/2|\n");
        var sel = Selection.of(tree.root());
        assertEquals(List.of(Rational.of(5)), Queries.sumRhythm(sel));
        var notes = TypeSelectors.selectNonChordNotes(sel);
        assertEquals(List.of(Rational.of(2), Rational.of(1, 2)), Queries.sumRhythm(notes));
    }

    @Test
    void pitchReportsTopOfChord() {
        var tree = ParsedTree.parse("X:1\nK:C\nC [EG] z c|\n");
        assertEquals(List.of(60, 67, 72), Queries.pitch(Selection.of(tree.root())));
    }

    @ParameterizedTest
    @CsvSource({
        "C2- E|, 2, [CE]2- [EG]|",
        "^F|, 2, [^F^A]|",
        "[CE]2|, 2, [CEEG]2|",
        "{g}A|, 2, {g}[Ac]|"
    })
    void harmonizeAddsDiatonicVoice(String before, int steps, String after) {
        assertEquals(after, applyToBody(before, (sel, ctx) -> Harmonize.harmonize(sel, ctx, steps)));
    }

    @Test
    void harmonizeFollowsOctaveMarks() {
        assertEquals("[bd'] [c'e']|", applyToBody("b c'|", (sel, ctx) -> Harmonize.harmonize(sel, ctx, 2)));
        assertEquals("[CA,]|", applyToBody("C|", (sel, ctx) -> Harmonize.harmonize(sel, ctx, -2)));
    }

    @Test
    void harmonizeByZeroIsANoOp() {
        assertEquals("CDE|", applyToBody("CDE|", (sel, ctx) -> Harmonize.harmonize(sel, ctx, 0)));
    }

    @Test
    void harmonizeSelectedChordNote() {
        var tree = ParsedTree.parse("X:1\nK:C\n[CE]|\n");
        var notes = TypeSelectors.selectNotes(Selection.of(tree.root()));
        Harmonize.harmonize(notes.withCursors(List.of(notes.cursors().get(0))), tree.ctx(), 4);
        assertEquals("X:1\nK:C\n[CGE]|\n", CsTreeSerializer.serialize(tree.root()));
    }

    @Test
    void harmonyOutOfRangeIsSkipped() {
        assertEquals("c|", applyToBody("c|", (sel, ctx) -> Harmonize.harmonize(sel, ctx, 70)));
    }

    @ParameterizedTest
    @CsvSource({
        "z z z z|, z4|",
        "z/ z/|, z|",
        "z2 z2|, z4|",
        "z z z|, z2 z|",
        "x x|, x2|",
        "z x|, z x|",
        "z z2|, z z2|",
        "z3 z3|, z3 z3|",
        "z|z|, z|z|"
    })
    void consolidateRestsMergesEqualNeighbours(String before, String after) {
        assertEquals(after, applyToBody(before, RestTransforms::consolidateRests));
    }

    @Test
    void consolidateRestsIsIdempotent() {
        var once = applyToBody("z/ z/ z/ z/ z z|", RestTransforms::consolidateRests);
        assertEquals("z4|", once);
        assertEquals(once, applyToBody(once, RestTransforms::consolidateRests));
    }

    @Test
    void consolidateRestsStaysInScope() {
        var tree = ParsedTree.parse("X:1\nK:C\nz z z z|\n");
        var rests = TypeSelectors.selectRests(Selection.of(tree.root()));
        var firstTwo = rests.withCursors(List.of(rests.cursors().get(0), rests.cursors().get(1)));
        var result = RestTransforms.consolidateRests(firstTwo, tree.ctx());
        assertEquals("X:1\nK:C\nz2 z z|\n", CsTreeSerializer.serialize(tree.root()));
        assertEquals(1, result.cursors().size());
    }

    @ParameterizedTest
    @CsvSource({
        "C z z z|, C4|",
        "C2 z2 D z|, C4 D2|",
        "[CE] z|, [CE]2|",
        "C y|, C2|",
        "C|z|, C-|C|",
        "C- z|, C2|",
        "C Z2|, C Z2|",
        "z C|, z C|"
    })
    void legatoFillsRestsWithTiedCopies(String before, String after) {
        assertEquals(after, applyToBody(before, RestTransforms::legato));
    }

    @Test
    void voiceMarkerBreaksLegatoChain() {
        assertEquals("C2 [V:2] z|", applyToBody("C z [V:2] z|", RestTransforms::legato));
    }

    @Test
    void legatoLeavesTiesWithoutFilledRests() {
        assertEquals("C-C|", applyToBody("C-C|", RestTransforms::legato));
    }
}
