package io.github.abcls.selectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.abcls.TestTunes;
import io.github.abcls.cstree.CsTreeSerializer;
import io.github.abcls.cstree.ParsedTree;
import io.github.abcls.cstree.Tag;
import io.github.abcls.cstree.TreeWalk;
import io.github.abcls.selection.Selection;
import io.github.abcls.selection.SourceRange;
import io.github.abcls.selection.Spans;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

class SelectorsTest {
    private static final String CHORDS = "X:1\nK:C\n[CEG]2 C2 D2|\n";

    private static Selection select(String source) {
        return Selection.of(ParsedTree.parse(source).root());
    }

    private static List<String> texts(Selection selection) {
        var idMap = TreeWalk.buildIdMap(selection.root());
        return selection.cursors().stream()
                .map(cursor -> cursor.stream()
                        .map(id -> CsTreeSerializer.serialize(idMap.get(id)))
                        .reduce("", String::concat))
                .toList();
    }

    static Stream<UnaryOperator<Selection>> typeSelectors() {
        return Stream.of(
                TypeSelectors::selectNotes,
                TypeSelectors::selectChords,
                TypeSelectors::selectRests,
                TypeSelectors::selectChordNotes,
                TypeSelectors::selectNonChordNotes,
                StructuralSelectors::selectTune);
    }

    @ParameterizedTest
    @MethodSource("typeSelectors")
    void typeSelectorsAreIdempotent(UnaryOperator<Selection> selector) {
        TestTunes.corpus().forEach(source -> {
            var once = selector.apply(select(source));
            assertEquals(once.cursors(), selector.apply(once).cursors(), source);
        });
    }

    @ParameterizedTest
    @EnumSource(Delimiter.class)
    void aroundIsIdempotent(Delimiter delimiter) {
        var hits = new int[1];
        TestTunes.corpus().forEach(source -> {
            var whole = select(source);
            var starts = List.of(whole, TypeSelectors.selectNotes(whole), TypeSelectors.selectRests(whole));
            for (var start : starts) {
                var once = DelimiterSelectors.selectAround(start, delimiter);
                var twice = DelimiterSelectors.selectAround(once, delimiter);
                assertEquals(once.cursors(), twice.cursors(), source);
                hits[0] += once.cursors().size();
            }
        });
        assertTrue(hits[0] > 0, "corpus holds no " + delimiter);
    }

    @Test
    void chordAndNonChordNotesPartitionNotes() {
        TestTunes.corpus().forEach(source -> {
            var sel = select(source);
            var all = TypeSelectors.selectNotes(sel).allIds();
            var inChords = TypeSelectors.selectChordNotes(sel).allIds();
            var outside = TypeSelectors.selectNonChordNotes(sel).allIds();

            var overlap = new HashSet<>(inChords);
            overlap.retainAll(outside);
            assertTrue(overlap.isEmpty(), source);
            var union = new HashSet<>(inChords);
            union.addAll(outside);
            assertEquals(all, union, source);
        });
    }

    @Test
    void fanOutYieldsSingletonCursorsInDocumentOrder() {
        var notes = TypeSelectors.selectNotes(select(CHORDS));
        assertEquals(List.of("C", "E", "G", "C2", "D2"), texts(notes));
        assertTrue(notes.cursors().stream().allMatch(c -> c.size() == 1));
        assertEquals(List.of("[CEG]2"), texts(TypeSelectors.selectChords(select(CHORDS))));
        assertEquals(List.of("C2", "D2"), texts(TypeSelectors.selectNonChordNotes(select(CHORDS))));
    }

    @Test
    void notesScopedToChordCursor() {
        var chords = TypeSelectors.selectChords(select(CHORDS));
        assertEquals(1, chords.cursors().size());
        assertEquals(List.of("C", "E", "G"), texts(TypeSelectors.selectNotes(chords)));
    }

    @Test
    void chordNotesAreOrderedBySourcePosition() {
        var chords = TypeSelectors.selectChords(select(CHORDS));
        assertEquals(List.of("G"), texts(ChordSelectors.selectTop(chords)));
        assertEquals(List.of("C"), texts(ChordSelectors.selectBottom(chords)));
        assertEquals(List.of("E"), texts(ChordSelectors.selectNthFromTop(chords, 1)));
        assertEquals(List.of(), texts(ChordSelectors.selectNthFromTop(chords, 3)));
        assertEquals(List.of("C", "E"), texts(ChordSelectors.selectAllButTop(chords)));
        assertEquals(List.of("E", "G"), texts(ChordSelectors.selectAllButBottom(chords)));
    }

    @Test
    void nthFromTopZeroIsTop() {
        TestTunes.corpus().forEach(source -> {
            var chords = TypeSelectors.selectChords(select(source));
            assertEquals(
                    ChordSelectors.selectTop(chords).cursors(),
                    ChordSelectors.selectNthFromTop(chords, 0).cursors(),
                    source);
        });
    }

    @Test
    void topNoteOfChordResolvesToItsColumn() {
        var top = ChordSelectors.selectTop(TypeSelectors.selectChords(select(CHORDS)));
        assertEquals(List.of(new SourceRange(2, 3, 2, 4)), Spans.resolve(top));
    }

    @Test
    void selectTuneFindsEveryTune() {
        var tunes = StructuralSelectors.selectTune(select("X:1\nK:C\nC\n\nX:2\nK:G\nG\n"));
        assertEquals(2, tunes.cursors().size());
        tunes.cursors().forEach(cursor -> {
            var node = TreeWalk.findNodeById(tunes.root(), cursor.iterator().next());
            assertEquals(Tag.TUNE, node.tag());
        });
    }

    @Test
    void insideChordSelectsContentsWithoutBrackets() {
        var inside = DelimiterSelectors.selectInsideChord(select(CHORDS));
        assertEquals(List.of("CEG"), texts(inside));
        var around = DelimiterSelectors.selectAroundChord(select(CHORDS));
        assertEquals(List.of("[CEG]2"), texts(around));
    }

    @Test
    void aroundFromInsideReturnsEnclosingConstruct() {
        var notes = TypeSelectors.selectChordNotes(select(CHORDS));
        var around = DelimiterSelectors.selectAroundChord(notes);
        // one result per input cursor
        assertEquals(List.of("[CEG]2", "[CEG]2", "[CEG]2"), texts(around));
    }

    @Test
    void cursorOutsideEveryConstructSelectsNothing() {
        var plain = TypeSelectors.selectNonChordNotes(select(CHORDS));
        assertTrue(DelimiterSelectors.selectAroundChord(plain).isEmpty());
        assertTrue(DelimiterSelectors.selectInsideGraceGroup(plain).isEmpty());
    }

    @Test
    void groupingInsideInfoLineExpression() {
        var sel = select("X:1\nM:(2+3)/8\nK:C\nC|\n");
        assertEquals(List.of("2+3"), texts(DelimiterSelectors.selectInsideGrouping(sel)));
        assertEquals(List.of("(2+3)"), texts(DelimiterSelectors.selectAroundGrouping(sel)));
    }

    @Test
    void rangeSelectsTopmostNodesInsideHalfOpenRange() {
        var sel = select(CHORDS);
        var inRange = RangeSelector.selectRange(sel, 2, 0, 2, 7);
        assertEquals(List.of(new SourceRange(2, 0, 2, 6)), Spans.resolve(inRange));
        assertEquals(List.of("C", "E", "G"), texts(TypeSelectors.selectNotes(inRange)));
    }

    @Test
    void nodeStartingAtExclusiveEndIsNotSelected() {
        var sel = select(CHORDS);
        // "C2" starts at column 7
        var upToSeven = TypeSelectors.selectNonChordNotes(RangeSelector.selectRange(sel, 2, 0, 2, 7));
        assertTrue(upToSeven.isEmpty());
        var upToNine = TypeSelectors.selectNonChordNotes(RangeSelector.selectRange(sel, 2, 0, 2, 9));
        assertEquals(List.of("C2"), texts(upToNine));
    }

    @Test
    void invertedRangeSelectsNothing() {
        assertTrue(RangeSelector.selectRange(select(CHORDS), 3, 0, 2, 0).isEmpty());
    }

    @Test
    void selectionsAreValues() {
        var sel = select(CHORDS);
        var notes = TypeSelectors.selectNotes(sel);
        assertEquals(List.of(Set.of(sel.root().id())), sel.cursors());
        assertEquals(sel.root(), notes.root());
    }

    @Test
    void selectSystemGivesOneCursorPerMusicLine() {
        var sel = select("X:1\nK:C\nCDE|\nFGA|\n");
        var systems = StructuralSelectors.selectSystem(sel);
        assertEquals(List.of("CDE|", "FGA|"), texts(systems));
        assertEquals(
                List.of(new SourceRange(2, 0, 2, 4), new SourceRange(3, 0, 3, 4)), Spans.resolve(systems));
    }

    @Test
    void systemCarriesInfoLinesBeforeAndLyricsAfter() {
        var sel = select("X:1\nK:C\n%verse\nT:Part\nCDE|\nw:la la\nFGA|\n");
        assertEquals(List.of("T:PartCDE|w:la la", "FGA|"), texts(StructuralSelectors.selectSystem(sel)));
    }

    @Test
    void lineContinuationJoinsSystems() {
        var sel = select("X:1\nK:C\nCD\\\nEF|\n");
        assertEquals(List.of("CD\\EF|"), texts(StructuralSelectors.selectSystem(sel)));
    }

    @Test
    void onlyTouchedSystemsAreSelected() {
        var sel = select("X:1\nK:C\nCDE|\nFGA|\n");
        var notes = TypeSelectors.selectNotes(sel);
        var fromF = sel.withCursors(List.of(notes.cursors().get(3)));
        assertEquals(List.of("FGA|"), texts(StructuralSelectors.selectSystem(fromF)));
    }

    @Test
    void untouchedBodyLeavesSelectionAsItIs() {
        var sel = select("X:1\nK:C\nCDE|\n");
        var header = TreeWalk.findFirstByTag(sel.root(), Tag.TUNE_HEADER);
        var headerOnly = sel.withCursors(List.of(Set.of(header.id())));
        assertSame(headerOnly, StructuralSelectors.selectSystem(headerOnly));
        assertSame(headerOnly, VoiceSelectors.selectVoices(headerOnly, "default"));
    }

    @Test
    void measuresAreCountedFromOneBetweenBarLines() {
        var sel = select("X:1\nK:C\nCD EF|GA|\nBc|\n");
        assertEquals(List.of("CDEF", "GA", "Bc"), texts(StructuralSelectors.selectMeasures(sel)));
        assertEquals(List.of("GA", "Bc"), texts(StructuralSelectors.selectMeasures(sel, 2, 3)));
        assertTrue(StructuralSelectors.selectMeasures(sel, 5, 9).isEmpty());
    }

    @Test
    void measureNumbersRestartInEachTune() {
        var sel = select("X:1\nK:C\nC|D|\n\nX:2\nK:C\nE|F|\n");
        assertEquals(List.of("C", "E"), texts(StructuralSelectors.selectMeasures(sel, 1, 1)));
    }

    @Test
    void measureRangeIsValidated() {
        var sel = select(CHORDS);
        assertThrows(IllegalArgumentException.class, () -> StructuralSelectors.selectMeasures(sel, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> StructuralSelectors.selectMeasures(sel, 1, -1));
        assertThrows(IllegalArgumentException.class, () -> StructuralSelectors.selectMeasures(sel, 3, 2));
    }

    @Test
    void measuresKeepOnlyTouchedElements() {
        var sel = select("X:1\nK:C\nC D E|F|\n");
        var notes = TypeSelectors.selectNotes(sel);
        var someNotes = sel.withCursors(List.of(notes.cursors().get(1), notes.cursors().get(3)));
        assertEquals(List.of("D", "F"), texts(StructuralSelectors.selectMeasures(someNotes)));
    }

    @Test
    void voicePassagesIncludeTheirMarkers() {
        var sel = select("X:1\nK:C\nV:1\nCD|\nV:2\nEF|\nV:1\nGA|\n");
        assertEquals(List.of("V:1CD|", "V:1GA|"), texts(VoiceSelectors.selectVoices(sel, "1")));
        assertEquals(List.of("V:2EF|"), texts(VoiceSelectors.selectVoices(sel, "2")));
    }

    @Test
    void defaultVoiceRunsUntilFirstMarker() {
        var sel = select("X:1\nK:C\nCD|\nV:2\nEF|\n");
        assertEquals(List.of("CD|"), texts(VoiceSelectors.selectVoices(sel, "default")));
        assertEquals(List.of("CD|"), texts(VoiceSelectors.selectVoices(sel, "")));
    }

    @Test
    void inlineFieldSwitchesVoiceButOverlayDoesNot() {
        var inline = select("X:1\nK:C\nCD [V:2] EF|\n");
        assertEquals(List.of("[V:2]EF|"), texts(VoiceSelectors.selectVoices(inline, "2")));
        var overlay = select("X:1\nK:C\nV:1\nCD & EF|\n");
        assertEquals(List.of("V:1CD&EF|"), texts(VoiceSelectors.selectVoices(overlay, "1")));
    }

    @Test
    void voiceIdIsFirstWordOfMarker() {
        var sel = select("X:1\nK:C\nV:T1 clef=bass\nCD|\n");
        assertEquals(1, VoiceSelectors.selectVoices(sel, "T1").cursors().size());
        assertSame(sel, VoiceSelectors.selectVoices(sel, "T2"));
    }

    @Test
    void voicesRestartInEachTune() {
        var sel = select("X:1\nK:C\nV:2\nCD|\n\nX:2\nK:C\nEF|\n");
        assertEquals(List.of("EF|"), texts(VoiceSelectors.selectVoices(sel, "default")));
    }
}
