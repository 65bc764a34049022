package io.github.abcls.transforms;

import io.github.abcls.cstree.CSNode;
import io.github.abcls.cstree.FromAst;
import io.github.abcls.cstree.Tag;
import io.github.abcls.cstree.ToAst;
import io.github.abcls.cstree.TreeUtils;
import io.github.abcls.parser.AbcContext;
import io.github.abcls.parser.Expr.Pitch;
import io.github.abcls.parser.Pitches;
import io.github.abcls.parser.TT;
import io.github.abcls.selection.Selection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Transforms that rewrite the pitch of notes in scope. Rhythm and tie children are left as they are. */
public final class PitchTransforms {
    private static final Logger logger = LogManager.getLogger(PitchTransforms.class);

    private static final int MIN_MIDI = 0;
    private static final int MAX_MIDI = 127;

    private PitchTransforms() {
        // utility
    }

    /**
     * Shifts every note in scope by {@code semitones}, respelling it with sharps. Notes whose result would fall
     * outside the MIDI range are left unchanged.
     */
    public static Selection transpose(Selection selection, AbcContext ctx, int semitones) {
        if (semitones == 0) {
            return selection;
        }
        int skipped = 0;
        for (var note : TransformTargets.notes(selection)) {
            var pitch = TreeUtils.findChildByTag(note, Tag.PITCH);
            if (pitch == null) {
                continue;
            }
            int target = midiOf(pitch.node()) + semitones;
            if (target < MIN_MIDI || target > MAX_MIDI) {
                skipped++;
                continue;
            }
            TreeUtils.replaceChild(note, pitch.node(), FromAst.fromAst(Pitches.fromMidiPitch(target, ctx)));
        }
        if (skipped > 0) {
            logger.debug("transpose({}) left {} note(s) outside the MIDI range untouched", semitones, skipped);
        }
        return selection;
    }

    public static Selection octave(Selection selection, AbcContext ctx, int octaves) {
        return transpose(selection, ctx, Math.multiplyExact(octaves, 12));
    }

    /**
     * Swaps sharp and flat spellings at the same MIDI pitch: sharpened notes are respelled with flats and flattened
     * notes with sharps. A double accidental lands on the natural letter when one exists. Naturals and notes without
     * an accidental are not touched.
     */
    public static Selection enharmonize(Selection selection, AbcContext ctx) {
        for (var note : TransformTargets.notes(selection)) {
            var pitch = TreeUtils.findChildByTag(note, Tag.PITCH);
            if (pitch == null) {
                continue;
            }
            var accidental = TreeUtils.findChildByTokenType(pitch.node(), TT.ACCIDENTAL);
            if (accidental == null) {
                continue;
            }
            var lexeme = accidental.node().tokenData().lexeme();
            int midi = midiOf(pitch.node());
            if (midi < MIN_MIDI || midi > MAX_MIDI) {
                continue;
            }
            Pitch respelled;
            if (lexeme.startsWith("^")) {
                respelled = Pitches.fromMidiPitchFlat(midi, ctx);
            } else if (lexeme.startsWith("_")) {
                respelled = Pitches.fromMidiPitch(midi, ctx);
            } else {
                continue;
            }
            TreeUtils.replaceChild(note, pitch.node(), FromAst.fromAst(respelled));
        }
        return selection;
    }

    static int midiOf(CSNode pitch) {
        return Pitches.toMidiPitch((Pitch) ToAst.toAst(pitch));
    }
}
