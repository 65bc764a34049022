package io.github.abcls.transforms;

import io.github.abcls.cstree.CSNode;
import io.github.abcls.cstree.Tag;
import io.github.abcls.cstree.TreeUtils;
import io.github.abcls.parser.AbcContext;
import io.github.abcls.parser.TT;
import io.github.abcls.selection.Selection;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Adds a parallel voice a fixed number of diatonic steps away: a third is 2 steps, a fifth 4, negative steps go
 * down. The harmony note keeps the original note's accidental, so the result follows the written letters rather than
 * the key.
 */
public final class Harmonize {
    private static final Logger logger = LogManager.getLogger(Harmonize.class);

    private static final String LETTERS = "CDEFGAB";
    private static final int LOWEST_OCTAVE = 0;
    private static final int HIGHEST_OCTAVE = 9;

    private Harmonize() {
        // utility
    }

    /**
     * A bare note in scope becomes a two-note chord that takes over the note's rhythm, tie and identity. A chord in
     * scope gets one harmony note per note, placed after its last note. A note selected inside a chord gets its
     * harmony right after it. Grace notes are left alone.
     */
    public static Selection harmonize(Selection selection, AbcContext ctx, int steps) {
        if (steps == 0) {
            return selection;
        }
        int skipped = 0;
        for (var node : TransformTargets.soundingElements(selection)) {
            boolean done;
            if (node.is(Tag.CHORD)) {
                done = harmonizeChord(node, ctx, steps);
            } else {
                var parent = TreeUtils.findParent(selection.root(), node);
                if (parent != null && parent.is(Tag.GRACE_GROUP)) {
                    continue;
                }
                done = parent != null && parent.is(Tag.CHORD)
                        ? harmonizeChordNote(node, ctx, steps)
                        : wrapInChord(node, ctx, steps);
            }
            if (!done) {
                skipped++;
            }
        }
        if (skipped > 0) {
            logger.debug("harmonize({}) left {} element(s) whose harmony falls out of range", steps, skipped);
        }
        return selection;
    }

    private static boolean wrapInChord(CSNode note, AbcContext ctx, int steps) {
        var pitch = TreeUtils.findChildByTag(note, Tag.PITCH);
        if (pitch == null) {
            return true;
        }
        var harmony = step(pitch.node(), ctx, steps);
        if (harmony == null) {
            return false;
        }
        var rhythm = TreeUtils.findRhythmChild(note);
        var tie = TreeUtils.findTieChild(note);

        var children = new ArrayList<CSNode>();
        children.add(CSNode.token(ctx, TT.CHRD_LEFT_BRKT, "["));
        children.add(CSNode.interior(ctx, Tag.NOTE, List.of(pitch.node())));
        children.add(CSNode.interior(ctx, Tag.NOTE, List.of(harmony)));
        children.add(CSNode.token(ctx, TT.CHRD_RIGHT_BRKT, "]"));
        if (rhythm != null) {
            children.add(rhythm.node());
        }
        if (tie != null) {
            children.add(tie.node());
        }
        note.retag(Tag.CHORD);
        note.linkChildren(children);
        return true;
    }

    private static boolean harmonizeChord(CSNode chord, AbcContext ctx, int steps) {
        var harmonies = new ArrayList<CSNode>();
        CSNode lastNote = null;
        for (var child = chord.firstChild(); child != null; child = child.nextSibling()) {
            if (!child.is(Tag.NOTE)) {
                continue;
            }
            lastNote = child;
            var harmony = harmonyNote(child, ctx, steps);
            if (harmony == null) {
                return false;
            }
            harmonies.add(harmony);
        }
        if (lastNote == null) {
            return true;
        }
        var anchor = lastNote;
        for (var harmony : harmonies) {
            TreeUtils.insertAfter(anchor, harmony);
            anchor = harmony;
        }
        return true;
    }

    private static boolean harmonizeChordNote(CSNode note, AbcContext ctx, int steps) {
        var harmony = harmonyNote(note, ctx, steps);
        if (harmony == null) {
            return false;
        }
        TreeUtils.insertAfter(note, harmony);
        return true;
    }

    /** A note at the stepped pitch carrying a copy of the source note's own rhythm. */
    private static @Nullable CSNode harmonyNote(CSNode note, AbcContext ctx, int steps) {
        var pitch = TreeUtils.findChildByTag(note, Tag.PITCH);
        if (pitch == null) {
            return null;
        }
        var harmony = step(pitch.node(), ctx, steps);
        if (harmony == null) {
            return null;
        }
        var children = new ArrayList<CSNode>();
        children.add(harmony);
        var rhythm = TreeUtils.findRhythmChild(note);
        if (rhythm != null) {
            children.add(TreeUtils.copy(rhythm.node(), ctx));
        }
        return CSNode.interior(ctx, Tag.NOTE, children);
    }

    /**
     * The pitch {@code steps} letters away. Uppercase letters sit in octave 4, lowercase in octave 5, and each
     * {@code '} or {@code ,} moves one octave. Returns {@code null} when the result leaves the writable range.
     */
    static @Nullable CSNode step(CSNode pitch, AbcContext ctx, int steps) {
        var letter = TreeUtils.findChildByTokenType(pitch, TT.NOTE_LETTER);
        if (letter == null) {
            return null;
        }
        char written = letter.node().tokenData().lexeme().charAt(0);
        int index = LETTERS.indexOf(Character.toUpperCase(written));
        long octave = Character.isLowerCase(written) ? 5 : 4;
        var octaveMarks = TreeUtils.findChildByTokenType(pitch, TT.OCTAVE);
        if (octaveMarks != null) {
            for (char c : octaveMarks.node().tokenData().lexeme().toCharArray()) {
                octave += c == '\'' ? 1 : c == ',' ? -1 : 0;
            }
        }
        long shifted = (long) index + steps;
        long newOctave = octave + Math.floorDiv(shifted, 7L);
        if (newOctave < LOWEST_OCTAVE || newOctave > HIGHEST_OCTAVE) {
            return null;
        }
        char newLetter = LETTERS.charAt((int) Math.floorMod(shifted, 7L));

        var children = new ArrayList<CSNode>();
        var accidental = TreeUtils.findChildByTokenType(pitch, TT.ACCIDENTAL);
        if (accidental != null) {
            children.add(TreeUtils.copy(accidental.node(), ctx));
        }
        if (newOctave >= 5) {
            children.add(CSNode.token(ctx, TT.NOTE_LETTER, String.valueOf(Character.toLowerCase(newLetter))));
            if (newOctave > 5) {
                children.add(CSNode.token(ctx, TT.OCTAVE, "'".repeat((int) newOctave - 5)));
            }
        } else {
            children.add(CSNode.token(ctx, TT.NOTE_LETTER, String.valueOf(newLetter)));
            if (newOctave < 4) {
                children.add(CSNode.token(ctx, TT.OCTAVE, ",".repeat(4 - (int) newOctave)));
            }
        }
        return CSNode.interior(ctx, Tag.PITCH, children);
    }
}
