package io.github.abcls.parser;

import io.github.abcls.parser.Expr.Pitch;
import org.jetbrains.annotations.Nullable;

/**
 * MIDI conversions for {@link Pitch} nodes. Middle C ({@code C}) is 60; each comma lowers and each apostrophe
 * raises by an octave; lowercase letters sit one octave above uppercase.
 */
public final class Pitches {
    private static final String[] SHARP_SPELLING = {"C", "^C", "D", "^D", "E", "F", "^F", "G", "^G", "A", "^A", "B"};
    private static final String[] FLAT_SPELLING = {"C", "_D", "D", "_E", "E", "F", "_G", "G", "_A", "A", "_B", "B"};

    private Pitches() {
        // utility
    }

    public static int toMidiPitch(Pitch pitch) {
        return midi(pitch.alteration(), pitch.noteLetter().lexeme(), pitch.octave());
    }

    static int midi(@Nullable Token alteration, String letter, @Nullable Token octave) {
        char c = letter.charAt(0);
        int value = 60 + letterOffset(Character.toUpperCase(c));
        if (Character.isLowerCase(c)) {
            value += 12;
        }
        if (octave != null) {
            for (char o : octave.lexeme().toCharArray()) {
                value += o == '\'' ? 12 : -12;
            }
        }
        if (alteration != null) {
            value += accidentalOffset(alteration.lexeme());
        }
        return value;
    }

    public static int accidentalOffset(String accidental) {
        return switch (accidental) {
            case "^" -> 1;
            case "^^" -> 2;
            case "_" -> -1;
            case "__" -> -2;
            default -> 0;
        };
    }

    private static int letterOffset(char upper) {
        return switch (upper) {
            case 'C' -> 0;
            case 'D' -> 2;
            case 'E' -> 4;
            case 'F' -> 5;
            case 'G' -> 7;
            case 'A' -> 9;
            case 'B' -> 11;
            default -> throw new IllegalArgumentException("Not a note letter: " + upper);
        };
    }

    /** Builds a pitch for {@code midi} using sharps for black keys. */
    public static Pitch fromMidiPitch(int midi, AbcContext ctx) {
        return spell(midi, SHARP_SPELLING, ctx);
    }

    /** Builds a pitch for {@code midi} using flats for black keys. */
    public static Pitch fromMidiPitchFlat(int midi, AbcContext ctx) {
        return spell(midi, FLAT_SPELLING, ctx);
    }

    private static Pitch spell(int midi, String[] spelling, AbcContext ctx) {
        var name = spelling[Math.floorMod(midi, 12)];
        int octave = Math.floorDiv(midi, 12) - 1;
        String accidental = name.length() > 1 ? name.substring(0, 1) : null;
        String letter = name.substring(name.length() - 1);
        String marks;
        if (octave <= 4) {
            marks = ",".repeat(4 - octave);
        } else {
            letter = letter.toLowerCase();
            marks = "'".repeat(octave - 5);
        }
        return new Pitch(
                ctx.generateId(),
                accidental == null ? null : Token.synthetic(TT.ACCIDENTAL, accidental, ctx),
                Token.synthetic(TT.NOTE_LETTER, letter, ctx),
                marks.isEmpty() ? null : Token.synthetic(TT.OCTAVE, marks, ctx));
    }
}
