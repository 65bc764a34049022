package io.github.abcls.transforms;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Optional properties written after the voice id of a {@code V:} line. */
public record VoiceParams(@Nullable String name, @Nullable String clef, @Nullable Integer transpose) {
    public static final VoiceParams NONE = new VoiceParams(null, null, null);

    /** @throws IllegalArgumentException when a value could not be written into one {@code V:} line */
    public VoiceParams {
        if (name != null && (name.indexOf('"') >= 0 || hasLineBreak(name))) {
            throw new IllegalArgumentException("Voice name must not contain quotes or line breaks: " + name);
        }
        if (clef != null && (clef.isBlank() || clef.chars().anyMatch(Character::isWhitespace))) {
            throw new IllegalArgumentException("Voice clef must be a single word, got '" + clef + "'");
        }
    }

    private static boolean hasLineBreak(String value) {
        return value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0;
    }

    /**
     * Reads {@code key=value} pairs such as {@code name=Trumpet}, {@code clef=treble}, {@code transpose=-2}.
     *
     * @throws IllegalArgumentException for an unknown key, a pair without {@code =}, a non-numeric transpose or a
     *     value that cannot be written into the line
     */
    public static VoiceParams parse(List<String> pairs) {
        String name = null;
        String clef = null;
        Integer transpose = null;
        for (var pair : pairs) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Expected key=value, got '" + pair + "'");
            }
            var key = pair.substring(0, eq).trim();
            var value = pair.substring(eq + 1).trim();
            switch (key) {
                case "name" -> name = value;
                case "clef" -> clef = value;
                case "transpose" -> {
                    try {
                        transpose = Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("transpose must be an integer, got '" + value + "'", e);
                    }
                }
                default -> throw new IllegalArgumentException("Unknown voice property '" + key + "'");
            }
        }
        return new VoiceParams(name, clef, transpose);
    }

    /** The value text of the {@code V:} line for {@code voiceId}, e.g. {@code T1 name="Trumpet" clef=treble}. */
    public String render(String voiceId) {
        var sb = new StringBuilder(voiceId);
        if (name != null) {
            sb.append(" name=\"").append(name).append('"');
        }
        if (clef != null) {
            sb.append(" clef=").append(clef);
        }
        if (transpose != null) {
            sb.append(" transpose=").append(transpose);
        }
        return sb.toString();
    }
}
