package io.github.abcls.cstree;

import io.github.abcls.parser.TT;
import org.jetbrains.annotations.Nullable;

/** Recognizes {@code V:} info lines and {@code [V:...]} inline fields in a tune body. */
public final class VoiceMarkers {
    /** Voice of body content written before any voice marker. */
    public static final String DEFAULT_VOICE = "";

    private VoiceMarkers() {
        // utility
    }

    public static boolean isVoiceMarker(CSNode node) {
        if (!node.is(Tag.INFO_LINE) && !node.is(Tag.INLINE_FIELD)) {
            return false;
        }
        var key = fieldToken(node);
        return key != null && key.tokenData().lexeme().equals("V:");
    }

    /**
     * Voice a marker switches to: the first word of its value. Callers check {@link #isVoiceMarker} first.
     */
    public static String voiceId(CSNode marker) {
        var text = new StringBuilder();
        var key = fieldToken(marker);
        for (var child = key == null ? null : key.nextSibling(); child != null; child = child.nextSibling()) {
            if (child.isTokenOf(TT.INLN_FLD_RGT_BRKT) || child.is(Tag.COMMENT)) {
                break;
            }
            text.append(CsTreeSerializer.serialize(child));
        }
        var trimmed = text.toString().trim();
        if (trimmed.isEmpty()) {
            return DEFAULT_VOICE;
        }
        return trimmed.split("\\s+", 2)[0];
    }

    /** Maps the names a request may use for the default voice onto {@link #DEFAULT_VOICE}. */
    public static String normalize(String voiceId) {
        var trimmed = voiceId.trim();
        return trimmed.equalsIgnoreCase("default") ? DEFAULT_VOICE : trimmed;
    }

    private static @Nullable CSNode fieldToken(CSNode node) {
        for (var child = node.firstChild(); child != null; child = child.nextSibling()) {
            if (child.isTokenOf(TT.INF_HDR)) {
                return child;
            }
        }
        return null;
    }
}
