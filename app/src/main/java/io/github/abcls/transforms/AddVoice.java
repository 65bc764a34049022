package io.github.abcls.transforms;

import io.github.abcls.cstree.CSNode;
import io.github.abcls.cstree.Tag;
import io.github.abcls.cstree.TreeUtils;
import io.github.abcls.parser.AbcContext;
import io.github.abcls.parser.TT;
import io.github.abcls.selection.ScopedWalk;
import io.github.abcls.selection.Selection;
import java.util.LinkedHashSet;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Declares a voice in the header of every tune the selection touches: tunes in scope, and the tunes enclosing any
 * node in scope.
 */
public final class AddVoice {
    private AddVoice() {
        // utility
    }

    public static Selection addVoice(Selection selection, AbcContext ctx, String voiceId, VoiceParams params) {
        if (voiceId.isBlank()) {
            throw new IllegalArgumentException("Voice id must not be blank");
        }
        var tunes = new LinkedHashSet<CSNode>();
        for (var cursor : selection.cursors()) {
            ScopedWalk.walk(selection.root(), cursor, Tag.TUNE, (node, inScope, tune) -> {
                if (inScope && tune != null) {
                    tunes.add(tune);
                    return false;
                }
                return true;
            });
        }
        for (var tune : tunes) {
            var header = TreeUtils.findChildByTag(tune, Tag.TUNE_HEADER);
            if (header != null) {
                insertVoiceLine(header.node(), ctx, params.render(voiceId));
            }
        }
        return selection;
    }

    /** Inserts {@code V:<value>} right before the {@code K:} line, or at the end of a header that has none. */
    private static void insertVoiceLine(CSNode header, AbcContext ctx, String value) {
        var infoLine = CSNode.interior(
                ctx,
                Tag.INFO_LINE,
                List.of(CSNode.token(ctx, TT.INF_HDR, "V:"), CSNode.token(ctx, TT.INFO_STR, value)));
        var eol = CSNode.token(ctx, TT.EOL, "\n");

        var keyLine = findKeyLine(header);
        if (keyLine != null) {
            TreeUtils.insertBefore(header, keyLine, infoLine);
            TreeUtils.insertBefore(header, keyLine, eol);
            return;
        }
        var children = header.children();
        if (!children.isEmpty() && !children.get(children.size() - 1).isTokenOf(TT.EOL)) {
            TreeUtils.appendChild(header, CSNode.token(ctx, TT.EOL, "\n"));
        }
        TreeUtils.appendChild(header, infoLine);
        TreeUtils.appendChild(header, eol);
    }

    private static @Nullable CSNode findKeyLine(CSNode header) {
        for (var child = header.firstChild(); child != null; child = child.nextSibling()) {
            if (child.is(Tag.INFO_LINE)) {
                var key = child.firstChild();
                if (key != null && key.isTokenOf(TT.INF_HDR) && key.tokenData().lexeme().equals("K:")) {
                    return child;
                }
            }
        }
        return null;
    }
}
