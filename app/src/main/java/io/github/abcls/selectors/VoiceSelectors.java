package io.github.abcls.selectors;

import io.github.abcls.cstree.VoiceMarkers;
import io.github.abcls.selection.Selection;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

public final class VoiceSelectors {
    private VoiceSelectors() {
        // utility
    }

    /**
     * Body content of voice {@code voiceId}, one cursor per contiguous passage. Each tune starts in the default
     * voice ({@code ""}, also reachable as {@code "default"}); a {@code V:} line or {@code [V:]} field switches
     * voice and belongs to the voice it switches to. Overlays ({@code &}) do not switch. When the voice has no
     * touched content the selection is returned as it is.
     */
    public static Selection selectVoices(Selection selection, String voiceId) {
        var wanted = VoiceMarkers.normalize(voiceId);
        var ids = selection.allIds();
        var cursors = new ArrayList<Set<Integer>>();
        BodyScan.forEachBody(selection, (body, inScope) -> {
            var voice = VoiceMarkers.DEFAULT_VOICE;
            var passage = new LinkedHashSet<Integer>();
            for (var child = body.firstChild(); child != null; child = child.nextSibling()) {
                if (VoiceMarkers.isVoiceMarker(child)) {
                    var next = VoiceMarkers.voiceId(child);
                    if (!next.equals(voice) && !passage.isEmpty()) {
                        cursors.add(new LinkedHashSet<>(passage));
                        passage.clear();
                    }
                    voice = next;
                }
                if (!voice.equals(wanted) || BodyScan.isLayout(child)) {
                    continue;
                }
                if (inScope || BodyScan.touches(child, ids)) {
                    passage.add(child.id());
                }
            }
            if (!passage.isEmpty()) {
                cursors.add(passage);
            }
        });
        return cursors.isEmpty() ? selection : selection.withCursors(cursors);
    }
}
