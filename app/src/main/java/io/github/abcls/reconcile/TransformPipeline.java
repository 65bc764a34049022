package io.github.abcls.reconcile;

import io.github.abcls.cstree.CsTreeSerializer;
import io.github.abcls.cstree.ParsedTree;
import io.github.abcls.diff.Change;
import io.github.abcls.diff.CharDiff;
import io.github.abcls.diff.TextEdits;
import io.github.abcls.selection.Selection;
import io.github.abcls.selection.SourceRange;
import io.github.abcls.selection.Spans;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.lsp4j.TextEdit;

/**
 * Runs a transform against a document and works out what the editor has to do: the text edits to apply and where
 * the cursors land in the edited text.
 */
public final class TransformPipeline {
    private static final Logger logger = LogManager.getLogger(TransformPipeline.class);

    private TransformPipeline() {
        // utility
    }

    /**
     * @param newText the document after the transform
     * @param changes character changes from the old text to {@code newText}
     * @param textEdits {@code changes} as editor edits against the old text
     * @param reparsed {@code newText} parsed again, with fresh identities
     * @param cursors the transformed cursors, expressed in {@code reparsed} identities
     * @param cursorRanges one range per surviving cursor, in {@code newText} coordinates
     */
    public record Outcome(
            String newText,
            List<Change> changes,
            List<TextEdit> textEdits,
            ParsedTree reparsed,
            List<Set<Integer>> cursors,
            List<SourceRange> cursorRanges) {}

    /**
     * Applies {@code transform} to a working copy of {@code document}'s tree; the cached tree is left as it was.
     *
     * @param cursors identities in {@code document}'s identity space
     */
    public static Outcome run(ParsedTree document, List<Set<Integer>> cursors, UnaryOperator<Selection> transform) {
        var workingRoot = document.workingCopy();
        var transformed = transform.apply(new Selection(workingRoot, cursors));

        var surviving = CursorPreservation.collectSurvivingCursorIds(transformed);
        var newText = CsTreeSerializer.serialize(transformed.root());
        var changes = CharDiff.diff(document.text(), newText);
        var textEdits = TextEdits.toTextEdits(document.text(), changes);

        var reparsed = ParsedTree.parse(newText, document.ctx());
        var remapped = CursorPreservation.remapCursors(transformed.root(), surviving, reparsed.root());
        var cursorRanges = Spans.resolve(new Selection(reparsed.root(), remapped));
        logger.debug(
                "Transform produced {} change(s); {} of {} cursor(s) survived",
                changes.size(),
                remapped.size(),
                cursors.size());
        return new Outcome(newText, changes, textEdits, reparsed, remapped, cursorRanges);
    }
}
