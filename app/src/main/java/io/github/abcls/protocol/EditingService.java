package io.github.abcls.protocol;

import io.github.abcls.cstree.CSNode;
import io.github.abcls.cstree.ParsedTree;
import io.github.abcls.reconcile.TransformPipeline;
import io.github.abcls.selection.Selection;
import io.github.abcls.selection.SourceRange;
import io.github.abcls.selection.Spans;
import io.github.abcls.selectors.RangeSelector;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.jetbrains.annotations.Nullable;

/**
 * Serves selector and transform requests against the open documents. Both the editor surface and the socket
 * surface go through here, so validation and error codes are the same on both.
 */
public final class EditingService {
    private static final Logger logger = LogManager.getLogger(EditingService.class);

    private final DocumentRegistry documents;

    public EditingService(DocumentRegistry documents) {
        this.documents = documents;
    }

    public DocumentRegistry documents() {
        return documents;
    }

    public SelectorResult applySelector(ApplySelectorParams params) throws ProtocolException {
        var uri = RequestValidator.requireUri(params.getUri());
        var selector = RequestValidator.requireSelector(params.getSelector());
        var args = RequestValidator.requireArgs(params.getArgs());
        var ranges = RequestValidator.requireRanges(params.getRanges());
        var document = requireAbcDocument(uri);
        var root = document.root();

        Selection start;
        var nodeIds = params.getCursorNodeIds();
        if (nodeIds != null && !nodeIds.isEmpty()) {
            var cursors = new ArrayList<Set<Integer>>();
            nodeIds.forEach(id -> cursors.add(Set.of(id)));
            start = new Selection(root, cursors);
        } else {
            start = initialSelection(root, ranges);
            if (start == null) {
                return new SelectorResult(List.of());
            }
        }

        Selection result;
        try {
            result = selector.invoke(start, args);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException(ErrorCodes.INVALID_PARAMS, e.getMessage(), e);
        }
        logger.debug(
                "{} on {}: {} cursor(s) in, {} out",
                selector.name(),
                uri,
                start.cursors().size(),
                result.cursors().size());
        return new SelectorResult(toRanges(Spans.resolve(result)));
    }

    public TransformResult applyTransform(ApplyTransformParams params) throws ProtocolException {
        var uri = RequestValidator.requireUri(params.getUri());
        var transform = RequestValidator.requireTransform(params.getTransform());
        var args = RequestValidator.requireArgs(params.getArgs());
        var ranges = RequestValidator.requireRanges(params.effectiveRanges());
        var document = requireAbcDocument(uri);

        var start = initialSelection(document.root(), ranges);
        if (start == null) {
            return new TransformResult(List.of(), List.of());
        }
        TransformPipeline.Outcome outcome;
        try {
            outcome = TransformPipeline.run(
                    document, start.cursors(), selection -> transform.invoke(selection, document.ctx(), args));
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new ProtocolException(ErrorCodes.INVALID_PARAMS, e.getMessage(), e);
        }
        logger.debug("{} on {}: {} edit(s)", transform.name(), uri, outcome.textEdits().size());
        return new TransformResult(outcome.textEdits(), toRanges(outcome.cursorRanges()));
    }

    private ParsedTree requireAbcDocument(String uri) throws ProtocolException {
        var document = documents.get(uri)
                .orElseThrow(() -> new ProtocolException(ErrorCodes.DOCUMENT_NOT_FOUND, "Document not yet opened"));
        if (!uri.endsWith(".abc")) {
            throw new ProtocolException(
                    ErrorCodes.FILE_TYPE_NOT_SUPPORTED, "Selectors and transforms are only supported for .abc files");
        }
        return document;
    }

    /**
     * The whole document when no ranges are given; otherwise the nodes inside each range, one cursor per node.
     * {@code null} when ranges are given but none of them holds a node.
     */
    static @Nullable Selection initialSelection(CSNode root, List<Range> ranges) {
        var whole = Selection.of(root);
        if (ranges.isEmpty()) {
            return whole;
        }
        var cursors = new ArrayList<Set<Integer>>();
        for (var range : ranges) {
            cursors.addAll(RangeSelector.selectRange(whole, toSourceRange(range)).cursors());
        }
        return cursors.isEmpty() ? null : whole.withCursors(cursors);
    }

    public static SourceRange toSourceRange(Range range) {
        return new SourceRange(
                range.getStart().getLine(),
                range.getStart().getCharacter(),
                range.getEnd().getLine(),
                range.getEnd().getCharacter());
    }

    public static Range toRange(SourceRange range) {
        return new Range(
                new Position(range.startLine(), range.startColumn()),
                new Position(range.endLine(), range.endColumn()));
    }

    private static List<Range> toRanges(List<SourceRange> ranges) {
        return ranges.stream().map(EditingService::toRange).toList();
    }
}
