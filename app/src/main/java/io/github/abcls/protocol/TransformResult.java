package io.github.abcls.protocol;

import java.util.List;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;

/** Edits against the request's document version, and where the cursors land once they are applied. */
public class TransformResult {
    private List<TextEdit> textEdits;
    private List<Range> cursorRanges;

    public TransformResult() {
        this(List.of(), List.of());
    }

    public TransformResult(List<TextEdit> textEdits, List<Range> cursorRanges) {
        this.textEdits = textEdits;
        this.cursorRanges = cursorRanges;
    }

    public List<TextEdit> getTextEdits() {
        return textEdits;
    }

    public void setTextEdits(List<TextEdit> textEdits) {
        this.textEdits = textEdits;
    }

    public List<Range> getCursorRanges() {
        return cursorRanges;
    }

    public void setCursorRanges(List<Range> cursorRanges) {
        this.cursorRanges = cursorRanges;
    }
}
