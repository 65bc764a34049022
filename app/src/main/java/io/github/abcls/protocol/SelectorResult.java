package io.github.abcls.protocol;

import java.util.List;
import org.eclipse.lsp4j.Range;

/** One range per resulting cursor. */
public class SelectorResult {
    private List<Range> ranges;

    public SelectorResult() {
        this(List.of());
    }

    public SelectorResult(List<Range> ranges) {
        this.ranges = ranges;
    }

    public List<Range> getRanges() {
        return ranges;
    }

    public void setRanges(List<Range> ranges) {
        this.ranges = ranges;
    }
}
