package io.github.abcls.protocol;

import java.util.List;
import org.eclipse.lsp4j.Range;
import org.jetbrains.annotations.Nullable;

/**
 * Parameters of {@code abc.applySelector}. Without ranges or node ids the selector starts from the whole
 * document.
 */
public class ApplySelectorParams {
    private @Nullable String uri;
    private @Nullable String selector;
    private @Nullable List<Object> args;
    private @Nullable List<Range> ranges;
    private @Nullable List<Integer> cursorNodeIds;

    public ApplySelectorParams() {}

    public ApplySelectorParams(String uri, String selector, List<Object> args, List<Range> ranges) {
        this.uri = uri;
        this.selector = selector;
        this.args = args;
        this.ranges = ranges;
    }

    public @Nullable String getUri() {
        return uri;
    }

    public void setUri(@Nullable String uri) {
        this.uri = uri;
    }

    public @Nullable String getSelector() {
        return selector;
    }

    public void setSelector(@Nullable String selector) {
        this.selector = selector;
    }

    public @Nullable List<Object> getArgs() {
        return args;
    }

    public void setArgs(@Nullable List<Object> args) {
        this.args = args;
    }

    public @Nullable List<Range> getRanges() {
        return ranges;
    }

    public void setRanges(@Nullable List<Range> ranges) {
        this.ranges = ranges;
    }

    public @Nullable List<Integer> getCursorNodeIds() {
        return cursorNodeIds;
    }

    public void setCursorNodeIds(@Nullable List<Integer> cursorNodeIds) {
        this.cursorNodeIds = cursorNodeIds;
    }
}
