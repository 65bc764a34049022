package io.github.abcls.protocol;

import java.util.List;
import org.eclipse.lsp4j.Range;
import org.jetbrains.annotations.Nullable;

/**
 * Parameters of {@code abc.applyTransform}. Editors send the current selections as {@code selections}; socket
 * clients send them as {@code ranges}. Without either the transform applies to the whole document.
 */
public class ApplyTransformParams {
    private @Nullable String uri;
    private @Nullable String transform;
    private @Nullable List<Object> args;
    private @Nullable List<Range> selections;
    private @Nullable List<Range> ranges;

    public ApplyTransformParams() {}

    public ApplyTransformParams(String uri, String transform, List<Object> args, List<Range> selections) {
        this.uri = uri;
        this.transform = transform;
        this.args = args;
        this.selections = selections;
    }

    public @Nullable String getUri() {
        return uri;
    }

    public void setUri(@Nullable String uri) {
        this.uri = uri;
    }

    public @Nullable String getTransform() {
        return transform;
    }

    public void setTransform(@Nullable String transform) {
        this.transform = transform;
    }

    public @Nullable List<Object> getArgs() {
        return args;
    }

    public void setArgs(@Nullable List<Object> args) {
        this.args = args;
    }

    public @Nullable List<Range> getSelections() {
        return selections;
    }

    public void setSelections(@Nullable List<Range> selections) {
        this.selections = selections;
    }

    public @Nullable List<Range> getRanges() {
        return ranges;
    }

    public void setRanges(@Nullable List<Range> ranges) {
        this.ranges = ranges;
    }

    /** {@code selections} when present, else {@code ranges}. */
    public @Nullable List<Range> effectiveRanges() {
        return selections != null ? selections : ranges;
    }
}
