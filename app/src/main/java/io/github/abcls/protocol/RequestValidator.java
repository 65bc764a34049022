package io.github.abcls.protocol;

import io.github.abcls.registry.SelectorRegistry;
import io.github.abcls.registry.TransformRegistry;
import java.util.List;
import java.util.regex.Pattern;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.jetbrains.annotations.Nullable;

/** Checks request parameters before any tree is touched. */
public final class RequestValidator {
    private static final Pattern VALID_URI = Pattern.compile("^file://[^?#]*$");

    private RequestValidator() {
        // utility
    }

    /** A {@code file://} URI without query, fragment or {@code ..} segment. */
    public static boolean isValidUri(@Nullable String uri) {
        return uri != null && VALID_URI.matcher(uri).matches() && !uri.contains("..");
    }

    public static String requireUri(@Nullable String uri) throws ProtocolException {
        if (!isValidUri(uri)) {
            throw new ProtocolException(ErrorCodes.INVALID_PARAMS, "Invalid or missing URI");
        }
        return uri;
    }

    public static SelectorRegistry.Entry requireSelector(@Nullable String name) throws ProtocolException {
        if (name == null) {
            throw new ProtocolException(ErrorCodes.INVALID_PARAMS, "Missing selector name");
        }
        return SelectorRegistry.lookup(name)
                .orElseThrow(() -> new ProtocolException(
                        ErrorCodes.INVALID_PARAMS,
                        "Unknown selector: \"" + name + "\". Available: "
                                + String.join(", ", SelectorRegistry.names())));
    }

    public static TransformRegistry.Entry requireTransform(@Nullable String name) throws ProtocolException {
        if (name == null) {
            throw new ProtocolException(ErrorCodes.INVALID_PARAMS, "Missing transform name");
        }
        return TransformRegistry.lookup(name)
                .orElseThrow(() -> new ProtocolException(
                        ErrorCodes.INVALID_PARAMS,
                        "Unknown transform: \"" + name + "\". Available: "
                                + String.join(", ", TransformRegistry.names())));
    }

    /** Arguments must be numbers or strings. */
    public static List<Object> requireArgs(@Nullable List<Object> args) throws ProtocolException {
        if (args == null) {
            return List.of();
        }
        for (var arg : args) {
            if (!(arg instanceof Number) && !(arg instanceof String)) {
                throw new ProtocolException(ErrorCodes.INVALID_PARAMS, "args must be an array of numbers or strings");
            }
        }
        return args;
    }

    public static List<Range> requireRanges(@Nullable List<Range> ranges) throws ProtocolException {
        if (ranges == null) {
            return List.of();
        }
        for (var range : ranges) {
            if (range == null || !isValid(range.getStart()) || !isValid(range.getEnd())) {
                throw new ProtocolException(ErrorCodes.INVALID_PARAMS, "ranges must hold start and end positions");
            }
        }
        return ranges;
    }

    private static boolean isValid(@Nullable Position position) {
        return position != null && position.getLine() >= 0 && position.getCharacter() >= 0;
    }
}
