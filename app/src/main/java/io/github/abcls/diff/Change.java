package io.github.abcls.diff;

/**
 * One edit against the old text. Offsets index the old text; {@code endOffsetInclusive} is the last replaced or
 * deleted character. An insert covers no characters: its end is {@code startOffset - 1}.
 */
public record Change(Kind kind, int startOffset, int endOffsetInclusive, String newContent) {

    public enum Kind {
        INSERT,
        DELETE,
        REPLACE
    }

    static Change insert(int at, String content) {
        return new Change(Kind.INSERT, at, at - 1, content);
    }

    static Change delete(int start, int endInclusive) {
        return new Change(Kind.DELETE, start, endInclusive, "");
    }

    static Change replace(int start, int endInclusive, String content) {
        return new Change(Kind.REPLACE, start, endInclusive, content);
    }

    /** Number of old characters this change covers. */
    public int length() {
        return endOffsetInclusive - startOffset + 1;
    }

    /** Exclusive end offset in the old text. */
    public int endOffset() {
        return endOffsetInclusive + 1;
    }
}
