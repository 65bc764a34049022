package io.github.abcls.selection;

/** Half-open source span {@code [start, end)} in 0-based line/column coordinates. */
public record SourceRange(int startLine, int startColumn, int endLine, int endColumn) {

    public boolean contains(SourceRange other) {
        return compare(startLine, startColumn, other.startLine, other.startColumn) <= 0
                && compare(other.endLine, other.endColumn, endLine, endColumn) <= 0;
    }

    public boolean isEmpty() {
        return compare(startLine, startColumn, endLine, endColumn) >= 0;
    }

    private static int compare(int lineA, int columnA, int lineB, int columnB) {
        return lineA != lineB ? Integer.compare(lineA, lineB) : Integer.compare(columnA, columnB);
    }
}
