package io.github.abcls.cstree;

/** Closed set of node kinds in a {@link CSNode} tree. Every kind except {@link #TOKEN} mirrors one AST record. */
public enum Tag {
    FILE_STRUCTURE,
    FILE_HEADER,
    TUNE,
    TUNE_HEADER,
    TUNE_BODY,
    INFO_LINE,
    COMMENT,
    DIRECTIVE,
    LYRIC_LINE,
    NOTE,
    PITCH,
    RHYTHM,
    REST,
    MULTI_MEASURE_REST,
    CHORD,
    BEAM,
    GRACE_GROUP,
    BAR_LINE,
    DECORATION,
    ANNOTATION,
    CHORD_SYMBOL,
    INLINE_FIELD,
    TUPLET,
    Y_SPACER,
    SYSTEM_BREAK,
    VOICE_OVERLAY,
    LINE_CONTINUATION,
    KV,
    BINARY,
    UNARY,
    GROUPING,
    ABSOLUTE_PITCH,
    ERROR_EXPR,
    TOKEN
}
