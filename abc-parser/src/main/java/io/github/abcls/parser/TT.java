package io.github.abcls.parser;

/** Token subtypes produced by {@link AbcParser}. */
public enum TT {
    // music code
    NOTE_LETTER,
    ACCIDENTAL,
    OCTAVE,
    RHY_NUMER,
    RHY_SEP,
    RHY_DENOM,
    RHY_BRKN,
    TIE,
    REST,
    MMR_REST,
    MMR_LENGTH,
    Y_SPC,
    CHRD_LEFT_BRKT,
    CHRD_RIGHT_BRKT,
    GRC_GRP_LEFT_BRACE,
    GRC_GRP_RGHT_BRACE,
    GRC_GRP_SLSH,
    INLN_FLD_LFT_BRKT,
    INLN_FLD_RGT_BRKT,
    BARLINE,
    REPEAT_NUMBER,
    REPEAT_COMMA,
    REPEAT_DASH,
    TUPLET_LPAREN,
    TUPLET_P,
    TUPLET_COLON,
    TUPLET_Q,
    TUPLET_R,
    SLUR,
    DECORATION,
    ANNOTATION,
    CHORD_SYMBOL,
    VOICE_OVRLAY,
    LINE_CONT,
    SYSTEM_BREAK,

    // info lines, inline fields and directives
    INF_HDR,
    INFO_STR,
    IDENTIFIER,
    NUMBER,
    STRING,
    EQL,
    PLUS,
    MINUS,
    SLASH,
    LPAREN,
    RPAREN,
    STYLESHEET_DIRECTIVE,
    LY_HDR,
    LY_TXT,

    // layout
    COMMENT,
    WS,
    EOL,
    SCT_BRK,
    FREE_TXT,
    INVALID
}
