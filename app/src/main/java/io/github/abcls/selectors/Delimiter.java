package io.github.abcls.selectors;

import io.github.abcls.cstree.Tag;
import io.github.abcls.parser.TT;

/** Bracketed constructs the inside/around selectors understand, with their opening and closing token types. */
public enum Delimiter {
    CHORD(Tag.CHORD, TT.CHRD_LEFT_BRKT, TT.CHRD_RIGHT_BRKT),
    GRACE_GROUP(Tag.GRACE_GROUP, TT.GRC_GRP_LEFT_BRACE, TT.GRC_GRP_RGHT_BRACE),
    INLINE_FIELD(Tag.INLINE_FIELD, TT.INLN_FLD_LFT_BRKT, TT.INLN_FLD_RGT_BRKT),
    GROUPING(Tag.GROUPING, TT.LPAREN, TT.RPAREN);

    private final Tag tag;
    private final TT open;
    private final TT close;

    Delimiter(Tag tag, TT open, TT close) {
        this.tag = tag;
        this.open = open;
        this.close = close;
    }

    public Tag tag() {
        return tag;
    }

    public TT open() {
        return open;
    }

    public TT close() {
        return close;
    }
}
