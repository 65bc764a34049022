package io.github.abcls.cstree;

import io.github.abcls.parser.AbcFormatter;

/** Serializes a tree back to ABC text through the AST formatter. */
public final class CsTreeSerializer {
    private CsTreeSerializer() {
        // utility
    }

    public static String serialize(CSNode root) {
        return AbcFormatter.stringify(ToAst.toAst(root));
    }
}
