package io.github.abcls.cstree;

import io.github.abcls.parser.AbcContext;
import io.github.abcls.parser.AbcParser;
import io.github.abcls.parser.Expr.FileStructure;

/** A parsed document: source text, its AST, the tree built from it and the context that owns its identities. */
public record ParsedTree(String text, FileStructure ast, CSNode root, AbcContext ctx) {

    public static ParsedTree parse(String text) {
        return parse(text, new AbcContext());
    }

    /**
     * Parses with an existing context. Re-parsing edited text with the context of the previous tree keeps the two
     * identity spaces disjoint.
     */
    public static ParsedTree parse(String text, AbcContext ctx) {
        var ast = AbcParser.parse(text, ctx);
        return new ParsedTree(text, ast, FromAst.fromAst(ast), ctx);
    }

    /** A separate tree over the same AST, sharing identities with {@link #root()}, for edits that must not touch it. */
    public CSNode workingCopy() {
        return FromAst.fromAst(ast);
    }
}
