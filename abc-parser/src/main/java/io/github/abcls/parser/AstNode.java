package io.github.abcls.parser;

/** Anything that may appear in an AST child position: a {@link Token} or an {@link Expr}. */
public interface AstNode {
    <R> R accept(AstVisitor<R> visitor);
}
