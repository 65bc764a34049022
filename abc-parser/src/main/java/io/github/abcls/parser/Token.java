package io.github.abcls.parser;

/**
 * A lexeme with its source position. {@code line} and {@code position} are 0-based; tokens created by
 * edits carry the position of the token they replace, or -1 when they have none.
 */
public record Token(TT type, String lexeme, int line, int position, int id) implements AstNode {

    public Token {
        if (lexeme == null) {
            throw new IllegalArgumentException("lexeme must not be null");
        }
    }

    /** Creates a token with no source position. */
    public static Token synthetic(TT type, String lexeme, AbcContext ctx) {
        return new Token(type, lexeme, -1, -1, ctx.generateId());
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitToken(this);
    }
}
