package io.github.abcls.parser;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Typed AST node. Every node carries an identity generated by the {@link AbcContext} that created it.
 *
 * <p>Field order in each record is the source order of its parts, which is also the order the formatter writes
 * them in.
 */
public interface Expr extends AstNode {
    int id();

    record FileStructure(int id, @Nullable FileHeader fileHeader, List<AstNode> contents) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitFileStructure(this);
        }
    }

    record FileHeader(int id, List<AstNode> contents) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitFileHeader(this);
        }
    }

    record Tune(int id, TuneHeader header, @Nullable TuneBody body) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitTune(this);
        }
    }

    record TuneHeader(int id, List<AstNode> infoLines) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitTuneHeader(this);
        }
    }

    /** One inner list per system (source line). */
    record TuneBody(int id, List<List<AstNode>> sequence) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitTuneBody(this);
        }
    }

    record InfoLine(int id, Token key, List<AstNode> value) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitInfoLine(this);
        }
    }

    record Comment(int id, Token token) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitComment(this);
        }
    }

    record Directive(int id, Token key, List<AstNode> values) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitDirective(this);
        }
    }

    record LyricLine(int id, Token header, List<AstNode> contents) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitLyricLine(this);
        }
    }

    record Note(int id, Pitch pitch, @Nullable Rhythm rhythm, @Nullable Token tie) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitNote(this);
        }
    }

    record Pitch(int id, @Nullable Token alteration, Token noteLetter, @Nullable Token octave) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitPitch(this);
        }
    }

    record Rhythm(
            int id,
            @Nullable Token numerator,
            @Nullable Token separator,
            @Nullable Token denominator,
            @Nullable Token broken)
            implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitRhythm(this);
        }
    }

    record Rest(int id, Token rest, @Nullable Rhythm rhythm) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitRest(this);
        }
    }

    record MultiMeasureRest(int id, Token rest, @Nullable Token length) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitMultiMeasureRest(this);
        }
    }

    record Chord(
            int id,
            @Nullable Token leftBracket,
            List<AstNode> contents,
            @Nullable Token rightBracket,
            @Nullable Rhythm rhythm,
            @Nullable Token tie)
            implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitChord(this);
        }
    }

    record Beam(int id, List<AstNode> contents) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitBeam(this);
        }
    }

    record GraceGroup(
            int id,
            @Nullable Token leftBrace,
            @Nullable Token acciaccaturaSlash,
            List<AstNode> notes,
            @Nullable Token rightBrace)
            implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitGraceGroup(this);
        }
    }

    record BarLine(int id, List<Token> barline, @Nullable List<Token> repeatNumbers) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitBarLine(this);
        }
    }

    record Decoration(int id, Token decoration) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitDecoration(this);
        }
    }

    record Annotation(int id, Token text) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitAnnotation(this);
        }
    }

    record ChordSymbol(int id, Token symbol) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitChordSymbol(this);
        }
    }

    record InlineField(
            int id, @Nullable Token leftBracket, Token field, List<Token> text, @Nullable Token rightBracket)
            implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitInlineField(this);
        }
    }

    record Tuplet(
            int id,
            @Nullable Token leftParen,
            Token p,
            @Nullable Token firstColon,
            @Nullable Token q,
            @Nullable Token secondColon,
            @Nullable Token r)
            implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitTuplet(this);
        }
    }

    record YSpacer(int id, Token ySpacer, @Nullable Rhythm rhythm) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitYSpacer(this);
        }
    }

    record SystemBreak(int id, Token symbol) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitSystemBreak(this);
        }
    }

    record VoiceOverlay(int id, List<Token> contents) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitVoiceOverlay(this);
        }
    }

    record LineContinuation(int id, Token token) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitLineContinuation(this);
        }
    }

    /** {@code key=value}; a bare value has neither key nor equals sign. */
    record Kv(int id, @Nullable Token key, @Nullable Token equals, AstNode value) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitKv(this);
        }
    }

    record Binary(int id, AstNode left, Token operator, AstNode right) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    record Unary(int id, Token operator, AstNode operand) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    record Grouping(int id, @Nullable Token leftParen, AstNode expression, @Nullable Token rightParen)
            implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitGrouping(this);
        }
    }

    record AbsolutePitch(int id, Token noteLetter, @Nullable Token alteration, @Nullable Token octave)
            implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitAbsolutePitch(this);
        }
    }

    record ErrorExpr(int id, List<Token> tokens) implements Expr {
        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visitErrorExpr(this);
        }
    }
}
