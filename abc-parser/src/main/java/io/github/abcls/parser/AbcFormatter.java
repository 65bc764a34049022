package io.github.abcls.parser;

import io.github.abcls.parser.Expr.AbsolutePitch;
import io.github.abcls.parser.Expr.Annotation;
import io.github.abcls.parser.Expr.BarLine;
import io.github.abcls.parser.Expr.Beam;
import io.github.abcls.parser.Expr.Binary;
import io.github.abcls.parser.Expr.Chord;
import io.github.abcls.parser.Expr.ChordSymbol;
import io.github.abcls.parser.Expr.Comment;
import io.github.abcls.parser.Expr.Decoration;
import io.github.abcls.parser.Expr.Directive;
import io.github.abcls.parser.Expr.ErrorExpr;
import io.github.abcls.parser.Expr.FileHeader;
import io.github.abcls.parser.Expr.FileStructure;
import io.github.abcls.parser.Expr.GraceGroup;
import io.github.abcls.parser.Expr.Grouping;
import io.github.abcls.parser.Expr.InfoLine;
import io.github.abcls.parser.Expr.InlineField;
import io.github.abcls.parser.Expr.Kv;
import io.github.abcls.parser.Expr.LineContinuation;
import io.github.abcls.parser.Expr.LyricLine;
import io.github.abcls.parser.Expr.MultiMeasureRest;
import io.github.abcls.parser.Expr.Note;
import io.github.abcls.parser.Expr.Pitch;
import io.github.abcls.parser.Expr.Rest;
import io.github.abcls.parser.Expr.Rhythm;
import io.github.abcls.parser.Expr.SystemBreak;
import io.github.abcls.parser.Expr.Tune;
import io.github.abcls.parser.Expr.TuneBody;
import io.github.abcls.parser.Expr.TuneHeader;
import io.github.abcls.parser.Expr.Tuplet;
import io.github.abcls.parser.Expr.Unary;
import io.github.abcls.parser.Expr.VoiceOverlay;
import io.github.abcls.parser.Expr.YSpacer;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Writes an AST back to ABC text. Output is the concatenation of token lexemes in field order, so line breaks and
 * spacing come from the WS/EOL/section-break tokens the tree carries.
 */
public final class AbcFormatter implements AstVisitor<Void> {
    private final StringBuilder out = new StringBuilder();

    private AbcFormatter() {}

    public static String stringify(AstNode node) {
        var formatter = new AbcFormatter();
        node.accept(formatter);
        return formatter.out.toString();
    }

    private void emit(@Nullable AstNode node) {
        if (node != null) {
            node.accept(this);
        }
    }

    private void emitAll(@Nullable List<? extends AstNode> nodes) {
        if (nodes != null) {
            nodes.forEach(this::emit);
        }
    }

    @Override
    public Void visitToken(Token token) {
        out.append(token.lexeme());
        return null;
    }

    @Override
    public Void visitFileStructure(FileStructure node) {
        emit(node.fileHeader());
        emitAll(node.contents());
        return null;
    }

    @Override
    public Void visitFileHeader(FileHeader node) {
        emitAll(node.contents());
        return null;
    }

    @Override
    public Void visitTune(Tune node) {
        emit(node.header());
        emit(node.body());
        return null;
    }

    @Override
    public Void visitTuneHeader(TuneHeader node) {
        emitAll(node.infoLines());
        return null;
    }

    @Override
    public Void visitTuneBody(TuneBody node) {
        node.sequence().forEach(this::emitAll);
        return null;
    }

    @Override
    public Void visitInfoLine(InfoLine node) {
        emit(node.key());
        emitAll(node.value());
        return null;
    }

    @Override
    public Void visitComment(Comment node) {
        return visitToken(node.token());
    }

    @Override
    public Void visitDirective(Directive node) {
        emit(node.key());
        emitAll(node.values());
        return null;
    }

    @Override
    public Void visitLyricLine(LyricLine node) {
        emit(node.header());
        emitAll(node.contents());
        return null;
    }

    @Override
    public Void visitNote(Note node) {
        emit(node.pitch());
        emit(node.rhythm());
        emit(node.tie());
        return null;
    }

    @Override
    public Void visitPitch(Pitch node) {
        emit(node.alteration());
        emit(node.noteLetter());
        emit(node.octave());
        return null;
    }

    @Override
    public Void visitRhythm(Rhythm node) {
        emit(node.numerator());
        emit(node.separator());
        emit(node.denominator());
        emit(node.broken());
        return null;
    }

    @Override
    public Void visitRest(Rest node) {
        emit(node.rest());
        emit(node.rhythm());
        return null;
    }

    @Override
    public Void visitMultiMeasureRest(MultiMeasureRest node) {
        emit(node.rest());
        emit(node.length());
        return null;
    }

    @Override
    public Void visitChord(Chord node) {
        emit(node.leftBracket());
        emitAll(node.contents());
        emit(node.rightBracket());
        emit(node.rhythm());
        emit(node.tie());
        return null;
    }

    @Override
    public Void visitBeam(Beam node) {
        emitAll(node.contents());
        return null;
    }

    @Override
    public Void visitGraceGroup(GraceGroup node) {
        emit(node.leftBrace());
        emit(node.acciaccaturaSlash());
        emitAll(node.notes());
        emit(node.rightBrace());
        return null;
    }

    @Override
    public Void visitBarLine(BarLine node) {
        emitAll(node.barline());
        emitAll(node.repeatNumbers());
        return null;
    }

    @Override
    public Void visitDecoration(Decoration node) {
        return visitToken(node.decoration());
    }

    @Override
    public Void visitAnnotation(Annotation node) {
        return visitToken(node.text());
    }

    @Override
    public Void visitChordSymbol(ChordSymbol node) {
        return visitToken(node.symbol());
    }

    @Override
    public Void visitInlineField(InlineField node) {
        emit(node.leftBracket());
        emit(node.field());
        emitAll(node.text());
        emit(node.rightBracket());
        return null;
    }

    @Override
    public Void visitTuplet(Tuplet node) {
        emit(node.leftParen());
        emit(node.p());
        emit(node.firstColon());
        emit(node.q());
        emit(node.secondColon());
        emit(node.r());
        return null;
    }

    @Override
    public Void visitYSpacer(YSpacer node) {
        emit(node.ySpacer());
        emit(node.rhythm());
        return null;
    }

    @Override
    public Void visitSystemBreak(SystemBreak node) {
        return visitToken(node.symbol());
    }

    @Override
    public Void visitVoiceOverlay(VoiceOverlay node) {
        emitAll(node.contents());
        return null;
    }

    @Override
    public Void visitLineContinuation(LineContinuation node) {
        return visitToken(node.token());
    }

    @Override
    public Void visitKv(Kv node) {
        emit(node.key());
        emit(node.equals());
        emit(node.value());
        return null;
    }

    @Override
    public Void visitBinary(Binary node) {
        emit(node.left());
        emit(node.operator());
        emit(node.right());
        return null;
    }

    @Override
    public Void visitUnary(Unary node) {
        emit(node.operator());
        emit(node.operand());
        return null;
    }

    @Override
    public Void visitGrouping(Grouping node) {
        emit(node.leftParen());
        emit(node.expression());
        emit(node.rightParen());
        return null;
    }

    @Override
    public Void visitAbsolutePitch(AbsolutePitch node) {
        emit(node.noteLetter());
        emit(node.alteration());
        emit(node.octave());
        return null;
    }

    @Override
    public Void visitErrorExpr(ErrorExpr node) {
        emitAll(node.tokens());
        return null;
    }
}
