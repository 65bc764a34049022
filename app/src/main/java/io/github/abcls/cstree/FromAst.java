package io.github.abcls.cstree;

import io.github.abcls.parser.AstNode;
import io.github.abcls.parser.AstVisitor;
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
import io.github.abcls.parser.Token;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Converts an AST into a {@link CSNode} tree. Children are listed in source order, skipping absent optional
 * fields; multi-system tune bodies are flattened into one child list.
 */
public final class FromAst implements AstVisitor<CSNode> {
    private static final FromAst INSTANCE = new FromAst();

    private FromAst() {}

    public static CSNode fromAst(AstNode node) {
        return node.accept(INSTANCE);
    }

    private CSNode interior(Tag tag, int id, Children children) {
        var node = CSNode.interior(tag, id);
        var converted = new ArrayList<CSNode>(children.nodes.size());
        for (var child : children.nodes) {
            converted.add(child.accept(this));
        }
        node.linkChildren(converted);
        return node;
    }

    private static Children children() {
        return new Children();
    }

    private static final class Children {
        private final List<AstNode> nodes = new ArrayList<>();

        Children add(@Nullable AstNode node) {
            if (node != null) {
                nodes.add(node);
            }
            return this;
        }

        Children addAll(@Nullable List<? extends AstNode> list) {
            if (list != null) {
                nodes.addAll(list);
            }
            return this;
        }
    }

    @Override
    public CSNode visitToken(Token token) {
        return CSNode.token(
                token.id(), new TokenData(token.lexeme(), token.type(), token.line(), token.position()));
    }

    @Override
    public CSNode visitFileStructure(FileStructure node) {
        return interior(Tag.FILE_STRUCTURE, node.id(), children().add(node.fileHeader()).addAll(node.contents()));
    }

    @Override
    public CSNode visitFileHeader(FileHeader node) {
        return interior(Tag.FILE_HEADER, node.id(), children().addAll(node.contents()));
    }

    @Override
    public CSNode visitTune(Tune node) {
        return interior(Tag.TUNE, node.id(), children().add(node.header()).add(node.body()));
    }

    @Override
    public CSNode visitTuneHeader(TuneHeader node) {
        return interior(Tag.TUNE_HEADER, node.id(), children().addAll(node.infoLines()));
    }

    @Override
    public CSNode visitTuneBody(TuneBody node) {
        var flat = children();
        node.sequence().forEach(flat::addAll);
        return interior(Tag.TUNE_BODY, node.id(), flat);
    }

    @Override
    public CSNode visitInfoLine(InfoLine node) {
        return interior(Tag.INFO_LINE, node.id(), children().add(node.key()).addAll(node.value()));
    }

    @Override
    public CSNode visitComment(Comment node) {
        return interior(Tag.COMMENT, node.id(), children().add(node.token()));
    }

    @Override
    public CSNode visitDirective(Directive node) {
        return interior(Tag.DIRECTIVE, node.id(), children().add(node.key()).addAll(node.values()));
    }

    @Override
    public CSNode visitLyricLine(LyricLine node) {
        return interior(Tag.LYRIC_LINE, node.id(), children().add(node.header()).addAll(node.contents()));
    }

    @Override
    public CSNode visitNote(Note node) {
        return interior(Tag.NOTE, node.id(), children().add(node.pitch()).add(node.rhythm()).add(node.tie()));
    }

    @Override
    public CSNode visitPitch(Pitch node) {
        return interior(
                Tag.PITCH, node.id(), children().add(node.alteration()).add(node.noteLetter()).add(node.octave()));
    }

    @Override
    public CSNode visitRhythm(Rhythm node) {
        return interior(
                Tag.RHYTHM,
                node.id(),
                children()
                        .add(node.numerator())
                        .add(node.separator())
                        .add(node.denominator())
                        .add(node.broken()));
    }

    @Override
    public CSNode visitRest(Rest node) {
        return interior(Tag.REST, node.id(), children().add(node.rest()).add(node.rhythm()));
    }

    @Override
    public CSNode visitMultiMeasureRest(MultiMeasureRest node) {
        return interior(Tag.MULTI_MEASURE_REST, node.id(), children().add(node.rest()).add(node.length()));
    }

    @Override
    public CSNode visitChord(Chord node) {
        return interior(
                Tag.CHORD,
                node.id(),
                children()
                        .add(node.leftBracket())
                        .addAll(node.contents())
                        .add(node.rightBracket())
                        .add(node.rhythm())
                        .add(node.tie()));
    }

    @Override
    public CSNode visitBeam(Beam node) {
        return interior(Tag.BEAM, node.id(), children().addAll(node.contents()));
    }

    @Override
    public CSNode visitGraceGroup(GraceGroup node) {
        return interior(
                Tag.GRACE_GROUP,
                node.id(),
                children()
                        .add(node.leftBrace())
                        .add(node.acciaccaturaSlash())
                        .addAll(node.notes())
                        .add(node.rightBrace()));
    }

    @Override
    public CSNode visitBarLine(BarLine node) {
        return interior(Tag.BAR_LINE, node.id(), children().addAll(node.barline()).addAll(node.repeatNumbers()));
    }

    @Override
    public CSNode visitDecoration(Decoration node) {
        return interior(Tag.DECORATION, node.id(), children().add(node.decoration()));
    }

    @Override
    public CSNode visitAnnotation(Annotation node) {
        return interior(Tag.ANNOTATION, node.id(), children().add(node.text()));
    }

    @Override
    public CSNode visitChordSymbol(ChordSymbol node) {
        return interior(Tag.CHORD_SYMBOL, node.id(), children().add(node.symbol()));
    }

    @Override
    public CSNode visitInlineField(InlineField node) {
        return interior(
                Tag.INLINE_FIELD,
                node.id(),
                children()
                        .add(node.leftBracket())
                        .add(node.field())
                        .addAll(node.text())
                        .add(node.rightBracket()));
    }

    @Override
    public CSNode visitTuplet(Tuplet node) {
        return interior(
                Tag.TUPLET,
                node.id(),
                children()
                        .add(node.leftParen())
                        .add(node.p())
                        .add(node.firstColon())
                        .add(node.q())
                        .add(node.secondColon())
                        .add(node.r()));
    }

    @Override
    public CSNode visitYSpacer(YSpacer node) {
        return interior(Tag.Y_SPACER, node.id(), children().add(node.ySpacer()).add(node.rhythm()));
    }

    @Override
    public CSNode visitSystemBreak(SystemBreak node) {
        return interior(Tag.SYSTEM_BREAK, node.id(), children().add(node.symbol()));
    }

    @Override
    public CSNode visitVoiceOverlay(VoiceOverlay node) {
        return interior(Tag.VOICE_OVERLAY, node.id(), children().addAll(node.contents()));
    }

    @Override
    public CSNode visitLineContinuation(LineContinuation node) {
        return interior(Tag.LINE_CONTINUATION, node.id(), children().add(node.token()));
    }

    @Override
    public CSNode visitKv(Kv node) {
        return interior(Tag.KV, node.id(), children().add(node.key()).add(node.equals()).add(node.value()));
    }

    @Override
    public CSNode visitBinary(Binary node) {
        return interior(Tag.BINARY, node.id(), children().add(node.left()).add(node.operator()).add(node.right()));
    }

    @Override
    public CSNode visitUnary(Unary node) {
        return interior(Tag.UNARY, node.id(), children().add(node.operator()).add(node.operand()));
    }

    @Override
    public CSNode visitGrouping(Grouping node) {
        return interior(
                Tag.GROUPING,
                node.id(),
                children().add(node.leftParen()).add(node.expression()).add(node.rightParen()));
    }

    @Override
    public CSNode visitAbsolutePitch(AbsolutePitch node) {
        return interior(
                Tag.ABSOLUTE_PITCH,
                node.id(),
                children().add(node.noteLetter()).add(node.alteration()).add(node.octave()));
    }

    @Override
    public CSNode visitErrorExpr(ErrorExpr node) {
        return interior(Tag.ERROR_EXPR, node.id(), children().addAll(node.tokens()));
    }
}
