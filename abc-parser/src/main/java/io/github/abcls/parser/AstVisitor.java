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

public interface AstVisitor<R> {
    R visitToken(Token token);

    R visitFileStructure(FileStructure node);

    R visitFileHeader(FileHeader node);

    R visitTune(Tune node);

    R visitTuneHeader(TuneHeader node);

    R visitTuneBody(TuneBody node);

    R visitInfoLine(InfoLine node);

    R visitComment(Comment node);

    R visitDirective(Directive node);

    R visitLyricLine(LyricLine node);

    R visitNote(Note node);

    R visitPitch(Pitch node);

    R visitRhythm(Rhythm node);

    R visitRest(Rest node);

    R visitMultiMeasureRest(MultiMeasureRest node);

    R visitChord(Chord node);

    R visitBeam(Beam node);

    R visitGraceGroup(GraceGroup node);

    R visitBarLine(BarLine node);

    R visitDecoration(Decoration node);

    R visitAnnotation(Annotation node);

    R visitChordSymbol(ChordSymbol node);

    R visitInlineField(InlineField node);

    R visitTuplet(Tuplet node);

    R visitYSpacer(YSpacer node);

    R visitSystemBreak(SystemBreak node);

    R visitVoiceOverlay(VoiceOverlay node);

    R visitLineContinuation(LineContinuation node);

    R visitKv(Kv node);

    R visitBinary(Binary node);

    R visitUnary(Unary node);

    R visitGrouping(Grouping node);

    R visitAbsolutePitch(AbsolutePitch node);

    R visitErrorExpr(ErrorExpr node);
}
