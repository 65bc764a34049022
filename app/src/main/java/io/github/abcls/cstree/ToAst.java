package io.github.abcls.cstree;

import io.github.abcls.parser.AstNode;
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
import io.github.abcls.parser.TT;
import io.github.abcls.parser.Token;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Rebuilds typed AST nodes from a {@link CSNode} tree. Each builder redistributes the flat child list into the
 * record's fields; optional tokens are recognised by their token type, not their position. The whole tune body
 * comes back as a single system.
 */
public final class ToAst {
    private ToAst() {
        // utility
    }

    public static AstNode toAst(CSNode node) {
        if (node.isToken()) {
            return toToken(node);
        }
        var children = new ArrayList<AstNode>();
        for (var child = node.firstChild(); child != null; child = child.nextSibling()) {
            children.add(toAst(child));
        }
        int id = node.id();
        return switch (node.tag()) {
            case FILE_STRUCTURE -> buildFileStructure(id, children);
            case FILE_HEADER -> new FileHeader(id, children);
            case TUNE -> buildTune(id, children);
            case TUNE_HEADER -> new TuneHeader(id, children);
            case TUNE_BODY -> new TuneBody(id, List.of(children));
            case INFO_LINE -> new InfoLine(id, token(children, 0, node), rest(children, 1));
            case COMMENT -> new Comment(id, token(children, 0, node));
            case DIRECTIVE -> new Directive(id, token(children, 0, node), rest(children, 1));
            case LYRIC_LINE -> new LyricLine(id, token(children, 0, node), rest(children, 1));
            case NOTE -> buildNote(id, children, node);
            case PITCH -> buildPitch(id, children, node);
            case RHYTHM -> buildRhythm(id, children, node);
            case REST -> new Rest(id, token(children, 0, node), firstRhythm(children));
            case MULTI_MEASURE_REST -> new MultiMeasureRest(
                    id, token(children, 0, node), children.size() > 1 ? token(children, 1, node) : null);
            case CHORD -> buildChord(id, children);
            case BEAM -> new Beam(id, children);
            case GRACE_GROUP -> buildGraceGroup(id, children);
            case BAR_LINE -> buildBarLine(id, children, node);
            case DECORATION -> new Decoration(id, token(children, 0, node));
            case ANNOTATION -> new Annotation(id, token(children, 0, node));
            case CHORD_SYMBOL -> new ChordSymbol(id, token(children, 0, node));
            case INLINE_FIELD -> buildInlineField(id, children, node);
            case TUPLET -> buildTuplet(id, children, node);
            case Y_SPACER -> new YSpacer(id, token(children, 0, node), firstRhythm(children));
            case SYSTEM_BREAK -> new SystemBreak(id, token(children, 0, node));
            case VOICE_OVERLAY -> new VoiceOverlay(id, tokens(children, node));
            case LINE_CONTINUATION -> new LineContinuation(id, token(children, 0, node));
            case KV -> buildKv(id, children, node);
            case BINARY -> new Binary(id, child(children, 0, node), token(children, 1, node), child(children, 2, node));
            case UNARY -> new Unary(id, token(children, 0, node), child(children, 1, node));
            case GROUPING -> buildGrouping(id, children, node);
            case ABSOLUTE_PITCH -> buildAbsolutePitch(id, children, node);
            case ERROR_EXPR -> new ErrorExpr(id, tokens(children, node));
            case TOKEN -> throw new IllegalStateException("Interior node tagged TOKEN: " + node);
        };
    }

    private static Token toToken(CSNode node) {
        var data = node.tokenData();
        return new Token(data.tokenType(), data.lexeme(), data.line(), data.column(), node.id());
    }

    private static FileStructure buildFileStructure(int id, List<AstNode> children) {
        if (!children.isEmpty() && children.get(0) instanceof FileHeader header) {
            return new FileStructure(id, header, rest(children, 1));
        }
        return new FileStructure(id, null, children);
    }

    private static Tune buildTune(int id, List<AstNode> children) {
        TuneHeader header = null;
        TuneBody body = null;
        for (var child : children) {
            if (child instanceof TuneHeader h) {
                header = h;
            } else if (child instanceof TuneBody b) {
                body = b;
            } else {
                throw new IllegalStateException("Unexpected child of Tune " + id + ": " + child);
            }
        }
        if (header == null) {
            throw new IllegalStateException("Tune " + id + " has no header");
        }
        return new Tune(id, header, body);
    }

    private static Note buildNote(int id, List<AstNode> children, CSNode node) {
        if (children.isEmpty() || !(children.get(0) instanceof Pitch pitch)) {
            throw new IllegalStateException("Note without pitch: " + node);
        }
        Rhythm rhythm = null;
        Token tie = null;
        for (var child : children.subList(1, children.size())) {
            if (child instanceof Rhythm r) {
                rhythm = r;
            } else if (isTokenOf(child, TT.TIE)) {
                tie = (Token) child;
            }
        }
        return new Note(id, pitch, rhythm, tie);
    }

    private static Pitch buildPitch(int id, List<AstNode> children, CSNode node) {
        Token alteration = null;
        Token letter = null;
        Token octave = null;
        for (var t : tokens(children, node)) {
            switch (t.type()) {
                case ACCIDENTAL -> alteration = t;
                case NOTE_LETTER -> letter = t;
                case OCTAVE -> octave = t;
                default -> throw new IllegalStateException("Unexpected token in pitch: " + t);
            }
        }
        if (letter == null) {
            throw new IllegalStateException("Pitch without note letter: " + node);
        }
        return new Pitch(id, alteration, letter, octave);
    }

    private static Rhythm buildRhythm(int id, List<AstNode> children, CSNode node) {
        Token numerator = null;
        Token separator = null;
        Token denominator = null;
        Token broken = null;
        for (var t : tokens(children, node)) {
            switch (t.type()) {
                case RHY_NUMER -> numerator = t;
                case RHY_SEP -> separator = t;
                case RHY_DENOM -> denominator = t;
                case RHY_BRKN -> broken = t;
                default -> throw new IllegalStateException("Unexpected token in rhythm: " + t);
            }
        }
        return new Rhythm(id, numerator, separator, denominator, broken);
    }

    private static Chord buildChord(int id, List<AstNode> children) {
        Token left = null;
        Token right = null;
        Rhythm rhythm = null;
        Token tie = null;
        var contents = new ArrayList<AstNode>();
        for (var child : children) {
            if (isTokenOf(child, TT.CHRD_LEFT_BRKT)) {
                left = (Token) child;
            } else if (isTokenOf(child, TT.CHRD_RIGHT_BRKT)) {
                right = (Token) child;
            } else if (child instanceof Rhythm r) {
                rhythm = r;
            } else if (isTokenOf(child, TT.TIE)) {
                tie = (Token) child;
            } else {
                contents.add(child);
            }
        }
        return new Chord(id, left, contents, right, rhythm, tie);
    }

    private static GraceGroup buildGraceGroup(int id, List<AstNode> children) {
        Token left = null;
        Token slash = null;
        Token right = null;
        var notes = new ArrayList<AstNode>();
        for (var child : children) {
            if (isTokenOf(child, TT.GRC_GRP_LEFT_BRACE)) {
                left = (Token) child;
            } else if (isTokenOf(child, TT.GRC_GRP_SLSH)) {
                slash = (Token) child;
            } else if (isTokenOf(child, TT.GRC_GRP_RGHT_BRACE)) {
                right = (Token) child;
            } else {
                notes.add(child);
            }
        }
        return new GraceGroup(id, left, slash, notes, right);
    }

    private static BarLine buildBarLine(int id, List<AstNode> children, CSNode node) {
        var barline = new ArrayList<Token>();
        List<Token> repeats = null;
        for (var t : tokens(children, node)) {
            if (t.type() == TT.REPEAT_NUMBER || t.type() == TT.REPEAT_COMMA || t.type() == TT.REPEAT_DASH) {
                if (repeats == null) {
                    repeats = new ArrayList<>();
                }
                repeats.add(t);
            } else {
                barline.add(t);
            }
        }
        return new BarLine(id, barline, repeats);
    }

    private static InlineField buildInlineField(int id, List<AstNode> children, CSNode node) {
        Token left = null;
        Token field = null;
        Token right = null;
        var text = new ArrayList<Token>();
        for (var t : tokens(children, node)) {
            switch (t.type()) {
                case INLN_FLD_LFT_BRKT -> left = t;
                case INLN_FLD_RGT_BRKT -> right = t;
                case INF_HDR -> field = t;
                default -> text.add(t);
            }
        }
        if (field == null) {
            throw new IllegalStateException("Inline field without header: " + node);
        }
        return new InlineField(id, left, field, text, right);
    }

    private static Tuplet buildTuplet(int id, List<AstNode> children, CSNode node) {
        Token left = null;
        Token p = null;
        Token firstColon = null;
        Token q = null;
        Token secondColon = null;
        Token r = null;
        for (var t : tokens(children, node)) {
            switch (t.type()) {
                case TUPLET_LPAREN -> left = t;
                case TUPLET_P -> p = t;
                case TUPLET_Q -> q = t;
                case TUPLET_R -> r = t;
                case TUPLET_COLON -> {
                    if (firstColon == null) {
                        firstColon = t;
                    } else {
                        secondColon = t;
                    }
                }
                default -> throw new IllegalStateException("Unexpected token in tuplet: " + t);
            }
        }
        if (p == null) {
            throw new IllegalStateException("Tuplet without p: " + node);
        }
        return new Tuplet(id, left, p, firstColon, q, secondColon, r);
    }

    private static Kv buildKv(int id, List<AstNode> children, CSNode node) {
        if (children.isEmpty()) {
            throw new IllegalStateException("Empty key/value: " + node);
        }
        Token key = null;
        Token equals = null;
        for (var child : children.subList(0, children.size() - 1)) {
            if (isTokenOf(child, TT.EQL)) {
                equals = (Token) child;
            } else if (child instanceof Token t) {
                key = t;
            } else {
                throw new IllegalStateException("Unexpected key in key/value: " + child);
            }
        }
        return new Kv(id, key, equals, children.get(children.size() - 1));
    }

    private static Grouping buildGrouping(int id, List<AstNode> children, CSNode node) {
        int start = 0;
        int end = children.size();
        Token left = null;
        Token right = null;
        if (end > 0 && isTokenOf(children.get(0), TT.LPAREN)) {
            left = (Token) children.get(0);
            start = 1;
        }
        if (end > start && isTokenOf(children.get(end - 1), TT.RPAREN)) {
            right = (Token) children.get(end - 1);
            end--;
        }
        if (end - start != 1) {
            throw new IllegalStateException("Grouping must wrap exactly one expression: " + node);
        }
        return new Grouping(id, left, children.get(start), right);
    }

    private static AbsolutePitch buildAbsolutePitch(int id, List<AstNode> children, CSNode node) {
        Token letter = null;
        Token alteration = null;
        Token octave = null;
        for (var t : tokens(children, node)) {
            switch (t.type()) {
                case NOTE_LETTER -> letter = t;
                case ACCIDENTAL -> alteration = t;
                case OCTAVE -> octave = t;
                default -> throw new IllegalStateException("Unexpected token in absolute pitch: " + t);
            }
        }
        if (letter == null) {
            throw new IllegalStateException("Absolute pitch without note letter: " + node);
        }
        return new AbsolutePitch(id, letter, alteration, octave);
    }

    private static boolean isTokenOf(AstNode node, TT type) {
        return node instanceof Token t && t.type() == type;
    }

    private static @Nullable Rhythm firstRhythm(List<AstNode> children) {
        for (var child : children) {
            if (child instanceof Rhythm r) {
                return r;
            }
        }
        return null;
    }

    private static AstNode child(List<AstNode> children, int index, CSNode node) {
        if (index >= children.size()) {
            throw new IllegalStateException("Missing child " + index + " of " + node);
        }
        return children.get(index);
    }

    private static Token token(List<AstNode> children, int index, CSNode node) {
        if (!(child(children, index, node) instanceof Token t)) {
            throw new IllegalStateException("Child " + index + " of " + node + " is not a token");
        }
        return t;
    }

    private static List<Token> tokens(List<AstNode> children, CSNode node) {
        var result = new ArrayList<Token>(children.size());
        for (int i = 0; i < children.size(); i++) {
            result.add(token(children, i, node));
        }
        return result;
    }

    private static List<AstNode> rest(List<AstNode> children, int from) {
        return new ArrayList<>(children.subList(Math.min(from, children.size()), children.size()));
    }
}
