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
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Line-oriented parser for ABC notation.
 *
 * <p>The parse is lossless: every character of the input belongs to exactly one token of the resulting tree, so
 * {@code AbcFormatter.stringify(parse(text, ctx))} returns {@code text} for any input. Characters that do not fit
 * the grammar end up in {@link ErrorExpr} nodes or free-text tokens rather than being dropped.
 *
 * <p>Tunes start at an {@code X:} line and end at a blank line. The tune header runs up to and including the
 * {@code K:} line, or up to the first line that is not an info line, comment or directive. Each body line is one
 * system.
 */
public final class AbcParser {
    private static final String DECORATION_CHARS = ".~HLMOPSTuv";

    private final String src;
    private final AbcContext ctx;
    private int pos;
    private int line;
    private int lineStart;

    private AbcParser(String src, AbcContext ctx) {
        this.src = src;
        this.ctx = ctx;
    }

    public static FileStructure parse(String source, AbcContext ctx) {
        return new AbcParser(source, ctx).parseFile();
    }

    // ---------------------------------------------------------------------
    // File and tune structure
    // ---------------------------------------------------------------------

    private FileStructure parseFile() {
        FileHeader fileHeader = null;
        var contents = new ArrayList<AstNode>();
        while (!atEof()) {
            if (isBlankLine()) {
                contents.add(blankLine());
            } else if (src.startsWith("X:", pos)) {
                contents.add(parseTune());
            } else if (fileHeader == null && contents.isEmpty()) {
                fileHeader = parseFileHeader();
            } else {
                freeTextSection(contents);
            }
        }
        return new FileStructure(ctx.generateId(), fileHeader, contents);
    }

    private FileHeader parseFileHeader() {
        var contents = new ArrayList<AstNode>();
        while (!atEof() && !isBlankLine() && !src.startsWith("X:", pos)) {
            parseHeaderLine(contents);
        }
        return new FileHeader(ctx.generateId(), contents);
    }

    private void freeTextSection(List<AstNode> out) {
        while (!atEof() && !isBlankLine() && !src.startsWith("X:", pos)) {
            int end = contentEnd();
            out.add(take(TT.FREE_TXT, end - pos));
            addEol(out);
        }
    }

    private Tune parseTune() {
        var headerLines = new ArrayList<AstNode>();
        parseHeaderLine(headerLines);
        boolean sawKey = false;
        while (!sawKey && !atEof() && !isBlankLine() && isHeaderLine()) {
            sawKey = src.startsWith("K:", pos);
            parseHeaderLine(headerLines);
        }
        var header = new TuneHeader(ctx.generateId(), headerLines);

        TuneBody body = null;
        if (!atEof() && !isBlankLine()) {
            var systems = new ArrayList<List<AstNode>>();
            while (!atEof() && !isBlankLine()) {
                systems.add(parseBodyLine());
            }
            body = new TuneBody(ctx.generateId(), systems);
        }
        return new Tune(ctx.generateId(), header, body);
    }

    private boolean isHeaderLine() {
        return src.startsWith("%", pos) || isInfoLineStart();
    }

    /** Parses one header line (info line, comment, directive or free text) and its line break. */
    private void parseHeaderLine(List<AstNode> out) {
        if (src.startsWith("%%", pos)) {
            out.add(parseDirective());
        } else if (src.startsWith("%", pos)) {
            out.add(new Comment(ctx.generateId(), take(TT.COMMENT, contentEnd() - pos)));
        } else if (isInfoLineStart()) {
            out.add(parseInfoLine());
        } else {
            out.add(take(TT.FREE_TXT, contentEnd() - pos));
        }
        addEol(out);
    }

    private List<AstNode> parseBodyLine() {
        var system = new ArrayList<AstNode>();
        if (src.startsWith("%%", pos)) {
            system.add(parseDirective());
        } else if (src.startsWith("%", pos)) {
            system.add(new Comment(ctx.generateId(), take(TT.COMMENT, contentEnd() - pos)));
        } else if (src.startsWith("w:", pos) || src.startsWith("W:", pos)) {
            system.add(parseLyricLine());
        } else if (isInfoLineStart()) {
            system.add(parseInfoLine());
        } else {
            system.addAll(groupBeams(parseMusic(contentEnd())));
        }
        addEol(system);
        return system;
    }

    // ---------------------------------------------------------------------
    // Info lines, directives, lyrics
    // ---------------------------------------------------------------------

    private InfoLine parseInfoLine() {
        var key = take(TT.INF_HDR, 2);
        int end = contentEnd();
        int commentAt = src.indexOf('%', pos);
        int valueEnd = commentAt >= 0 && commentAt < end ? commentAt : end;
        var value = new ArrayList<AstNode>(parseInfoValue(valueEnd));
        if (pos < end) {
            value.add(new Comment(ctx.generateId(), take(TT.COMMENT, end - pos)));
        }
        return new InfoLine(ctx.generateId(), key, value);
    }

    private Directive parseDirective() {
        int end = contentEnd();
        int keyEnd = pos + 2;
        while (keyEnd < end && isIdentifierChar(src.charAt(keyEnd))) {
            keyEnd++;
        }
        var key = take(TT.STYLESHEET_DIRECTIVE, keyEnd - pos);
        return new Directive(ctx.generateId(), key, parseInfoValue(end));
    }

    private LyricLine parseLyricLine() {
        var header = take(TT.LY_HDR, 2);
        var contents = new ArrayList<AstNode>();
        int end = contentEnd();
        if (pos < end) {
            contents.add(take(TT.LY_TXT, end - pos));
        }
        return new LyricLine(ctx.generateId(), header, contents);
    }

    /** Tokenizes an info-line value up to {@code end} and folds the tokens into expressions. */
    private List<AstNode> parseInfoValue(int end) {
        var tokens = new ArrayList<Token>();
        while (pos < end) {
            char c = src.charAt(pos);
            if (c == ' ' || c == '\t') {
                tokens.add(take(TT.WS, runLength(end, ch -> ch == ' ' || ch == '\t')));
            } else if (c == '"') {
                int close = src.indexOf('"', pos + 1);
                int stop = close >= 0 && close < end ? close + 1 : end;
                tokens.add(take(TT.STRING, stop - pos));
            } else if (Character.isDigit(c)) {
                int len = runLength(end, Character::isDigit);
                if (pos + len + 1 < end
                        && src.charAt(pos + len) == '.'
                        && Character.isDigit(src.charAt(pos + len + 1))) {
                    len++;
                    while (pos + len < end && Character.isDigit(src.charAt(pos + len))) {
                        len++;
                    }
                }
                tokens.add(take(TT.NUMBER, len));
            } else if (Character.isLetter(c) || c == '_') {
                tokens.add(take(TT.IDENTIFIER, runLength(end, AbcParser::isIdentifierChar)));
            } else if (c == '=') {
                tokens.add(take(TT.EQL, 1));
            } else if (c == '+') {
                tokens.add(take(TT.PLUS, 1));
            } else if (c == '-') {
                tokens.add(take(TT.MINUS, 1));
            } else if (c == '/') {
                tokens.add(take(TT.SLASH, 1));
            } else if (c == '(') {
                tokens.add(take(TT.LPAREN, 1));
            } else if (c == ')') {
                tokens.add(take(TT.RPAREN, 1));
            } else {
                tokens.add(take(TT.INFO_STR, runLength(end, AbcParser::isInfoStrChar)));
            }
        }
        return new InfoExpressionFolder(tokens).fold();
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '#';
    }

    private static boolean isInfoStrChar(char c) {
        return !(c == ' '
                || c == '\t'
                || c == '"'
                || Character.isLetterOrDigit(c)
                || c == '_'
                || "=+-/()".indexOf(c) >= 0);
    }

    /** Folds info-value tokens into key/value, binary, unary and grouping expressions. */
    private final class InfoExpressionFolder {
        private final List<Token> tokens;
        private int k;

        InfoExpressionFolder(List<Token> tokens) {
            this.tokens = tokens;
        }

        List<AstNode> fold() {
            var out = new ArrayList<AstNode>();
            while (k < tokens.size()) {
                var t = tokens.get(k);
                if (t.type() == TT.IDENTIFIER && peekType(1) == TT.EQL && startsExpression(k + 2)) {
                    k += 2;
                    var eq = tokens.get(k - 1);
                    AstNode value = "middle".equals(t.lexeme()) ? absolutePitchOrExpr() : expression();
                    out.add(new Kv(ctx.generateId(), t, eq, value));
                } else if (startsExpression(k)) {
                    out.add(expression());
                } else {
                    out.add(t);
                    k++;
                }
            }
            return out;
        }

        private @Nullable TT peekType(int offset) {
            int i = k + offset;
            return i < tokens.size() ? tokens.get(i).type() : null;
        }

        private boolean startsExpression(int i) {
            if (i >= tokens.size()) {
                return false;
            }
            return switch (tokens.get(i).type()) {
                case NUMBER, IDENTIFIER, STRING -> true;
                case LPAREN -> startsExpression(i + 1);
                case PLUS, MINUS -> startsExpression(i + 1);
                default -> false;
            };
        }

        private AstNode expression() {
            AstNode left = unary();
            while ((peekType(0) == TT.PLUS || peekType(0) == TT.SLASH) && startsExpression(k + 1)) {
                var op = tokens.get(k++);
                left = new Binary(ctx.generateId(), left, op, unary());
            }
            return left;
        }

        private AstNode unary() {
            var t = tokens.get(k);
            if (t.type() == TT.PLUS || t.type() == TT.MINUS) {
                k++;
                return new Unary(ctx.generateId(), t, unary());
            }
            if (t.type() == TT.LPAREN) {
                k++;
                var inner = expression();
                Token close = null;
                if (peekType(0) == TT.RPAREN) {
                    close = tokens.get(k++);
                }
                return new Grouping(ctx.generateId(), t, inner, close);
            }
            k++;
            return t;
        }

        private AstNode absolutePitchOrExpr() {
            var t = tokens.get(k);
            var lexeme = t.lexeme();
            if (t.type() != TT.IDENTIFIER || !lexeme.matches("[A-Ga-g][#b]?")) {
                return expression();
            }
            k++;
            var letter = new Token(TT.NOTE_LETTER, lexeme.substring(0, 1), t.line(), t.position(), ctx.generateId());
            Token alteration = null;
            if (lexeme.length() == 2) {
                alteration =
                        new Token(TT.ACCIDENTAL, lexeme.substring(1), t.line(), t.position() + 1, ctx.generateId());
            }
            Token octave = null;
            if (k < tokens.size() && tokens.get(k).lexeme().matches("[,']+")) {
                var o = tokens.get(k++);
                octave = new Token(TT.OCTAVE, o.lexeme(), o.line(), o.position(), ctx.generateId());
            }
            return new AbsolutePitch(ctx.generateId(), letter, alteration, octave);
        }
    }

    // ---------------------------------------------------------------------
    // Music code
    // ---------------------------------------------------------------------

    private List<AstNode> parseMusic(int end) {
        var items = new ArrayList<AstNode>();
        while (pos < end) {
            items.add(parseMusicElement(end));
        }
        return items;
    }

    private AstNode parseMusicElement(int end) {
        char c = src.charAt(pos);
        char next = pos + 1 < end ? src.charAt(pos + 1) : '\0';
        if (c == ' ' || c == '\t') {
            return take(TT.WS, runLength(end, ch -> ch == ' ' || ch == '\t'));
        }
        if (c == '%') {
            return new Comment(ctx.generateId(), take(TT.COMMENT, end - pos));
        }
        if (c == '"') {
            return parseQuoted(end);
        }
        if (c == '!' || c == '+') {
            int close = src.indexOf(c, pos + 1);
            if (close < 0 || close >= end) {
                return error(1);
            }
            return new Decoration(ctx.generateId(), take(TT.DECORATION, close + 1 - pos));
        }
        if (DECORATION_CHARS.indexOf(c) >= 0) {
            return new Decoration(ctx.generateId(), take(TT.DECORATION, 1));
        }
        if (c == '[') {
            if (Character.isLetter(next) && pos + 2 < end && src.charAt(pos + 2) == ':') {
                return parseInlineField(end);
            }
            if (next == '|' || Character.isDigit(next)) {
                return parseBarLine(end);
            }
            return parseChord(end);
        }
        if (c == '|' || c == ':') {
            return parseBarLine(end);
        }
        if (c == '{') {
            return parseGraceGroup(end);
        }
        if (c == '(') {
            return Character.isDigit(next) ? parseTuplet(end) : take(TT.SLUR, 1);
        }
        if (c == ')') {
            return take(TT.SLUR, 1);
        }
        if (isNoteStart(end)) {
            return parseNote(end);
        }
        if (c == 'z' || c == 'x') {
            var rest = take(TT.REST, 1);
            return new Rest(ctx.generateId(), rest, parseRhythm(end));
        }
        if (c == 'Z' || c == 'X') {
            var rest = take(TT.MMR_REST, 1);
            Token length = null;
            if (pos < end && Character.isDigit(src.charAt(pos))) {
                length = take(TT.MMR_LENGTH, runLength(end, Character::isDigit));
            }
            return new MultiMeasureRest(ctx.generateId(), rest, length);
        }
        if (c == 'y') {
            var spacer = take(TT.Y_SPC, 1);
            return new YSpacer(ctx.generateId(), spacer, parseRhythm(end));
        }
        if (c == '&') {
            return new VoiceOverlay(ctx.generateId(), List.of(take(TT.VOICE_OVRLAY, 1)));
        }
        if (c == '\\') {
            return new LineContinuation(ctx.generateId(), take(TT.LINE_CONT, 1));
        }
        if (c == '$') {
            return new SystemBreak(ctx.generateId(), take(TT.SYSTEM_BREAK, 1));
        }
        return error(1);
    }

    private ErrorExpr error(int length) {
        return new ErrorExpr(ctx.generateId(), List.of(take(TT.INVALID, length)));
    }

    private AstNode parseQuoted(int end) {
        int close = src.indexOf('"', pos + 1);
        int stop = close >= 0 && close < end ? close + 1 : end;
        char first = pos + 1 < stop ? src.charAt(pos + 1) : '\0';
        if (first != '\0' && "^_<>@".indexOf(first) >= 0) {
            return new Annotation(ctx.generateId(), take(TT.ANNOTATION, stop - pos));
        }
        return new ChordSymbol(ctx.generateId(), take(TT.CHORD_SYMBOL, stop - pos));
    }

    private boolean isNoteStart(int end) {
        return pos + accidentalLength(end) < end && isNoteLetter(src.charAt(pos + accidentalLength(end)));
    }

    private int accidentalLength(int end) {
        char c = src.charAt(pos);
        if (c == '^' || c == '_') {
            return pos + 1 < end && src.charAt(pos + 1) == c ? 2 : 1;
        }
        return c == '=' ? 1 : 0;
    }

    private static boolean isNoteLetter(char c) {
        return (c >= 'A' && c <= 'G') || (c >= 'a' && c <= 'g');
    }

    private Note parseNote(int end) {
        var pitch = parsePitch(end);
        var rhythm = parseRhythm(end);
        Token tie = null;
        if (pos < end && src.charAt(pos) == '-') {
            tie = take(TT.TIE, 1);
        }
        return new Note(ctx.generateId(), pitch, rhythm, tie);
    }

    private Pitch parsePitch(int end) {
        Token alteration = null;
        int accLen = accidentalLength(end);
        if (accLen > 0) {
            alteration = take(TT.ACCIDENTAL, accLen);
        }
        var letter = take(TT.NOTE_LETTER, 1);
        Token octave = null;
        int octLen = runLength(end, ch -> ch == ',' || ch == '\'');
        if (octLen > 0) {
            octave = take(TT.OCTAVE, octLen);
        }
        return new Pitch(ctx.generateId(), alteration, letter, octave);
    }

    private @Nullable Rhythm parseRhythm(int end) {
        Token numerator = null;
        Token separator = null;
        Token denominator = null;
        Token broken = null;
        int len = runLength(end, Character::isDigit);
        if (len > 0) {
            numerator = take(TT.RHY_NUMER, len);
        }
        len = runLength(end, ch -> ch == '/');
        if (len > 0) {
            separator = take(TT.RHY_SEP, len);
            len = runLength(end, Character::isDigit);
            if (len > 0) {
                denominator = take(TT.RHY_DENOM, len);
            }
        }
        if (pos < end && (src.charAt(pos) == '>' || src.charAt(pos) == '<')) {
            char b = src.charAt(pos);
            broken = take(TT.RHY_BRKN, runLength(end, ch -> ch == b));
        }
        if (numerator == null && separator == null && broken == null) {
            return null;
        }
        return new Rhythm(ctx.generateId(), numerator, separator, denominator, broken);
    }

    private Chord parseChord(int end) {
        var left = take(TT.CHRD_LEFT_BRKT, 1);
        var contents = new ArrayList<AstNode>();
        while (pos < end && src.charAt(pos) != ']') {
            char c = src.charAt(pos);
            if (isNoteStart(end)) {
                contents.add(parseNote(end));
            } else if (c == ' ' || c == '\t') {
                contents.add(take(TT.WS, runLength(end, ch -> ch == ' ' || ch == '\t')));
            } else if (c == '"') {
                contents.add(parseQuoted(end));
            } else if (DECORATION_CHARS.indexOf(c) >= 0) {
                contents.add(new Decoration(ctx.generateId(), take(TT.DECORATION, 1)));
            } else {
                break;
            }
        }
        Token right = null;
        if (pos < end && src.charAt(pos) == ']') {
            right = take(TT.CHRD_RIGHT_BRKT, 1);
        }
        var rhythm = parseRhythm(end);
        Token tie = null;
        if (pos < end && src.charAt(pos) == '-') {
            tie = take(TT.TIE, 1);
        }
        return new Chord(ctx.generateId(), left, contents, right, rhythm, tie);
    }

    private GraceGroup parseGraceGroup(int end) {
        var left = take(TT.GRC_GRP_LEFT_BRACE, 1);
        Token slash = null;
        if (pos < end && src.charAt(pos) == '/') {
            slash = take(TT.GRC_GRP_SLSH, 1);
        }
        var notes = new ArrayList<AstNode>();
        while (pos < end && src.charAt(pos) != '}') {
            char c = src.charAt(pos);
            if (isNoteStart(end)) {
                notes.add(parseNote(end));
            } else if (c == ' ' || c == '\t') {
                notes.add(take(TT.WS, runLength(end, ch -> ch == ' ' || ch == '\t')));
            } else {
                break;
            }
        }
        Token right = null;
        if (pos < end && src.charAt(pos) == '}') {
            right = take(TT.GRC_GRP_RGHT_BRACE, 1);
        }
        return new GraceGroup(ctx.generateId(), left, slash, notes, right);
    }

    private InlineField parseInlineField(int end) {
        var left = take(TT.INLN_FLD_LFT_BRKT, 1);
        var field = take(TT.INF_HDR, 2);
        var text = new ArrayList<Token>();
        int close = src.indexOf(']', pos);
        int stop = close >= 0 && close < end ? close : end;
        if (stop > pos) {
            text.add(take(TT.INFO_STR, stop - pos));
        }
        Token right = null;
        if (pos < end && src.charAt(pos) == ']') {
            right = take(TT.INLN_FLD_RGT_BRKT, 1);
        }
        return new InlineField(ctx.generateId(), left, field, text, right);
    }

    private BarLine parseBarLine(int end) {
        var barline = new ArrayList<Token>();
        int start = pos;
        int i = pos;
        if (src.charAt(i) == '[' && i + 1 < end && Character.isDigit(src.charAt(i + 1))) {
            i++;
        } else {
            if (src.charAt(i) == '[') {
                i++;
            }
            while (i < end && (src.charAt(i) == '|' || src.charAt(i) == ':')) {
                i++;
            }
            if (i < end && src.charAt(i) == ']' && src.charAt(i - 1) == '|') {
                i++;
            }
        }
        barline.add(take(TT.BARLINE, i - start));

        List<Token> repeats = null;
        if (pos < end && Character.isDigit(src.charAt(pos))) {
            repeats = new ArrayList<>();
            while (pos < end) {
                char c = src.charAt(pos);
                if (Character.isDigit(c)) {
                    repeats.add(take(TT.REPEAT_NUMBER, runLength(end, Character::isDigit)));
                } else if ((c == ',' || c == '-') && pos + 1 < end && Character.isDigit(src.charAt(pos + 1))) {
                    repeats.add(take(c == ',' ? TT.REPEAT_COMMA : TT.REPEAT_DASH, 1));
                } else {
                    break;
                }
            }
        }
        return new BarLine(ctx.generateId(), barline, repeats);
    }

    private Tuplet parseTuplet(int end) {
        var left = take(TT.TUPLET_LPAREN, 1);
        var p = take(TT.TUPLET_P, runLength(end, Character::isDigit));
        Token firstColon = null;
        Token q = null;
        Token secondColon = null;
        Token r = null;
        if (pos < end && src.charAt(pos) == ':') {
            firstColon = take(TT.TUPLET_COLON, 1);
            int len = runLength(end, Character::isDigit);
            if (len > 0) {
                q = take(TT.TUPLET_Q, len);
            }
            if (pos < end && src.charAt(pos) == ':') {
                secondColon = take(TT.TUPLET_COLON, 1);
                len = runLength(end, Character::isDigit);
                if (len > 0) {
                    r = take(TT.TUPLET_R, len);
                }
            }
        }
        return new Tuplet(ctx.generateId(), left, p, firstColon, q, secondColon, r);
    }

    /** Wraps runs of two or more notes/chords written without whitespace into beams. */
    private List<AstNode> groupBeams(List<AstNode> items) {
        var grouped = new ArrayList<AstNode>();
        var run = new ArrayList<AstNode>();
        for (var item : items) {
            if (isBeamable(item)) {
                run.add(item);
            } else {
                flushRun(run, grouped);
                grouped.add(item);
            }
        }
        flushRun(run, grouped);
        return grouped;
    }

    private void flushRun(List<AstNode> run, List<AstNode> grouped) {
        long anchors = run.stream().filter(n -> n instanceof Note || n instanceof Chord).count();
        if (anchors >= 2) {
            grouped.add(new Beam(ctx.generateId(), new ArrayList<>(run)));
        } else {
            grouped.addAll(run);
        }
        run.clear();
    }

    private static boolean isBeamable(AstNode node) {
        if (node instanceof Token t) {
            return t.type() == TT.SLUR;
        }
        return node instanceof Note
                || node instanceof Chord
                || node instanceof GraceGroup
                || node instanceof Decoration
                || node instanceof Annotation
                || node instanceof ChordSymbol
                || node instanceof Tuplet;
    }

    // ---------------------------------------------------------------------
    // Lines and tokens
    // ---------------------------------------------------------------------

    private boolean atEof() {
        return pos >= src.length();
    }

    private boolean isInfoLineStart() {
        return pos + 1 < src.length() && Character.isLetter(src.charAt(pos)) && src.charAt(pos + 1) == ':';
    }

    private boolean isBlankLine() {
        int i = pos;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (c == '\n') {
                return true;
            }
            if (c != ' ' && c != '\t' && c != '\r') {
                return false;
            }
            i++;
        }
        return true;
    }

    private Token blankLine() {
        int nl = src.indexOf('\n', pos);
        int stop = nl < 0 ? src.length() : nl + 1;
        var t = take(TT.SCT_BRK, stop - pos);
        if (nl >= 0) {
            newLine();
        }
        return t;
    }

    /** End of the current line's content, excluding the line terminator. */
    private int contentEnd() {
        int nl = src.indexOf('\n', pos);
        if (nl < 0) {
            return src.length();
        }
        return nl > pos && src.charAt(nl - 1) == '\r' ? nl - 1 : nl;
    }

    private void addEol(List<AstNode> out) {
        if (atEof()) {
            return;
        }
        int nl = src.indexOf('\n', pos);
        out.add(take(TT.EOL, nl + 1 - pos));
        newLine();
    }

    private void newLine() {
        line++;
        lineStart = pos;
    }

    private Token take(TT type, int length) {
        var t = new Token(type, src.substring(pos, pos + length), line, pos - lineStart, ctx.generateId());
        pos += length;
        return t;
    }

    private int runLength(int end, CharPredicate predicate) {
        int i = pos;
        while (i < end && predicate.test(src.charAt(i))) {
            i++;
        }
        return i - pos;
    }

    @FunctionalInterface
    private interface CharPredicate {
        boolean test(char c);
    }
}
