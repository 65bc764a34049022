package io.github.abcls.transforms;

import io.github.abcls.cstree.CSNode;
import io.github.abcls.cstree.Tag;
import io.github.abcls.cstree.TreeUtils;
import io.github.abcls.parser.AbcContext;
import io.github.abcls.parser.TT;
import java.util.ArrayList;
import org.jetbrains.annotations.Nullable;

/**
 * Conversions between {@link Tag#RHYTHM} subtrees and {@link Rational} durations.
 *
 * <p>Textual forms: {@code 2} is 2/1, {@code /} is 1/2, {@code //} is 1/4, {@code 3/4} is 3/4. A broken-rhythm
 * marker ({@code >}, {@code <}) does not change the value.
 */
public final class Rhythms {
    private Rhythms() {
        // utility
    }

    /**
     * @throws IllegalArgumentException when a numerator, denominator or slash run does not fit an {@code int}
     *     duration
     */
    public static Rational rhythmToRational(CSNode rhythm) {
        int numerator = 1;
        int slashes = 0;
        Integer denominator = null;
        for (var child = rhythm.firstChild(); child != null; child = child.nextSibling()) {
            var data = child.data();
            if (data == null) {
                continue;
            }
            switch (data.tokenType()) {
                case RHY_NUMER -> numerator = parseCount(data.lexeme());
                case RHY_SEP -> slashes = data.lexeme().length();
                case RHY_DENOM -> denominator = parseCount(data.lexeme());
                default -> {}
            }
        }
        if (denominator != null) {
            return Rational.of(numerator, shifted(denominator, Math.max(0, slashes - 1)));
        }
        return Rational.of(numerator, shifted(1, slashes));
    }

    private static int parseCount(String digits) {
        long value;
        try {
            value = Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Rhythm value out of range: " + digits, e);
        }
        if (value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Rhythm value out of range: " + digits);
        }
        return (int) value;
    }

    private static int shifted(int value, int halvings) {
        long result = (long) value << Math.min(halvings, 32);
        if (halvings >= 32 || result > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                    "Rhythm denominator out of range: " + value + " halved " + halvings + " times");
        }
        return (int) result;
    }

    /** Duration of a note, chord or rest; {@code 1/1} when it has no rhythm child. */
    public static Rational getNodeRhythm(CSNode node) {
        var rhythm = TreeUtils.findRhythmChild(node);
        return rhythm == null ? Rational.ONE : rhythmToRational(rhythm.node());
    }

    /**
     * Builds a rhythm subtree for {@code value}. Non-positive values clamp to {@code 1/1}, which has no text of
     * its own: the result is then {@code null}, or a rhythm holding only {@code broken} when one is given.
     */
    public static @Nullable CSNode rationalToRhythm(Rational value, @Nullable CSNode broken, AbcContext ctx) {
        var r = value.isPositive() ? value : Rational.ONE;
        var children = new ArrayList<CSNode>();
        if (r.numerator() != 1) {
            children.add(CSNode.token(ctx, TT.RHY_NUMER, Integer.toString(r.numerator())));
        }
        if (r.denominator() != 1) {
            children.add(CSNode.token(ctx, TT.RHY_SEP, "/"));
            if (r.denominator() != 2) {
                children.add(CSNode.token(ctx, TT.RHY_DENOM, Integer.toString(r.denominator())));
            }
        }
        if (broken != null) {
            children.add(broken);
        }
        if (children.isEmpty()) {
            return null;
        }
        return CSNode.interior(ctx, Tag.RHYTHM, children);
    }

    /** Rewrites the rhythm of a note, chord or rest, keeping any broken-rhythm marker it already had. */
    public static void setNodeRhythm(CSNode node, Rational value, AbcContext ctx) {
        var existing = TreeUtils.findRhythmChild(node);
        CSNode broken = null;
        if (existing != null) {
            var marker = TreeUtils.findChildByTokenType(existing.node(), TT.RHY_BRKN);
            if (marker != null) {
                TreeUtils.removeChild(existing.node(), marker.node());
                broken = marker.node();
            }
        }
        TreeUtils.replaceRhythm(node, rationalToRhythm(value, broken, ctx));
    }
}
