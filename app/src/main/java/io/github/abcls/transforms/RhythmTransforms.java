package io.github.abcls.transforms;

import io.github.abcls.parser.AbcContext;
import io.github.abcls.selection.Selection;
import java.util.function.UnaryOperator;

/**
 * Duration edits on the notes, chords and rests in scope. A chord's duration is the chord's own rhythm, so the
 * notes inside a selected chord are not edited individually. Results that are not positive clamp to {@code 1/1}.
 */
public final class RhythmTransforms {
    public static final int DEFAULT_FACTOR = 2;

    private RhythmTransforms() {
        // utility
    }

    public static Selection setRhythm(Selection selection, AbcContext ctx, Rational value) {
        return apply(selection, ctx, current -> value);
    }

    public static Selection addToRhythm(Selection selection, AbcContext ctx, Rational delta) {
        return apply(selection, ctx, current -> current.add(delta));
    }

    public static Selection multiplyRhythm(Selection selection, AbcContext ctx, int factor) {
        checkFactor(factor);
        return apply(selection, ctx, current -> current.multiply(Rational.of(factor)));
    }

    public static Selection divideRhythm(Selection selection, AbcContext ctx, int factor) {
        checkFactor(factor);
        return apply(selection, ctx, current -> current.divide(Rational.of(factor)));
    }

    private static void checkFactor(int factor) {
        if (factor <= 0) {
            throw new IllegalArgumentException("Factor must be positive, got " + factor);
        }
    }

    private static Selection apply(Selection selection, AbcContext ctx, UnaryOperator<Rational> change) {
        for (var node : TransformTargets.timedElements(selection)) {
            var current = Rhythms.getNodeRhythm(node);
            var next = change.apply(current);
            if (!next.isPositive()) {
                next = Rational.ONE;
            }
            // an unchanged value keeps its original spelling, e.g. "/2"
            if (!next.equals(current)) {
                Rhythms.setNodeRhythm(node, next, ctx);
            }
        }
        return selection;
    }
}
