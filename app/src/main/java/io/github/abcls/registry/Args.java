package io.github.abcls.registry;

import io.github.abcls.transforms.Rational;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Coerces loosely typed request arguments. Wire arguments arrive as numbers or strings; integral doubles and numeric
 * strings are accepted where an integer is expected.
 */
public final class Args {
    private Args() {
        // utility
    }

    public static int intArg(List<?> args, int index, String name) {
        var value = args.get(index);
        if (value instanceof Integer i) {
            return i;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) <= Integer.MAX_VALUE) {
                return (int) d;
            }
        } else if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " must be an integer, got '" + s + "'", e);
            }
        }
        throw new IllegalArgumentException(name + " must be an integer, got " + value);
    }

    public static int intArg(List<?> args, int index, String name, int defaultValue) {
        return index < args.size() ? intArg(args, index, name) : defaultValue;
    }

    public static String stringArg(List<?> args, int index, String name) {
        var value = args.get(index);
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d == Math.rint(d) ? Long.toString(n.longValue()) : n.toString();
        }
        throw new IllegalArgumentException(name + " must be a string, got " + value);
    }

    /** Reads either {@code numerator, denominator} as two numbers, or a single {@code "n/d"} string. */
    public static Rational rationalArg(List<?> args, String name) {
        if (args.size() >= 2) {
            int numerator = intArg(args, 0, name + " numerator");
            int denominator = intArg(args, 1, name + " denominator");
            if (denominator == 0) {
                throw new IllegalArgumentException(name + " denominator must not be zero");
            }
            return Rational.of(numerator, denominator);
        }
        var first = args.get(0);
        if (first instanceof String s) {
            return Rational.parse(s);
        }
        return Rational.of(intArg(args, 0, name));
    }

    public static List<String> stringArgs(List<?> args, int from, String name) {
        return IntStream.range(from, args.size())
                .mapToObj(i -> stringArg(args, i, name))
                .toList();
    }
}
