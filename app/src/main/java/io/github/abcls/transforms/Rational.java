package io.github.abcls.transforms;

/**
 * A duration relative to the tune's unit note length. Always stored reduced, with a positive denominator.
 */
public record Rational(int numerator, int denominator) implements Comparable<Rational> {
    public static final Rational ZERO = new Rational(0, 1);
    public static final Rational ONE = new Rational(1, 1);

    public Rational {
        if (denominator == 0) {
            throw new IllegalArgumentException("Denominator must not be zero");
        }
        if (denominator < 0) {
            numerator = -numerator;
            denominator = -denominator;
        }
        int gcd = gcd(Math.abs(numerator), denominator);
        if (gcd > 1) {
            numerator /= gcd;
            denominator /= gcd;
        }
    }

    public static Rational of(int numerator, int denominator) {
        return new Rational(numerator, denominator);
    }

    public static Rational of(int whole) {
        return new Rational(whole, 1);
    }

    /**
     * Parses {@code "3/4"}, {@code "2"} or {@code "-1/2"}.
     *
     * @throws IllegalArgumentException on anything else
     */
    public static Rational parse(String text) {
        var trimmed = text.trim();
        int slash = trimmed.indexOf('/');
        try {
            if (slash < 0) {
                return of(Integer.parseInt(trimmed));
            }
            return of(
                    Integer.parseInt(trimmed.substring(0, slash).trim()),
                    Integer.parseInt(trimmed.substring(slash + 1).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a rational: '" + text + "'", e);
        }
    }

    public Rational add(Rational other) {
        return of(
                Math.addExact(
                        Math.multiplyExact(numerator, other.denominator),
                        Math.multiplyExact(other.numerator, denominator)),
                Math.multiplyExact(denominator, other.denominator));
    }

    public Rational multiply(Rational other) {
        return of(Math.multiplyExact(numerator, other.numerator), Math.multiplyExact(denominator, other.denominator));
    }

    public Rational divide(Rational other) {
        if (other.numerator == 0) {
            throw new ArithmeticException("Division by zero");
        }
        return of(Math.multiplyExact(numerator, other.denominator), Math.multiplyExact(denominator, other.numerator));
    }

    public boolean isPositive() {
        return numerator > 0;
    }

    @Override
    public int compareTo(Rational other) {
        return Long.compare((long) numerator * other.denominator, (long) other.numerator * denominator);
    }

    @Override
    public String toString() {
        return denominator == 1 ? Integer.toString(numerator) : numerator + "/" + denominator;
    }

    private static int gcd(int a, int b) {
        while (b != 0) {
            int t = a % b;
            a = b;
            b = t;
        }
        return a;
    }
}
