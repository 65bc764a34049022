package io.github.abcls.registry;

import java.util.List;

final class Arity {
    private Arity() {
        // utility
    }

    static void check(String name, int min, int max, List<?> args) {
        if (args.size() < min || args.size() > max) {
            var expected = min == max ? Integer.toString(min) : min + ".." + max;
            throw new IllegalArgumentException(
                    name + " expects " + expected + " argument(s), got " + args.size());
        }
    }
}
