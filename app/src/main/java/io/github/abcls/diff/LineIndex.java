package io.github.abcls.diff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Maps character offsets of a text to 0-based line and column. */
final class LineIndex {
    private final List<Integer> lineStarts = new ArrayList<>();

    LineIndex(String text) {
        lineStarts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lineStarts.add(i + 1);
            }
        }
    }

    int line(int offset) {
        int found = Collections.binarySearch(lineStarts, offset);
        return found >= 0 ? found : -found - 2;
    }

    int column(int offset) {
        return offset - lineStarts.get(line(offset));
    }
}
