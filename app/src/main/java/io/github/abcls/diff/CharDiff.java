package io.github.abcls.diff;

import java.util.ArrayList;
import java.util.List;

/**
 * Character-level diff built on a longest-common-subsequence table. Unchanged leading and trailing text is
 * stripped before the table is built, so its size depends only on the region that differs.
 */
public final class CharDiff {
    private CharDiff() {
        // utility
    }

    /** Edits turning {@code oldText} into {@code newText}, in document order. */
    public static List<Change> diff(String oldText, String newText) {
        if (oldText.equals(newText)) {
            return List.of();
        }
        if (oldText.isEmpty()) {
            return List.of(Change.insert(0, newText));
        }
        if (newText.isEmpty()) {
            return List.of(Change.delete(0, oldText.length() - 1));
        }

        int prefix = 0;
        int maxPrefix = Math.min(oldText.length(), newText.length());
        while (prefix < maxPrefix && oldText.charAt(prefix) == newText.charAt(prefix)) {
            prefix++;
        }
        int suffix = 0;
        int maxSuffix = maxPrefix - prefix;
        while (suffix < maxSuffix
                && oldText.charAt(oldText.length() - 1 - suffix) == newText.charAt(newText.length() - 1 - suffix)) {
            suffix++;
        }
        var oldMid = oldText.substring(prefix, oldText.length() - suffix);
        var newMid = newText.substring(prefix, newText.length() - suffix);

        var changes = new ArrayList<Change>();
        var pairs = lcsPairs(oldMid, newMid);
        int oldIdx = 0;
        int newIdx = 0;
        for (int p = 0; p <= pairs.size(); p++) {
            int nextOld = p < pairs.size() ? pairs.get(p)[0] : oldMid.length();
            int nextNew = p < pairs.size() ? pairs.get(p)[1] : newMid.length();
            int deleted = nextOld - oldIdx;
            var inserted = newMid.substring(newIdx, nextNew);
            int start = prefix + oldIdx;
            if (deleted > 0 && !inserted.isEmpty()) {
                changes.add(Change.replace(start, start + deleted - 1, inserted));
            } else if (deleted > 0) {
                changes.add(Change.delete(start, start + deleted - 1));
            } else if (!inserted.isEmpty()) {
                changes.add(Change.insert(start, inserted));
            }
            oldIdx = nextOld + 1;
            newIdx = nextNew + 1;
        }
        return changes;
    }

    /** Matching index pairs {@code [oldIndex, newIndex]} of one longest common subsequence, in order. */
    static List<int[]> lcsPairs(String a, String b) {
        int m = a.length();
        int n = b.length();
        var dp = new int[m + 1][n + 1];
        for (int i = 1; i <= m; i++) {
            for (int j = 1; j <= n; j++) {
                if (a.charAt(i - 1) == b.charAt(j - 1)) {
                    dp[i][j] = dp[i - 1][j - 1] + 1;
                } else {
                    dp[i][j] = Math.max(dp[i - 1][j], dp[i][j - 1]);
                }
            }
        }
        var reversed = new ArrayList<int[]>();
        int i = m;
        int j = n;
        while (i > 0 && j > 0) {
            if (a.charAt(i - 1) == b.charAt(j - 1)) {
                reversed.add(new int[] {i - 1, j - 1});
                i--;
                j--;
            } else if (dp[i - 1][j] > dp[i][j - 1]) {
                i--;
            } else {
                j--;
            }
        }
        var pairs = new ArrayList<int[]>(reversed.size());
        for (int k = reversed.size() - 1; k >= 0; k--) {
            pairs.add(reversed.get(k));
        }
        return pairs;
    }

    /** Applies {@code changes} (as produced by {@link #diff}) to {@code oldText}, last change first. */
    public static String apply(String oldText, List<Change> changes) {
        var sb = new StringBuilder(oldText);
        for (int k = changes.size() - 1; k >= 0; k--) {
            var change = changes.get(k);
            sb.replace(change.startOffset(), change.endOffset(), change.newContent());
        }
        return sb.toString();
    }
}
