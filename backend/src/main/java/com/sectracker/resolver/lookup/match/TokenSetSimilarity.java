package com.sectracker.resolver.lookup.match;

import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Token-set similarity: order- and duplicate-insensitive comparison of whitespace tokens.
 * Both sides are reduced to sorted token sets; the shared tokens are compared against each side's
 * shared-plus-remaining tokens using an insertion/deletion ratio, and the best of the three
 * comparisons wins. A side whose tokens are all shared with the other scores 1.0.
 */
public class TokenSetSimilarity {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        Set<String> tokens1 = tokenize(s1);
        Set<String> tokens2 = tokenize(s2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        TreeSet<String> intersection = new TreeSet<>(tokens1);
        intersection.retainAll(tokens2);
        TreeSet<String> diff12 = new TreeSet<>(tokens1);
        diff12.removeAll(tokens2);
        TreeSet<String> diff21 = new TreeSet<>(tokens2);
        diff21.removeAll(tokens1);

        if (!intersection.isEmpty() && (diff12.isEmpty() || diff21.isEmpty())) {
            return 1.0;
        }

        String sect = String.join(" ", intersection);
        String sect12 = join(sect, String.join(" ", diff12));
        String sect21 = join(sect, String.join(" ", diff21));

        double best = indelRatio(sect12, sect21);
        if (!sect.isEmpty()) {
            best = Math.max(best, indelRatio(sect, sect12));
            best = Math.max(best, indelRatio(sect, sect21));
        }
        return best;
    }

    private Set<String> tokenize(String value) {
        Set<String> tokens = new TreeSet<>();
        for (String token : WHITESPACE.split(value.trim())) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private String join(String sect, String diff) {
        if (sect.isEmpty()) {
            return diff;
        }
        if (diff.isEmpty()) {
            return sect;
        }
        return sect + " " + diff;
    }

    /**
     * 1 - indel_distance / (len1 + len2), where the indel distance counts insertions and deletions only.
     */
    static double indelRatio(String s1, String s2) {
        int total = s1.length() + s2.length();
        if (total == 0) {
            return 1.0;
        }
        int lcs = longestCommonSubsequence(s1, s2);
        int distance = total - 2 * lcs;
        return 1.0 - ((double) distance / total);
    }

    private static int longestCommonSubsequence(String s1, String s2) {
        if (s1.length() < s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }
        int m = s2.length();
        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];

        for (int i = 1; i <= s1.length(); i++) {
            char c = s1.charAt(i - 1);
            for (int j = 1; j <= m; j++) {
                if (c == s2.charAt(j - 1)) {
                    currentRow[j] = previousRow[j - 1] + 1;
                } else {
                    currentRow[j] = Math.max(previousRow[j], currentRow[j - 1]);
                }
            }
            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }
        return previousRow[m];
    }
}
