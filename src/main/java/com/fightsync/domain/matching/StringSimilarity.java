package com.fightsync.domain.matching;

/**
 * Edit-distance similarity between strings.
 */
public final class StringSimilarity {

    private StringSimilarity() {
    }

    /**
     * Levenshtein distance with a two-row table.
     */
    public static int levenshtein(String a, String b) {
        if (a.equals(b)) {
            return 0;
        }
        if (a.isEmpty()) {
            return b.length();
        }
        if (b.isEmpty()) {
            return a.length();
        }

        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                int cost = ca == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                    Math.min(current[j - 1] + 1, previous[j] + 1),
                    previous[j - 1] + cost
                );
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /**
     * Similarity in [0, 1]: 1 minus the edit distance relative to the longer
     * string. Two empty strings are identical.
     */
    public static double similarity(String a, String b) {
        String longer = a.length() >= b.length() ? a : b;
        String shorter = longer == a ? b : a;
        if (longer.isEmpty()) {
            return 1.0;
        }
        return (longer.length() - levenshtein(longer, shorter)) / (double) longer.length();
    }
}
