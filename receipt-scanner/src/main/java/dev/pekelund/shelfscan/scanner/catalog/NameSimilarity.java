package dev.pekelund.shelfscan.scanner.catalog;

import java.util.Locale;

/**
 * Normalized similarity of two product names in the range [0, 1].
 */
public final class NameSimilarity {

    private NameSimilarity() {
    }

    public static double of(String first, String second) {
        String a = normalise(first);
        String b = normalise(second);
        if (a.equals(b)) {
            return a.isEmpty() ? 0.0 : 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int longer = Math.max(a.length(), b.length());
        if (a.contains(b) || b.contains(a)) {
            return (double) Math.min(a.length(), b.length()) / longer;
        }
        return 1.0 - (double) levenshtein(a, b) / longer;
    }

    private static String normalise(String value) {
        return value != null ? value.trim().toLowerCase(Locale.ROOT) : "";
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int substitution = previous[j - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                current[j] = Math.min(substitution, Math.min(previous[j] + 1, current[j - 1] + 1));
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
