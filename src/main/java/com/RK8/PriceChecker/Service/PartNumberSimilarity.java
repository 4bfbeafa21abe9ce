package com.RK8.PriceChecker.Service;

import org.springframework.stereotype.Component;

/**
 * Normalized Levenshtein similarity: 1 - distance / longer length.
 * Two empty strings are identical.
 */
@Component
public class PartNumberSimilarity {

    public double score(String a, String b) {
        String s1 = a == null ? "" : a;
        String s2 = b == null ? "" : b;

        int longer = Math.max(s1.length(), s2.length());
        if (longer == 0) return 1.0;

        return 1.0 - (double) distance(s1, s2) / longer;
    }

    int distance(String s1, String s2) {
        int[] previous = new int[s2.length() + 1];
        int[] current = new int[s2.length() + 1];

        for (int j = 0; j <= s2.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= s1.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= s2.length(); j++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                        Math.min(current[j - 1] + 1, previous[j] + 1),
                        previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[s2.length()];
    }
}
