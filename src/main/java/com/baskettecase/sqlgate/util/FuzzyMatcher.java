package com.baskettecase.sqlgate.util;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Finds "did you mean?" suggestions for misspelled server and database names
 * using Levenshtein distance.
 */
public final class FuzzyMatcher {

    private static final int MAX_SUGGESTIONS = 3;
    private static final double SIMILARITY_THRESHOLD = 0.4;

    private FuzzyMatcher() {
    }

    /**
     * Top suggestions for the input, best match first
     */
    public static List<String> findClosestMatches(String input, Collection<String> candidates) {
        return findClosestMatches(input, candidates, MAX_SUGGESTIONS);
    }

    public static List<String> findClosestMatches(String input, Collection<String> candidates, int maxSuggestions) {
        if (input == null || input.isEmpty() || candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        String normalizedInput = input.toLowerCase(Locale.ROOT);

        return candidates.stream()
            .map(candidate -> new Match(candidate,
                similarity(normalizedInput, candidate.toLowerCase(Locale.ROOT))))
            .filter(match -> match.similarity() >= SIMILARITY_THRESHOLD)
            .sorted((a, b) -> Double.compare(b.similarity(), a.similarity()))
            .limit(maxSuggestions)
            .map(Match::value)
            .collect(Collectors.toList());
    }

    /**
     * 0.0 (completely different) to 1.0 (identical)
     */
    static double similarity(String s1, String s2) {
        int maxLength = Math.max(s1.length(), s2.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - ((double) levenshteinDistance(s1, s2) / maxLength);
    }

    private static int levenshteinDistance(String s1, String s2) {
        int len1 = s1.length();
        int len2 = s2.length();
        int[] previous = new int[len2 + 1];
        int[] current = new int[len2 + 1];

        for (int j = 0; j <= len2; j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= len1; i++) {
            current[0] = i;
            for (int j = 1; j <= len2; j++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(previous[j] + 1, current[j - 1] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }

        return previous[len2];
    }

    private record Match(String value, double similarity) {
    }
}
