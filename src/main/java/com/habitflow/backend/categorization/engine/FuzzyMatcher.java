package com.habitflow.backend.categorization.engine;

import java.util.ArrayList;
import java.util.List;

import com.habitflow.backend.categorization.model.MatchSignal;
import com.habitflow.backend.categorization.model.SignalSource;
import com.habitflow.backend.categorization.registry.CategoryRegistry;
import com.habitflow.backend.categorization.registry.CategoryRegistry.IndexedTerm;

/**
 * Typo tolerance: tokens without an exact keyword hit are compared against every registry
 * keyword using {@code 1 - distance / max(len)}, where distance is the optimal string alignment
 * distance (an adjacent transposition costs one edit).
 *
 * Only the best keyword per token is kept; on equal similarity the first one in registry order wins.
 */
public final class FuzzyMatcher implements SignalMatcher {

    static final int MIN_TOKEN_LENGTH = 3;

    private final CategoryRegistry registry;
    private final double threshold;

    public FuzzyMatcher(CategoryRegistry registry, double threshold) {
        this.registry = registry;
        this.threshold = threshold;
    }

    @Override
    public List<MatchSignal> match(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) return List.of();

        List<MatchSignal> out = new ArrayList<>();
        for (String token : tokens) {
            if (!isCandidate(token)) continue;

            String bestKeyword = null;
            double bestSimilarity = 0.0;
            for (String keyword : registry.keywordIndex().keySet()) {
                int longest = Math.max(token.length(), keyword.length());
                // the length gap alone is a lower bound on the distance
                if (1.0 - (double) Math.abs(token.length() - keyword.length()) / longest < threshold) continue;

                double similarity = similarity(token, keyword);
                if (similarity >= threshold && similarity > bestSimilarity) {
                    bestKeyword = keyword;
                    bestSimilarity = similarity;
                }
            }
            if (bestKeyword == null) continue;

            for (IndexedTerm hit : registry.keywordHits(bestKeyword)) {
                out.add(new MatchSignal(hit.category(), SignalSource.FUZZY,
                        token + "~" + bestKeyword, hit.weight() * bestSimilarity));
            }
        }
        return out;
    }

    private boolean isCandidate(String token) {
        if (token.length() < MIN_TOKEN_LENGTH) return false;
        if (!registry.keywordHits(token).isEmpty()) return false;
        for (int i = 0; i < token.length(); i++) {
            if (Character.isLetter(token.charAt(i))) return true;
        }
        return false;
    }

    static double similarity(String a, String b) {
        int longest = Math.max(a.length(), b.length());
        if (longest == 0) return 1.0;
        return 1.0 - (double) distance(a, b) / longest;
    }

    /**
     * Optimal string alignment distance: insertions, deletions, substitutions and
     * transpositions of adjacent characters, each costing 1.
     */
    static int distance(String a, String b) {
        int n = a.length();
        int m = b.length();
        int[][] d = new int[n + 1][m + 1];
        for (int i = 0; i <= n; i++) d[i][0] = i;
        for (int j = 0; j <= m; j++) d[0][j] = j;

        for (int i = 1; i <= n; i++) {
            for (int j = 1; j <= m; j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                int best = Math.min(
                        Math.min(d[i - 1][j] + 1, d[i][j - 1] + 1),
                        d[i - 1][j - 1] + cost);
                if (i > 1 && j > 1
                        && a.charAt(i - 1) == b.charAt(j - 2)
                        && a.charAt(i - 2) == b.charAt(j - 1)) {
                    best = Math.min(best, d[i - 2][j - 2] + 1);
                }
                d[i][j] = best;
            }
        }
        return d[n][m];
    }
}
