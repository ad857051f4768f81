package com.habitflow.backend.categorization.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.habitflow.backend.categorization.model.CategorizationResult;
import com.habitflow.backend.categorization.model.Category;
import com.habitflow.backend.categorization.model.CategorySuggestion;
import com.habitflow.backend.categorization.model.MatchSignal;
import com.habitflow.backend.categorization.registry.CategoryDefinition;
import com.habitflow.backend.categorization.registry.CategoryRegistry;
import com.habitflow.backend.config.CategorizationProperties;

/**
 * Fuses signals into one decision.
 *
 * <ul>
 *   <li>score = sum of contributions per category</li>
 *   <li>confidence = clamp(score / maxScore, 0, 1)</li>
 *   <li>categories within tieEpsilon of the best confidence are decided by priority rank (lowest wins);
 *       when the best clears fallbackThreshold, only tied categories that also clear it take part</li>
 *   <li>a winner below fallbackThreshold is replaced by {@link Category#OTHER} with confidence 0</li>
 * </ul>
 */
public final class ScoreAggregator {

    private final CategoryRegistry registry;
    private final double maxScore;
    private final double tieEpsilon;
    private final double fallbackThreshold;
    private final double suggestionMinConfidence;

    public ScoreAggregator(CategoryRegistry registry, CategorizationProperties properties) {
        this.registry = registry;
        this.maxScore = properties.maxScore();
        this.tieEpsilon = properties.tieEpsilon();
        this.fallbackThreshold = properties.fallbackThreshold();
        this.suggestionMinConfidence = properties.suggestionMinConfidence();
    }

    public CategorizationResult aggregate(String input, List<String> tokens, List<MatchSignal> signals) {
        Map<Category, Double> scores = sum(signals);

        double best = 0.0;
        for (double score : scores.values()) {
            best = Math.max(best, confidence(score));
        }
        double floor = best >= fallbackThreshold ? fallbackThreshold : 0.0;
        Category winner = best > 0.0 ? breakTie(scores, best, floor) : null;
        double confidence = winner == null ? 0.0 : confidence(scores.get(winner));

        if (winner == null || confidence < fallbackThreshold) {
            return new CategorizationResult(input, tokens, scores, Category.OTHER, 0.0, signals, true);
        }
        return new CategorizationResult(input, tokens, scores, winner, confidence, signals, false);
    }

    /**
     * Ranked suggestions (Other excluded), best first. Never empty: with no candidate the single
     * entry is (Other, 0).
     */
    public List<CategorySuggestion> rank(List<MatchSignal> signals, int limit) {
        Map<Category, Double> scores = sum(signals);

        List<CategorySuggestion> ranked = new ArrayList<>();
        for (Map.Entry<Category, Double> e : scores.entrySet()) {
            if (e.getKey() == Category.OTHER) continue;
            double confidence = confidence(e.getValue());
            if (confidence > 0.0 && confidence >= suggestionMinConfidence) {
                ranked.add(new CategorySuggestion(e.getKey(), confidence));
            }
        }
        ranked.sort(Comparator.comparingDouble(CategorySuggestion::confidence).reversed()
                .thenComparingInt(s -> registry.priorityOf(s.category())));

        if (ranked.isEmpty()) {
            return List.of(new CategorySuggestion(Category.OTHER, 0.0));
        }
        return List.copyOf(ranked.subList(0, Math.min(Math.max(limit, 1), ranked.size())));
    }

    private Map<Category, Double> sum(List<MatchSignal> signals) {
        Map<Category, Double> scores = new LinkedHashMap<>();
        for (CategoryDefinition def : registry.definitions()) {
            scores.put(def.category(), 0.0);
        }
        if (signals != null) {
            for (MatchSignal s : signals) {
                if (scores.containsKey(s.category())) {
                    scores.merge(s.category(), s.weight(), Double::sum);
                }
            }
        }
        return Collections.unmodifiableMap(scores);
    }

    private Category breakTie(Map<Category, Double> scores, double best, double floor) {
        Category chosen = null;
        for (Map.Entry<Category, Double> e : scores.entrySet()) {
            double confidence = confidence(e.getValue());
            if (confidence <= 0.0 || confidence < floor || best - confidence > tieEpsilon) continue;
            if (chosen == null || registry.priorityOf(e.getKey()) < registry.priorityOf(chosen)) {
                chosen = e.getKey();
            }
        }
        return chosen;
    }

    double confidence(double score) {
        if (!(score > 0.0)) return 0.0;
        return Math.min(1.0, score / maxScore);
    }
}
