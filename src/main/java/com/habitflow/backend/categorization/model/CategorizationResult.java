package com.habitflow.backend.categorization.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a single classification call.
 *
 * @param input      the raw text as received (null becomes "")
 * @param tokens     normalized token sequence
 * @param scores     raw aggregate score per registry category, in registry order
 * @param category   winning category, {@link Category#OTHER} on fallback
 * @param confidence normalized [0,1] confidence of the winner
 * @param signals    every signal collected, in emission order
 * @param fallback   true iff the best confidence stayed below the fallback threshold
 */
public record CategorizationResult(
        String input,
        List<String> tokens,
        Map<Category, Double> scores,
        Category category,
        double confidence,
        List<MatchSignal> signals,
        boolean fallback
) {
    public CategorizationResult {
        Objects.requireNonNull(category, "category is required");
        if (input == null) input = "";
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        scores = scores == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(scores));
        signals = signals == null ? List.of() : List.copyOf(signals);
        if (Double.isNaN(confidence)) confidence = 0.0;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public String categoryId() {
        return category.getId();
    }
}
