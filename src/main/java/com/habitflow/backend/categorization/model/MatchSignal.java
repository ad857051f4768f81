package com.habitflow.backend.categorization.model;

import java.util.Objects;

/**
 * One piece of evidence for a category, produced per classification call.
 */
public record MatchSignal(Category category, SignalSource source, String matched, double weight) {
    public MatchSignal {
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(source, "source is required");
        if (matched == null) matched = "";
        if (Double.isNaN(weight) || weight < 0.0) throw new IllegalArgumentException("weight must be >= 0");
    }
}
