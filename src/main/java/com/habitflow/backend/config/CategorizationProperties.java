package com.habitflow.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning constants of the categorization engine.
 *
 * Example:
 * habitflow.categorization.registry-location=classpath:categorization/registry.json
 * habitflow.categorization.fuzzy-threshold=0.8
 * habitflow.categorization.fallback-threshold=0.15
 *
 * @param registryLocation        Spring resource location of the registry asset
 * @param fuzzyThreshold          minimum similarity for a fuzzy keyword match
 * @param fallbackThreshold       winners below this confidence fall back to Other
 * @param tieEpsilon              confidences closer than this are a tie
 * @param maxScore                aggregate score that maps to confidence 1.0
 * @param phraseBonus             added on top of a phrase's weight
 * @param suggestionMinConfidence categories below this are left out of ranked suggestions
 * @param defaultSuggestionLimit  size of the ranked suggestion list when none is requested
 */
@ConfigurationProperties(prefix = "habitflow.categorization")
public record CategorizationProperties(
        String registryLocation,
        Double fuzzyThreshold,
        Double fallbackThreshold,
        Double tieEpsilon,
        Double maxScore,
        Double phraseBonus,
        Double suggestionMinConfidence,
        Integer defaultSuggestionLimit
) {
    public static final String DEFAULT_REGISTRY_LOCATION = "classpath:categorization/registry.json";

    public CategorizationProperties {
        if (registryLocation == null || registryLocation.isBlank()) {
            registryLocation = DEFAULT_REGISTRY_LOCATION;
        }
        if (fuzzyThreshold == null) {
            fuzzyThreshold = 0.8;
        }
        if (fallbackThreshold == null) {
            fallbackThreshold = 0.15;
        }
        if (tieEpsilon == null) {
            tieEpsilon = 0.01;
        }
        if (maxScore == null) {
            maxScore = 2.0;
        }
        if (phraseBonus == null) {
            phraseBonus = 0.2;
        }
        if (suggestionMinConfidence == null) {
            suggestionMinConfidence = 0.05;
        }
        if (defaultSuggestionLimit == null) {
            defaultSuggestionLimit = 3;
        }

        requireUnit("fuzzy-threshold", fuzzyThreshold);
        requireUnit("fallback-threshold", fallbackThreshold);
        requireUnit("tie-epsilon", tieEpsilon);
        requireUnit("suggestion-min-confidence", suggestionMinConfidence);
        if (!Double.isFinite(maxScore) || maxScore <= 0.0) {
            throw new IllegalArgumentException("habitflow.categorization.max-score must be > 0, got " + maxScore);
        }
        if (!Double.isFinite(phraseBonus) || phraseBonus < 0.0) {
            throw new IllegalArgumentException("habitflow.categorization.phrase-bonus must be >= 0, got " + phraseBonus);
        }
        if (defaultSuggestionLimit < 1) {
            throw new IllegalArgumentException("habitflow.categorization.default-suggestion-limit must be >= 1, got " + defaultSuggestionLimit);
        }
    }

    public static CategorizationProperties defaults() {
        return new CategorizationProperties(null, null, null, null, null, null, null, null);
    }

    private static void requireUnit(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException("habitflow.categorization." + name + " must be within [0,1], got " + value);
        }
    }
}
