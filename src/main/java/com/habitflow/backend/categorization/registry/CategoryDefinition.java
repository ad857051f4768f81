package com.habitflow.backend.categorization.registry;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import com.habitflow.backend.categorization.model.Category;

/**
 * Rules for one category. Terms are stored already normalized.
 *
 * @param priority tie-break rank, lower wins
 */
public record CategoryDefinition(
        Category category,
        int priority,
        List<WeightedTerm> keywords,
        List<WeightedTerm> phrases,
        List<PatternRule> patterns
) {
    public CategoryDefinition {
        Objects.requireNonNull(category, "category is required");
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        phrases = phrases == null ? List.of() : List.copyOf(phrases);
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }

    public record WeightedTerm(String term, double weight) {
        public WeightedTerm {
            if (term == null || term.isBlank()) throw new IllegalArgumentException("term is required");
            if (!Double.isFinite(weight) || weight <= 0.0) throw new IllegalArgumentException("weight must be > 0 for term '" + term + "'");
        }
    }

    public record PatternRule(Pattern pattern, double weight) {
        public PatternRule {
            Objects.requireNonNull(pattern, "pattern is required");
            if (!Double.isFinite(weight) || weight <= 0.0) throw new IllegalArgumentException("weight must be > 0 for pattern '" + pattern + "'");
        }

        public static PatternRule of(String regex, double weight) {
            return new PatternRule(Pattern.compile(regex), weight);
        }
    }
}
