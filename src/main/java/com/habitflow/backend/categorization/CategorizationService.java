package com.habitflow.backend.categorization;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.habitflow.backend.categorization.engine.FuzzyMatcher;
import com.habitflow.backend.categorization.engine.KeywordMatcher;
import com.habitflow.backend.categorization.engine.PatternMatcher;
import com.habitflow.backend.categorization.engine.ScoreAggregator;
import com.habitflow.backend.categorization.engine.SignalMatcher;
import com.habitflow.backend.categorization.engine.TextNormalizer;
import com.habitflow.backend.categorization.model.CategorizationResult;
import com.habitflow.backend.categorization.model.CategorySuggestion;
import com.habitflow.backend.categorization.model.MatchSignal;
import com.habitflow.backend.categorization.registry.CategoryDefinition;
import com.habitflow.backend.categorization.registry.CategoryRegistry;
import com.habitflow.backend.config.CategorizationProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Suggests a category for a habit name.
 *
 * Stateless apart from the immutable registry and tuning it was built with: calls are reentrant,
 * perform no I/O and never throw, so it is safe to call on every keystroke from many threads.
 */
@Service
@Slf4j
public class CategorizationService {

    private final CategoryRegistry registry;
    private final CategorizationProperties properties;
    private final List<SignalMatcher> matchers;
    private final ScoreAggregator aggregator;

    public CategorizationService(CategoryRegistry registry, CategorizationProperties properties) {
        this.registry = registry;
        this.properties = properties;
        // order matters only for signal ordering in the result
        this.matchers = List.of(
                new KeywordMatcher(registry, properties.phraseBonus()),
                new PatternMatcher(registry),
                new FuzzyMatcher(registry, properties.fuzzyThreshold()));
        this.aggregator = new ScoreAggregator(registry, properties);
    }

    public CategorizationResult suggestCategory(String habitName) {
        String input = habitName == null ? "" : habitName;
        List<String> tokens = TextNormalizer.tokenize(input);
        List<MatchSignal> signals = collectSignals(tokens);

        CategorizationResult result = aggregator.aggregate(input, tokens, signals);

        log.debug("Categorization suggest normalized='{}' -> category='{}' confidence={} fallback={} signals={}",
                String.join(" ", tokens), result.categoryId(), result.confidence(), result.fallback(), signals.size());
        return result;
    }

    /**
     * Ranked categories for the habit name, best first.
     *
     * @param limit clamped to 1..number of registry categories
     */
    public List<CategorySuggestion> suggestions(String habitName, int limit) {
        int bounded = Math.max(1, Math.min(limit, registry.definitions().size()));
        List<String> tokens = TextNormalizer.tokenize(habitName);
        return aggregator.rank(collectSignals(tokens), bounded);
    }

    public List<CategorySuggestion> suggestions(String habitName) {
        return suggestions(habitName, properties.defaultSuggestionLimit());
    }

    /** Category catalogue in priority order. */
    public List<CategoryDefinition> categories() {
        return registry.definitionsByPriority();
    }

    public String registryVersion() {
        return registry.version();
    }

    private List<MatchSignal> collectSignals(List<String> tokens) {
        if (tokens.isEmpty()) return List.of();
        List<MatchSignal> signals = new ArrayList<>();
        for (SignalMatcher matcher : matchers) {
            signals.addAll(matcher.match(tokens));
        }
        return signals;
    }
}
