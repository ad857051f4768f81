package com.habitflow.backend.categorization.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

import com.habitflow.backend.categorization.model.MatchSignal;
import com.habitflow.backend.categorization.model.SignalSource;
import com.habitflow.backend.categorization.registry.CategoryRegistry;
import com.habitflow.backend.categorization.registry.CategoryRegistry.IndexedPattern;

/**
 * Evaluates every pattern rule, in registry order, against the normalized text.
 * Rules are not short-circuited: several categories may collect evidence from one input.
 */
public final class PatternMatcher implements SignalMatcher {

    private final CategoryRegistry registry;

    public PatternMatcher(CategoryRegistry registry) {
        this.registry = registry;
    }

    @Override
    public List<MatchSignal> match(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) return List.of();

        String text = String.join(" ", tokens);
        List<MatchSignal> out = new ArrayList<>();
        for (IndexedPattern p : registry.patterns()) {
            Matcher m = p.rule().pattern().matcher(text);
            if (m.find()) {
                out.add(new MatchSignal(p.category(), SignalSource.PATTERN, m.group(), p.rule().weight()));
            }
        }
        return out;
    }
}
