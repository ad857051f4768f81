package com.habitflow.backend.categorization.engine;

import java.util.ArrayList;
import java.util.List;

import com.habitflow.backend.categorization.model.MatchSignal;
import com.habitflow.backend.categorization.model.SignalSource;
import com.habitflow.backend.categorization.registry.CategoryRegistry;
import com.habitflow.backend.categorization.registry.CategoryRegistry.IndexedTerm;

/**
 * Exact single-word lookups plus 2..3 token phrase windows.
 *
 * A phrase contributes {@code max(phrase weight, best constituent keyword weight) + phraseBonus}.
 * The floor spans every category, so a phrase always outweighs each single-word hit inside it.
 */
public final class KeywordMatcher implements SignalMatcher {

    private final CategoryRegistry registry;
    private final double phraseBonus;

    public KeywordMatcher(CategoryRegistry registry, double phraseBonus) {
        this.registry = registry;
        this.phraseBonus = phraseBonus;
    }

    @Override
    public List<MatchSignal> match(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) return List.of();

        List<MatchSignal> out = new ArrayList<>();

        for (String token : tokens) {
            for (IndexedTerm hit : registry.keywordHits(token)) {
                out.add(new MatchSignal(hit.category(), SignalSource.KEYWORD, token, hit.weight()));
            }
        }

        for (int start = 0; start < tokens.size(); start++) {
            for (int size = 2; size <= CategoryRegistry.MAX_PHRASE_TOKENS && start + size <= tokens.size(); size++) {
                List<String> window = tokens.subList(start, start + size);
                String phrase = String.join(" ", window);
                for (IndexedTerm hit : registry.phraseHits(phrase)) {
                    double base = Math.max(hit.weight(), bestConstituentWeight(window));
                    out.add(new MatchSignal(hit.category(), SignalSource.PHRASE, phrase, base + phraseBonus));
                }
            }
        }
        return out;
    }

    private double bestConstituentWeight(List<String> window) {
        double best = 0.0;
        for (String token : window) {
            for (IndexedTerm kw : registry.keywordHits(token)) {
                if (kw.weight() > best) {
                    best = kw.weight();
                }
            }
        }
        return best;
    }
}
