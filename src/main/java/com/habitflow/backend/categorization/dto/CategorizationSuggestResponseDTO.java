package com.habitflow.backend.categorization.dto;

import java.util.List;

import com.habitflow.backend.categorization.model.CategorizationResult;
import com.habitflow.backend.categorization.model.Category;

public record CategorizationSuggestResponseDTO(
        String category,
        String displayName,
        String icon,
        String color,
        double confidence,
        boolean fallback,
        List<String> tokens,
        List<MatchSignalDTO> signals
) {

    public record MatchSignalDTO(String category, String source, String matched, double weight) {}

    public static CategorizationSuggestResponseDTO from(CategorizationResult result) {
        Category c = result.category();
        List<MatchSignalDTO> signals = result.signals().stream()
                .map(s -> new MatchSignalDTO(s.category().getId(), s.source().name(), s.matched(), s.weight()))
                .toList();
        return new CategorizationSuggestResponseDTO(
                c.getId(),
                c.getDisplayName(),
                c.getIcon(),
                c.getColor(),
                result.confidence(),
                result.fallback(),
                result.tokens(),
                signals
        );
    }
}
