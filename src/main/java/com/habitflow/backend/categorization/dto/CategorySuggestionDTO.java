package com.habitflow.backend.categorization.dto;

import com.habitflow.backend.categorization.model.Category;
import com.habitflow.backend.categorization.model.CategorySuggestion;

public record CategorySuggestionDTO(
        String category,
        String displayName,
        String icon,
        String color,
        double confidence
) {
    public static CategorySuggestionDTO from(CategorySuggestion suggestion) {
        Category c = suggestion.category();
        return new CategorySuggestionDTO(c.getId(), c.getDisplayName(), c.getIcon(), c.getColor(), suggestion.confidence());
    }
}
