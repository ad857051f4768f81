package com.habitflow.backend.categorization.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of habit categories. {@link #OTHER} is the mandatory fallback.
 *
 * The id is what callers persist next to a habit and later group analytics by.
 */
public enum Category {

    FITNESS("Fitness", "Health & Fitness", "🏃", "#10B981"),
    EDUCATION("Education", "Learning & Education", "📚", "#3B82F6"),
    MINDFULNESS("Mindfulness", "Mindfulness", "🧘", "#EC4899"),
    WORK("Work", "Work & Productivity", "💼", "#F59E0B"),
    HEALTH("Health", "Health & Nutrition", "🥗", "#22C55E"),
    SOCIAL("Social", "Social", "👥", "#06B6D4"),
    FINANCE("Finance", "Finance", "💰", "#84CC16"),
    OTHER("Other", "Other", "📌", "#6B7280");

    private final String id;
    private final String displayName;
    private final String icon;
    private final String color;

    Category(String id, String displayName, String icon, String color) {
        this.id = id;
        this.displayName = displayName;
        this.icon = icon;
        this.color = color;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getIcon() {
        return icon;
    }

    public String getColor() {
        return color;
    }

    /**
     * Resolves a persisted/configured id (case-insensitive).
     */
    public static Optional<Category> fromId(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        String wanted = id.trim().toLowerCase(Locale.ROOT);
        for (Category c : values()) {
            if (c.id.toLowerCase(Locale.ROOT).equals(wanted)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
