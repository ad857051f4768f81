package com.habitflow.backend.categorization.model;

public record CategorySuggestion(Category category, double confidence) {}
