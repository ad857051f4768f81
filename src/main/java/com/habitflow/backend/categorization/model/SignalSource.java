package com.habitflow.backend.categorization.model;

public enum SignalSource {
    KEYWORD,
    PHRASE,
    PATTERN,
    FUZZY
}
