package com.habitflow.backend.categorization.dto;

public record CategoryResponseDTO(
        String id,
        String displayName,
        String icon,
        String color,
        int priority
) {}
