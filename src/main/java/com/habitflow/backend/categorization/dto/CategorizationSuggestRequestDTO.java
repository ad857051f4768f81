package com.habitflow.backend.categorization.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CategorizationSuggestRequestDTO(
        @NotNull(message = "habitName is required")
        @Size(max = 500, message = "habitName must be at most 500 characters")
        String habitName
) {}
