package com.habitflow.backend.categorization;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.habitflow.backend.categorization.dto.CategorizationSuggestRequestDTO;
import com.habitflow.backend.categorization.dto.CategorizationSuggestResponseDTO;
import com.habitflow.backend.categorization.dto.CategoryResponseDTO;
import com.habitflow.backend.categorization.dto.CategorySuggestionDTO;
import com.habitflow.backend.dto.ApiResponse;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/categorization")
@RequiredArgsConstructor
public class CategorizationController {

    private final CategorizationService categorizationService;

    @PostMapping("/suggest")
    public ResponseEntity<ApiResponse<CategorizationSuggestResponseDTO>> suggest(
            @Valid @RequestBody CategorizationSuggestRequestDTO request
    ) {
        var result = categorizationService.suggestCategory(request.habitName());
        return ResponseEntity.ok(ApiResponse.success(CategorizationSuggestResponseDTO.from(result), "Category suggested"));
    }

    @GetMapping("/suggestions")
    public ResponseEntity<ApiResponse<List<CategorySuggestionDTO>>> suggestions(
            @RequestParam(defaultValue = "") String habitName,
            @RequestParam(required = false) Integer limit
    ) {
        var ranked = limit == null
                ? categorizationService.suggestions(habitName)
                : categorizationService.suggestions(habitName, limit);

        List<CategorySuggestionDTO> body = ranked.stream()
                .map(CategorySuggestionDTO::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(body, "Suggestions ranked"));
    }

    @GetMapping("/categories")
    public ResponseEntity<ApiResponse<List<CategoryResponseDTO>>> categories() {
        List<CategoryResponseDTO> body = categorizationService.categories()
                .stream()
                .map(d -> new CategoryResponseDTO(
                        d.category().getId(),
                        d.category().getDisplayName(),
                        d.category().getIcon(),
                        d.category().getColor(),
                        d.priority()
                ))
                .toList();
        return ResponseEntity.ok(ApiResponse.success(body, "Categories found"));
    }
}
