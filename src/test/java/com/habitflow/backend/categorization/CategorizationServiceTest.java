package com.habitflow.backend.categorization;

import static com.habitflow.backend.categorization.support.RegistryFixtures.keywords;
import static com.habitflow.backend.categorization.support.RegistryFixtures.other;
import static com.habitflow.backend.categorization.support.RegistryFixtures.term;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.habitflow.backend.categorization.model.CategorizationResult;
import com.habitflow.backend.categorization.model.Category;
import com.habitflow.backend.categorization.model.CategorySuggestion;
import com.habitflow.backend.categorization.model.SignalSource;
import com.habitflow.backend.categorization.registry.CategoryRegistry;
import com.habitflow.backend.categorization.support.RegistryFixtures;
import com.habitflow.backend.config.CategorizationProperties;

class CategorizationServiceTest {

    private static CategorizationService service;

    @BeforeAll
    static void setUp() {
        service = new CategorizationService(RegistryFixtures.bundled(), CategorizationProperties.defaults());
    }

    @ParameterizedTest
    @CsvSource({
            "Go to gym, Fitness",
            "Read a book, Education",
            "Save money, Finance",
            "Call mom, Social",
            "Drink water, Health",
            "check email, Work",
            "run 5k, Fitness",
            "sleep 8 hours, Health",
            "Learn Spanish, Education",
            "meditate, Mindfulness"
    })
    void suggestsExpectedCategory(String habit, String expected) {
        CategorizationResult result = service.suggestCategory(habit);

        assertEquals(expected, result.categoryId());
        assertFalse(result.fallback());
        assertTrue(result.confidence() >= 0.15, "confidence " + result.confidence());
    }

    @Test
    void strongPhraseSaturatesConfidence() {
        CategorizationResult result = service.suggestCategory("Go to gym");

        assertEquals(1.0, result.confidence(), 1e-9);
        assertEquals(List.of("go", "gym"), result.tokens());
        assertTrue(result.signals().stream().anyMatch(s -> s.source() == SignalSource.PHRASE));
        assertTrue(result.signals().stream().anyMatch(s -> s.source() == SignalSource.PATTERN));
    }

    @Test
    void singleKeywordGivesPartialConfidence() {
        CategorizationResult result = service.suggestCategory("meditate");

        assertEquals(Category.MINDFULNESS, result.category());
        assertEquals(0.5, result.confidence(), 1e-9);
    }

    @Test
    void typoIsRecoveredByFuzzyMatching() {
        CategorizationResult result = service.suggestCategory("Workuot");

        assertEquals(Category.FITNESS, result.category());
        assertTrue(result.confidence() > 0.0 && result.confidence() < 0.5);
        assertEquals(SignalSource.FUZZY, result.signals().get(0).source());
        assertEquals("workuot~workout", result.signals().get(0).matched());
    }

    @Test
    void tooFarFromAnyKeywordFallsBack() {
        CategorizationResult result = service.suggestCategory("Wrkt");

        assertEquals(Category.OTHER, result.category());
        assertEquals(0.0, result.confidence());
        assertTrue(result.fallback());
    }

    @Test
    void ambiguousKeywordPrefersHigherWeight() {
        CategorizationResult result = service.suggestCategory("Journal");

        assertEquals(Category.MINDFULNESS, result.category());
        assertEquals(0.35, result.confidence(), 1e-9);
        assertEquals(2, result.signals().size());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "!!!", "asdkjhasd", "привет", "🏃‍♂️", "12345", "the to my"})
    void unrecognisedInputFallsBackToOther(String habit) {
        CategorizationResult result = service.suggestCategory(habit);

        assertEquals(Category.OTHER, result.category());
        assertEquals(0.0, result.confidence());
        assertTrue(result.fallback());
    }

    @Test
    void nullInputIsTreatedAsEmpty() {
        CategorizationResult result = service.suggestCategory(null);

        assertNotNull(result);
        assertEquals("", result.input());
        assertEquals(Category.OTHER, result.category());
        assertTrue(result.fallback());
    }

    @Test
    void caseAndSurroundingNoiseDoNotMatter() {
        CategorizationResult lower = service.suggestCategory("go to gym");
        CategorizationResult upper = service.suggestCategory("  GO TO GYM!!  ");

        assertEquals(lower.category(), upper.category());
        assertEquals(lower.confidence(), upper.confidence());
        assertEquals(lower.tokens(), upper.tokens());
        assertEquals(service.suggestCategory("meditate").confidence(), service.suggestCategory("MEDITATE").confidence());
    }

    @Test
    void sameInputAlwaysGivesSameResult() {
        CategorizationResult first = service.suggestCategory("Morning yoga and meditate");
        for (int i = 0; i < 50; i++) {
            CategorizationResult again = service.suggestCategory("Morning yoga and meditate");
            assertEquals(first.category(), again.category());
            assertEquals(first.confidence(), again.confidence());
            assertEquals(first.signals(), again.signals());
        }
        assertEquals(Category.MINDFULNESS, first.category());
    }

    @Test
    void veryLongInputIsHandled() {
        String habit = "drink water ".repeat(500);
        CategorizationResult result = service.suggestCategory(habit);

        assertEquals(Category.HEALTH, result.category());
        assertEquals(1.0, result.confidence(), 1e-9);
    }

    @Test
    void scoresCoverEveryRegistryCategory() {
        CategorizationResult result = service.suggestCategory("Save money");

        assertEquals(Category.values().length, result.scores().size());
        assertTrue(result.scores().get(Category.FINANCE) > 0.0);
        assertEquals(0.0, result.scores().get(Category.OTHER));
    }

    @Test
    void concurrentCallsAgree() throws Exception {
        List<String> habits = List.of("Go to gym", "Read a book", "Journal", "Workuot", "Wrkt", "save $20");
        List<CategorizationResult> expected = habits.stream().map(service::suggestCategory).toList();

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<List<CategorizationResult>>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(pool.submit(() -> habits.stream().map(service::suggestCategory).toList()));
            }
            for (Future<List<CategorizationResult>> f : futures) {
                List<CategorizationResult> actual = f.get();
                for (int i = 0; i < habits.size(); i++) {
                    assertEquals(expected.get(i).category(), actual.get(i).category());
                    assertEquals(expected.get(i).confidence(), actual.get(i).confidence());
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void suggestionsAreRankedBestFirst() {
        List<CategorySuggestion> ranked = service.suggestions("Morning yoga and meditate");

        assertEquals(Category.MINDFULNESS, ranked.get(0).category());
        assertEquals(Category.FITNESS, ranked.get(1).category());
        assertTrue(ranked.get(0).confidence() >= ranked.get(1).confidence());
    }

    @Test
    void suggestionsRespectLimitAndFallBackToOther() {
        assertEquals(1, service.suggestions("Journal", 1).size());
        assertEquals(2, service.suggestions("Journal", 10).size());
        assertEquals(1, service.suggestions("Journal", 0).size());

        List<CategorySuggestion> none = service.suggestions("asdkjhasd");
        assertEquals(1, none.size());
        assertEquals(Category.OTHER, none.get(0).category());
        assertEquals(0.0, none.get(0).confidence());
    }

    @RepeatedTest(10)
    void equallyWeightedCategoriesResolveToLowerPriorityRank() {
        // Finance is declared first; Work ranks ahead of it
        CategoryRegistry registry = CategoryRegistry.of("tie", List.of(
                keywords(Category.FINANCE, 2, term("budget", 0.8)),
                keywords(Category.WORK, 1, term("budget", 0.8)),
                other(3)));
        CategorizationService tied = new CategorizationService(registry, CategorizationProperties.defaults());

        CategorizationResult result = tied.suggestCategory("Budget");

        assertEquals(Category.WORK, result.category());
        assertEquals(0.4, result.confidence(), 1e-9);
        assertEquals(result.scores().get(Category.FINANCE), result.scores().get(Category.WORK));
        assertFalse(result.fallback());
    }

    @Test
    void categoriesComeInPriorityOrder() {
        var categories = service.categories();

        assertEquals(Category.values().length, categories.size());
        assertEquals(Category.FITNESS, categories.get(0).category());
        assertEquals(Category.OTHER, categories.get(categories.size() - 1).category());
        assertEquals("2025.1", service.registryVersion());
    }
}
