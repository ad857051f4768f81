package com.habitflow.backend.categorization.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.habitflow.backend.categorization.engine.TextNormalizer;
import com.habitflow.backend.categorization.model.Category;
import com.habitflow.backend.categorization.registry.CategoryDefinition.PatternRule;
import com.habitflow.backend.categorization.registry.CategoryDefinition.WeightedTerm;

/**
 * Immutable, validated set of {@link CategoryDefinition}s plus the lookup indexes derived from it.
 *
 * <p>Built once via {@link #of(String, List)}; afterwards every structure is unmodifiable, so
 * instances can be shared between threads without synchronization.</p>
 *
 * <p>"Registry order" is the order the definitions were supplied in, and within a definition the
 * order of its terms and rules. All indexes preserve it so signal ordering stays deterministic.</p>
 */
public final class CategoryRegistry {

    public static final int MAX_PHRASE_TOKENS = 3;

    /** A (category, weight) entry behind a keyword or phrase. */
    public record IndexedTerm(Category category, String term, double weight) {}

    /** A pattern rule tagged with its category. */
    public record IndexedPattern(Category category, PatternRule rule) {}

    private final String version;
    private final List<CategoryDefinition> definitions;
    private final Map<Category, CategoryDefinition> byCategory;
    private final Map<String, List<IndexedTerm>> keywordIndex;
    private final Map<String, List<IndexedTerm>> phraseIndex;
    private final List<IndexedPattern> patterns;

    private CategoryRegistry(String version, List<CategoryDefinition> definitions) {
        this.version = version;
        this.definitions = List.copyOf(definitions);

        Map<Category, CategoryDefinition> defs = new EnumMap<>(Category.class);
        Map<String, List<IndexedTerm>> keywords = new LinkedHashMap<>();
        Map<String, List<IndexedTerm>> phrases = new LinkedHashMap<>();
        List<IndexedPattern> rules = new ArrayList<>();

        for (CategoryDefinition def : this.definitions) {
            defs.put(def.category(), def);
            for (WeightedTerm kw : def.keywords()) {
                keywords.computeIfAbsent(kw.term(), k -> new ArrayList<>())
                        .add(new IndexedTerm(def.category(), kw.term(), kw.weight()));
            }
            for (WeightedTerm ph : def.phrases()) {
                phrases.computeIfAbsent(ph.term(), k -> new ArrayList<>())
                        .add(new IndexedTerm(def.category(), ph.term(), ph.weight()));
            }
            for (PatternRule rule : def.patterns()) {
                rules.add(new IndexedPattern(def.category(), rule));
            }
        }

        this.byCategory = Collections.unmodifiableMap(defs);
        this.keywordIndex = freeze(keywords);
        this.phraseIndex = freeze(phrases);
        this.patterns = List.copyOf(rules);
    }

    /**
     * Validates the definitions, normalizes their terms and builds the registry.
     *
     * @throws RegistryValidationException if the definitions are incomplete or inconsistent
     */
    public static CategoryRegistry of(String version, List<CategoryDefinition> definitions) {
        if (version == null || version.isBlank()) {
            throw new RegistryValidationException("registry version is required");
        }
        if (definitions == null || definitions.isEmpty()) {
            throw new RegistryValidationException("registry has no category definitions");
        }

        Set<Category> seenCategories = EnumSet.noneOf(Category.class);
        Set<Integer> seenPriorities = new HashSet<>();
        List<CategoryDefinition> normalized = new ArrayList<>(definitions.size());

        for (CategoryDefinition def : definitions) {
            if (def == null) {
                throw new RegistryValidationException("registry contains a null category definition");
            }
            if (!seenCategories.add(def.category())) {
                throw new RegistryValidationException("duplicate definition for category " + def.category().getId());
            }
            if (!seenPriorities.add(def.priority())) {
                throw new RegistryValidationException("duplicate priority rank " + def.priority()
                        + " (category " + def.category().getId() + ")");
            }
            normalized.add(new CategoryDefinition(
                    def.category(),
                    def.priority(),
                    normalizeTerms(def.category(), "keyword", def.keywords(), 1, 1),
                    normalizeTerms(def.category(), "phrase", def.phrases(), 2, MAX_PHRASE_TOKENS),
                    def.patterns()));
        }

        if (!seenCategories.contains(Category.OTHER)) {
            throw new RegistryValidationException("registry must define the fallback category " + Category.OTHER.getId());
        }

        return new CategoryRegistry(version.trim(), normalized);
    }

    private static List<WeightedTerm> normalizeTerms(Category category, String kind, List<WeightedTerm> terms,
                                                     int minTokens, int maxTokens) {
        Map<String, Double> byTerm = new LinkedHashMap<>();
        for (WeightedTerm t : terms) {
            List<String> tokens = TextNormalizer.tokenize(t.term());
            if (tokens.size() < minTokens || tokens.size() > maxTokens) {
                throw new RegistryValidationException(String.format(
                        "%s '%s' of category %s normalizes to %d token(s), expected %d..%d",
                        kind, t.term(), category.getId(), tokens.size(), minTokens, maxTokens));
            }
            String term = String.join(" ", tokens);
            Double previous = byTerm.putIfAbsent(term, t.weight());
            if (previous != null && Double.compare(previous, t.weight()) != 0) {
                throw new RegistryValidationException(String.format(
                        "%s '%s' of category %s is declared with contradictory weights %s and %s",
                        kind, term, category.getId(), previous, t.weight()));
            }
        }
        List<WeightedTerm> out = new ArrayList<>(byTerm.size());
        byTerm.forEach((term, weight) -> out.add(new WeightedTerm(term, weight)));
        return out;
    }

    private static Map<String, List<IndexedTerm>> freeze(Map<String, List<IndexedTerm>> in) {
        Map<String, List<IndexedTerm>> out = new LinkedHashMap<>();
        in.forEach((k, v) -> out.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(out);
    }

    public String version() {
        return version;
    }

    /** Definitions in registry order. */
    public List<CategoryDefinition> definitions() {
        return definitions;
    }

    /** Definitions ordered by priority rank (lowest first). */
    public List<CategoryDefinition> definitionsByPriority() {
        List<CategoryDefinition> sorted = new ArrayList<>(definitions);
        sorted.sort(Comparator.comparingInt(CategoryDefinition::priority));
        return List.copyOf(sorted);
    }

    public Optional<CategoryDefinition> definition(Category category) {
        return Optional.ofNullable(byCategory.get(category));
    }

    public boolean contains(Category category) {
        return byCategory.containsKey(category);
    }

    /**
     * Priority rank of a category; categories missing from the registry rank last.
     */
    public int priorityOf(Category category) {
        CategoryDefinition def = byCategory.get(category);
        return def == null ? Integer.MAX_VALUE : def.priority();
    }

    public List<IndexedTerm> keywordHits(String token) {
        return keywordIndex.getOrDefault(token, List.of());
    }

    public List<IndexedTerm> phraseHits(String phrase) {
        return phraseIndex.getOrDefault(phrase, List.of());
    }

    /** Keyword -> entries, in registry order. */
    public Map<String, List<IndexedTerm>> keywordIndex() {
        return keywordIndex;
    }

    public int phraseCount() {
        return phraseIndex.size();
    }

    public List<IndexedPattern> patterns() {
        return patterns;
    }
}
