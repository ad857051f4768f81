package com.habitflow.backend.categorization.registry;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

import org.springframework.core.io.Resource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.habitflow.backend.categorization.model.Category;
import com.habitflow.backend.categorization.registry.CategoryDefinition.PatternRule;
import com.habitflow.backend.categorization.registry.CategoryDefinition.WeightedTerm;
import com.habitflow.backend.categorization.registry.RegistryDocument.CategoryDocument;
import com.habitflow.backend.categorization.registry.RegistryDocument.PatternDocument;
import com.habitflow.backend.categorization.registry.RegistryDocument.TermDocument;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads the versioned JSON registry asset and turns it into a validated {@link CategoryRegistry}.
 *
 * Any problem is reported as a {@link RegistryValidationException}; a half-loaded registry is
 * never returned.
 */
@Slf4j
public class CategoryRegistryLoader {

    private final ObjectMapper objectMapper;

    public CategoryRegistryLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CategoryRegistry load(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new RegistryValidationException("category registry asset not found: " + resource);
        }
        try (InputStream in = resource.getInputStream()) {
            return load(in, resource.getDescription());
        } catch (IOException e) {
            throw new RegistryValidationException("failed to read category registry " + resource.getDescription(), e);
        }
    }

    public CategoryRegistry load(InputStream in, String source) {
        RegistryDocument document;
        try {
            document = objectMapper.readValue(in, RegistryDocument.class);
        } catch (IOException e) {
            throw new RegistryValidationException("malformed category registry " + source + ": " + e.getMessage(), e);
        }
        if (document == null) {
            throw new RegistryValidationException("category registry " + source + " is empty");
        }

        CategoryRegistry registry = CategoryRegistry.of(document.version(), toDefinitions(document.categories()));

        log.info("Loaded category registry source={} version={} categories={} keywords={} phrases={} patterns={}",
                source,
                registry.version(),
                registry.definitions().size(),
                registry.keywordIndex().size(),
                registry.phraseCount(),
                registry.patterns().size());
        return registry;
    }

    private List<CategoryDefinition> toDefinitions(List<CategoryDocument> categories) {
        if (categories == null) return List.of();

        List<CategoryDefinition> out = new ArrayList<>(categories.size());
        for (int i = 0; i < categories.size(); i++) {
            CategoryDocument doc = categories.get(i);
            if (doc == null) {
                throw new RegistryValidationException("categories[" + i + "] is null");
            }
            String where = "categories[" + i + "]";
            Category category = Category.fromId(doc.id())
                    .orElseThrow(() -> new RegistryValidationException(where + ": unknown or missing category id '" + doc.id() + "'"));
            if (doc.priority() == null) {
                throw new RegistryValidationException(where + " (" + category.getId() + "): priority is required");
            }
            try {
                out.add(new CategoryDefinition(
                        category,
                        doc.priority(),
                        toTerms(doc.keywords()),
                        toTerms(doc.phrases()),
                        toPatterns(doc.patterns())));
            } catch (PatternSyntaxException e) {
                throw new RegistryValidationException(where + " (" + category.getId() + "): invalid pattern " + e.getPattern(), e);
            } catch (IllegalArgumentException e) {
                throw new RegistryValidationException(where + " (" + category.getId() + "): " + e.getMessage(), e);
            }
        }
        return out;
    }

    private static List<WeightedTerm> toTerms(List<TermDocument> docs) {
        if (docs == null) return List.of();
        List<WeightedTerm> out = new ArrayList<>(docs.size());
        for (TermDocument d : docs) {
            if (d == null || d.weight() == null) {
                throw new IllegalArgumentException("term and weight are required (" + d + ")");
            }
            out.add(new WeightedTerm(d.term(), d.weight()));
        }
        return out;
    }

    private static List<PatternRule> toPatterns(List<PatternDocument> docs) {
        if (docs == null) return List.of();
        List<PatternRule> out = new ArrayList<>(docs.size());
        for (PatternDocument d : docs) {
            if (d == null || d.regex() == null || d.regex().isBlank() || d.weight() == null) {
                throw new IllegalArgumentException("regex and weight are required (" + d + ")");
            }
            out.add(PatternRule.of(d.regex(), d.weight()));
        }
        return out;
    }
}
