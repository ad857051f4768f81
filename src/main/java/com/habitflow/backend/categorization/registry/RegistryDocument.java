package com.habitflow.backend.categorization.registry;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * JSON shape of the registry asset, as read by Jackson. Fields are nullable here;
 * {@link CategoryRegistryLoader} reports the missing ones.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegistryDocument(String version, List<CategoryDocument> categories) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CategoryDocument(
            String id,
            Integer priority,
            List<TermDocument> keywords,
            List<TermDocument> phrases,
            List<PatternDocument> patterns
    ) {}

    public record TermDocument(String term, Double weight) {}

    public record PatternDocument(String regex, Double weight) {}
}
