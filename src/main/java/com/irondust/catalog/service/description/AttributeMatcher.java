package com.irondust.catalog.service.description;

import com.irondust.catalog.model.DescriptionRules;

import java.util.Map;

/**
 * Decides whether a characteristic maps onto the external attribute vocabulary.
 *
 * <p>Matching runs in two phases:
 * <ol>
 *   <li>Exact lookup of the trimmed key</li>
 *   <li>Bidirectional containment of normalized keys, so "Цвет корпуса изделия"
 *       and "Мощность, кВт" still find "Цвет корпуса" and "Мощность"</li>
 * </ol>
 * The vocabulary is walked in insertion order and the first hit wins. Short
 * vocabulary keys can produce false positives in phase 2; no further
 * disambiguation is attempted.
 */
public class AttributeMatcher {

    /** Outcome of a vocabulary lookup; {@code slug} is empty when there is no match. */
    public record AttributeMatch(boolean isAttribute, String slug) {
        public static final AttributeMatch NONE = new AttributeMatch(false, "");
    }

    private final DescriptionRules rules;

    public AttributeMatcher(DescriptionRules rules) {
        this.rules = rules;
    }

    public AttributeMatch match(String key) {
        if (key == null) return AttributeMatch.NONE;
        Map<String, String> vocabulary = rules.getVocabulary();

        String exact = vocabulary.get(key.trim());
        if (exact != null) return new AttributeMatch(true, exact);

        String normalizedKey = KeyNormalizer.normalize(key);
        // An empty string is contained in everything
        if (normalizedKey.isEmpty()) return AttributeMatch.NONE;

        for (Map.Entry<String, String> entry : vocabulary.entrySet()) {
            String normalizedVocabKey = KeyNormalizer.normalize(entry.getKey());
            if (normalizedVocabKey.isEmpty()) continue;
            if (normalizedKey.contains(normalizedVocabKey) || normalizedVocabKey.contains(normalizedKey)) {
                return new AttributeMatch(true, entry.getValue());
            }
        }
        return AttributeMatch.NONE;
    }
}
