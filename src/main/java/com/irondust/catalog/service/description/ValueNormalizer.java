package com.irondust.catalog.service.description;

import com.irondust.catalog.model.DescriptionRules;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Cleans characteristic values and renders boolean-like values for their consumer.
 *
 * <p>The same value has two textual forms:
 * <ul>
 *   <li>{@link #forDisplay(String)} - HTML description, "yes"/"true" become "Да", "no"/"false" become "Нет"</li>
 *   <li>{@link #forAttribute(String)} - attribute payload, "да"/"true" become "yes", "нет"/"false" become "no";
 *       Cyrillic Да/Нет is never produced</li>
 * </ul>
 * Lookups ignore case; values outside the token tables are returned unchanged.
 */
public class ValueNormalizer {
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private final DescriptionRules rules;

    public ValueNormalizer(DescriptionRules rules) {
        this.rules = rules;
    }

    /** Trims and collapses internal whitespace. */
    public String normalize(String value) {
        if (value == null || value.isEmpty()) return "";
        return SPACES.matcher(value.trim()).replaceAll(" ");
    }

    public String forDisplay(String value) {
        String v = normalize(value);
        String mapped = rules.getDisplayBooleans().get(v.toLowerCase(Locale.ROOT));
        return mapped != null ? mapped : v;
    }

    public String forAttribute(String value) {
        String v = normalize(value);
        String mapped = rules.getAttributeBooleans().get(v.toLowerCase(Locale.ROOT));
        return mapped != null ? mapped : v;
    }
}
