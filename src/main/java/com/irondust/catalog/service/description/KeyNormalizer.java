package com.irondust.catalog.service.description;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form of a characteristic key for case- and punctuation-insensitive
 * comparison. Never used for display.
 *
 * <p>"Цвет, корпуса!" and "цвет корпуса" both normalize to "цвет корпуса".
 * The function is idempotent.
 */
public final class KeyNormalizer {
    private KeyNormalizer() {}

    // Unicode-aware so Cyrillic letters count as word characters
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SPACES = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    public static String normalize(String key) {
        if (key == null || key.isEmpty()) return "";
        String s = key.toLowerCase(Locale.ROOT);
        s = NON_WORD.matcher(s).replaceAll(" ");
        s = SPACES.matcher(s).replaceAll(" ").trim();
        return s;
    }
}
