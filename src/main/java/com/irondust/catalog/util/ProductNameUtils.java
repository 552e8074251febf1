package com.irondust.catalog.util;

import java.util.regex.Pattern;

/**
 * Utilities for turning a product name into the tail of a document link text,
 * e.g. "Инструкция Конвектор ЭВУБ-2 220В".
 *
 * <p>Rules applied in order:
 * <ol>
 *   <li>Replace "/" with "-" (as in SKUs)</li>
 *   <li>Replace everything except letters, digits, underscore, whitespace and hyphens with a space</li>
 *   <li>Collapse repeated whitespace and trim</li>
 *   <li>Limit to 60 characters, cutting at the last space when it lies past position 40</li>
 * </ol>
 */
public final class ProductNameUtils {
    private ProductNameUtils() {}

    public static final int MAX_LENGTH = 60;
    private static final int MIN_WORD_CUT = 40;

    private static final Pattern DISALLOWED = Pattern.compile("[^\\w\\s\\-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SPACES = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    public static String sanitizeForDocumentName(String name) {
        if (name == null) return "";
        String s = name.trim().replace('/', '-');
        s = DISALLOWED.matcher(s).replaceAll(" ");
        s = SPACES.matcher(s).replaceAll(" ").trim();

        if (s.length() > MAX_LENGTH) {
            String truncated = s.substring(0, MAX_LENGTH);
            int lastSpace = truncated.lastIndexOf(' ');
            s = lastSpace > MIN_WORD_CUT ? truncated.substring(0, lastSpace) : truncated;
        }
        return s.trim();
    }
}
