package com.irondust.catalog.service.description;

import org.jsoup.Jsoup;

/**
 * Derives the short, markup-free excerpt from an assembled description.
 *
 * <p>Text longer than {@code maxLength} is cut at the last space when that space
 * lies beyond 70% of {@code maxLength}, otherwise hard-cut at {@code maxLength};
 * in both cases "..." is appended.
 */
public final class ExcerptExtractor {
    private ExcerptExtractor() {}

    public static final int DEFAULT_MAX_LENGTH = 200;
    private static final double WORD_CUT_RATIO = 0.7;

    public static String extract(String html) {
        return extract(html, DEFAULT_MAX_LENGTH);
    }

    public static String extract(String html, int maxLength) {
        if (html == null || html.isBlank()) return "";
        // Jsoup separates block elements with spaces and decodes entities
        String text = Jsoup.parse(html).text();
        text = text.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();

        if (maxLength <= 0 || text.length() <= maxLength) return text;

        String truncated = text.substring(0, maxLength);
        int lastSpace = truncated.lastIndexOf(' ');
        if (lastSpace > maxLength * WORD_CUT_RATIO) {
            return truncated.substring(0, lastSpace) + "...";
        }
        return truncated + "...";
    }
}
