package com.irondust.catalog.service.description;

import com.irondust.catalog.util.MarkupUtils;

import java.util.regex.Pattern;

/**
 * Cleans the raw article HTML that opens a product description.
 *
 * <p>Rules applied in order:
 * <ol>
 *   <li>Trim</li>
 *   <li>Collapse runs of blank lines into a single blank line</li>
 *   <li>Strip leading spaces and tabs on every line</li>
 *   <li>Wrap in {@code <p>} when there is no markup at all</li>
 *   <li>Rewrite line breaks in XHTML form ({@code <br />})</li>
 * </ol>
 */
public final class ArticleHtmlCleaner {
    private ArticleHtmlCleaner() {}

    private static final Pattern BLANK_LINES = Pattern.compile("\\r?\\n[ \\t\\r]*(?:\\r?\\n[ \\t\\r]*)+");
    private static final Pattern LEADING_WS = Pattern.compile("(?m)^[ \\t]+");
    private static final Pattern LINE_BREAK = Pattern.compile("(?i)<br\\s*/?>");

    public static String clean(String html) {
        if (html == null || html.isBlank()) return "";
        String cleaned = html.trim();
        cleaned = BLANK_LINES.matcher(cleaned).replaceAll("\n\n");
        cleaned = LEADING_WS.matcher(cleaned).replaceAll("");
        if (!MarkupUtils.containsMarkup(cleaned)) {
            cleaned = "<p>" + cleaned + "</p>";
        }
        cleaned = LINE_BREAK.matcher(cleaned).replaceAll("<br />");
        return cleaned;
    }
}
