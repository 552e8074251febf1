package com.irondust.catalog.util;

import java.util.regex.Pattern;

/**
 * Small helpers for building description HTML by string concatenation.
 */
public final class MarkupUtils {
    private MarkupUtils() {}

    private static final Pattern TAG = Pattern.compile("<[^>]+>");

    /** Escapes text for use in element content and double-quoted attributes. */
    public static String esc(String s) {
        if (s == null) return "";
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }

    /** True when the string contains at least one angle-bracket tag. */
    public static boolean containsMarkup(String s) {
        return s != null && TAG.matcher(s).find();
    }
}
