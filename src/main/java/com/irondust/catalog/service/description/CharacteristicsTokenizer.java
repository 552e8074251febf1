package com.irondust.catalog.service.description;

import com.irondust.catalog.model.CharacteristicPair;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a raw characteristics string into ordered key/value pairs.
 *
 * <p>Parsing is tolerant: malformed input never raises.
 * <ol>
 *   <li>Split on {@code ;} only outside parentheses, so "Питание (220 В; 50 Гц)" stays whole</li>
 *   <li>If that yields at most one segment (e.g. unbalanced brackets), split on every {@code ;}</li>
 *   <li>Split each segment on its first {@code :}; values may contain further colons</li>
 *   <li>A segment without a colon, or with nothing after it ("Цвет:"), is kept as a key with an empty value</li>
 *   <li>A segment with an empty key (": Белый") is dropped</li>
 * </ol>
 */
public final class CharacteristicsTokenizer {
    private CharacteristicsTokenizer() {}

    public static List<CharacteristicPair> tokenize(String raw) {
        if (raw == null || raw.isBlank()) return List.of();
        String text = raw.trim();

        List<String> segments = splitOutsideBrackets(text);
        if (segments.size() <= 1) {
            segments = splitNaive(text);
        }

        List<CharacteristicPair> out = new ArrayList<>();
        for (String segment : segments) {
            int colon = segment.indexOf(':');
            if (colon < 0) {
                out.add(new CharacteristicPair(segment, ""));
                continue;
            }
            String key = segment.substring(0, colon).trim();
            String value = stripTrailingSemicolons(segment.substring(colon + 1).trim());
            if (key.isEmpty()) continue;
            out.add(new CharacteristicPair(key, value));
        }
        return out;
    }

    private static List<String> splitOutsideBrackets(String text) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
            }
            if (ch == ';' && depth == 0) {
                addTrimmed(parts, current);
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        addTrimmed(parts, current);
        return parts;
    }

    private static List<String> splitNaive(String text) {
        List<String> parts = new ArrayList<>();
        for (String p : text.split(";")) {
            String t = p.trim();
            if (!t.isEmpty()) parts.add(t);
        }
        return parts;
    }

    private static void addTrimmed(List<String> parts, CharSequence part) {
        String t = part.toString().trim();
        if (!t.isEmpty()) parts.add(t);
    }

    private static String stripTrailingSemicolons(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == ';') end--;
        return value.substring(0, end).trim();
    }
}
