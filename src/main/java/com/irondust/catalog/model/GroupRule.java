package com.irondust.catalog.model;

import java.util.List;

/**
 * One classification rule: a characteristic whose normalized key contains any of
 * the keywords belongs to {@code group}. Rules are evaluated in configured order.
 */
public record GroupRule(List<String> keywords, String group) {
    public GroupRule {
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
    }
}
