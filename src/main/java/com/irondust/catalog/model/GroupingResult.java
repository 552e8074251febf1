package com.irondust.catalog.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Characteristics of one product grouped by display group.
 *
 * <p>Within a group, characteristics keep the order of the source text.
 * Every characteristic appears in exactly one group; {@link #all()} returns
 * them in source text order regardless of group.
 */
public final class GroupingResult {
    private final Map<String, List<Characteristic>> groups;
    private final List<Characteristic> all;

    private GroupingResult(Map<String, List<Characteristic>> groups, List<Characteristic> all) {
        this.groups = groups;
        this.all = all;
    }

    public static GroupingResult empty() {
        return new GroupingResult(Collections.emptyMap(), Collections.emptyList());
    }

    /**
     * Groups characteristics (given in source text order) by their {@code group} field.
     */
    public static GroupingResult of(List<Characteristic> characteristics) {
        Map<String, List<Characteristic>> byGroup = new LinkedHashMap<>();
        for (Characteristic c : characteristics) {
            byGroup.computeIfAbsent(c.getGroup(), g -> new ArrayList<>()).add(c);
        }
        Map<String, List<Characteristic>> frozen = new LinkedHashMap<>();
        byGroup.forEach((g, list) -> frozen.put(g, Collections.unmodifiableList(list)));
        return new GroupingResult(Collections.unmodifiableMap(frozen),
            Collections.unmodifiableList(new ArrayList<>(characteristics)));
    }

    public Map<String, List<Characteristic>> groups() { return groups; }

    public List<Characteristic> get(String group) {
        return groups.getOrDefault(group, Collections.emptyList());
    }

    public List<Characteristic> all() { return all; }

    public boolean isEmpty() { return all.isEmpty(); }

    public int size() { return all.size(); }
}
