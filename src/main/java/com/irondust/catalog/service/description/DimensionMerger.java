package com.irondust.catalog.service.description;

import com.irondust.catalog.model.Characteristic;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Collapses width, height and length/depth characteristics into the single
 * "W x H x L" value of the merged dimensions attribute.
 *
 * <p>Only the axes actually present are joined, always in width, height, length
 * order. When an axis appears more than once the first occurrence wins.
 */
public final class DimensionMerger {
    private DimensionMerger() {}

    public static Optional<String> mergeDimensions(List<Characteristic> characteristics) {
        if (characteristics == null || characteristics.isEmpty()) return Optional.empty();
        String width = null;
        String height = null;
        String length = null;

        for (Characteristic c : characteristics) {
            String key = KeyNormalizer.normalize(c.getKey());
            String value = c.getValue();
            if (value.isBlank()) continue;
            if (key.contains("ширин")) {
                if (width == null) width = value;
            } else if (key.contains("высот")) {
                if (height == null) height = value;
            } else if (key.contains("глубин") || key.contains("длин")) {
                if (length == null) length = value;
            }
        }

        List<String> parts = new ArrayList<>(3);
        if (width != null) parts.add(width);
        if (height != null) parts.add(height);
        if (length != null) parts.add(length);
        if (parts.isEmpty()) return Optional.empty();
        return Optional.of(String.join(" x ", parts));
    }
}
