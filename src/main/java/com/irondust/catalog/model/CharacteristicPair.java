package com.irondust.catalog.model;

/**
 * A raw key/value pair as cut out of the characteristics string, before grouping.
 * Both parts are trimmed; the value may be empty.
 */
public record CharacteristicPair(String key, String value) {
    public CharacteristicPair {
        key = key != null ? key : "";
        value = value != null ? value : "";
    }
}
