package com.irondust.catalog.model;

import java.util.Objects;

/**
 * One parsed characteristic: the original key, its whitespace-normalized value,
 * the display group it was classified into and its external attribute slug, if any.
 *
 * <p>The value is kept in its neutral form. Consumers pick the rendering:
 * the HTML description shows boolean-like values as Да/Нет, the attribute
 * payload keeps yes/no.
 */
public final class Characteristic {
    private final String key;
    private final String value;
    private final String group;
    private final boolean externalAttribute;
    private final String attributeSlug;

    public Characteristic(String key, String value, String group, boolean externalAttribute, String attributeSlug) {
        this.key = key != null ? key : "";
        this.value = value != null ? value : "";
        this.group = group != null ? group : "";
        this.externalAttribute = externalAttribute;
        this.attributeSlug = attributeSlug != null ? attributeSlug : "";
    }

    public String getKey() { return key; }
    public String getValue() { return value; }
    public String getGroup() { return group; }
    public boolean isExternalAttribute() { return externalAttribute; }
    public String getAttributeSlug() { return attributeSlug; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Characteristic that)) return false;
        return externalAttribute == that.externalAttribute
            && key.equals(that.key)
            && value.equals(that.value)
            && group.equals(that.group)
            && attributeSlug.equals(that.attributeSlug);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value, group, externalAttribute, attributeSlug);
    }

    @Override
    public String toString() {
        return "Characteristic{" + key + "=" + value + ", group=" + group
            + (externalAttribute ? ", slug=" + attributeSlug : "") + "}";
    }
}
