package com.irondust.catalog.service.description;

import com.irondust.catalog.model.Characteristic;
import com.irondust.catalog.model.CharacteristicPair;
import com.irondust.catalog.model.DescriptionRules;
import com.irondust.catalog.model.GroupingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a raw characteristics string into grouped {@link Characteristic}s and
 * derives the attribute payload and the extracted named fields from them.
 *
 * <p>Stateless apart from the caller-supplied {@link DescriptionStats}; safe to
 * share across threads.
 */
public class CharacteristicsParser {
    private static final Logger log = LoggerFactory.getLogger(CharacteristicsParser.class);

    /** Attribute slug to value plus slug to visibility flags. */
    public record AttributePayload(Map<String, String> attributes, Map<String, String> attributesData) {
        public static AttributePayload empty() {
            return new AttributePayload(new LinkedHashMap<>(), new LinkedHashMap<>());
        }
    }

    private final DescriptionRules rules;
    private final GroupClassifier groupClassifier;
    private final AttributeMatcher attributeMatcher;
    private final ValueNormalizer valueNormalizer;

    public CharacteristicsParser(DescriptionRules rules) {
        this.rules = rules;
        this.groupClassifier = new GroupClassifier(rules);
        this.attributeMatcher = new AttributeMatcher(rules);
        this.valueNormalizer = new ValueNormalizer(rules);
    }

    public GroupingResult parseAndGroup(String raw, DescriptionStats stats) {
        List<CharacteristicPair> pairs = CharacteristicsTokenizer.tokenize(raw);
        if (pairs.isEmpty()) return GroupingResult.empty();

        List<Characteristic> characteristics = new ArrayList<>(pairs.size());
        int matched = 0;
        for (CharacteristicPair pair : pairs) {
            String group = groupClassifier.classify(pair.key());
            AttributeMatcher.AttributeMatch match = attributeMatcher.match(pair.key());
            if (match.isAttribute()) matched++;
            characteristics.add(new Characteristic(
                pair.key(),
                valueNormalizer.normalize(pair.value()),
                group,
                match.isAttribute(),
                match.slug()
            ));
        }
        GroupingResult grouped = GroupingResult.of(characteristics);
        if (stats != null) {
            stats.addParsed(pairs.size());
            stats.addGrouped(characteristics.size());
            stats.addAttributesMatched(matched);
        }
        log.debug("Grouped {} characteristics into {} groups", grouped.size(), grouped.groups().size());
        return grouped;
    }

    /**
     * Builds the attribute payload. Values use the yes/no encoding; the first
     * characteristic per slug wins, and a merged dimensions value replaces any
     * directly matched one when the vocabulary declares the dimensions slug.
     */
    public AttributePayload extractAttributes(GroupingResult grouped) {
        AttributePayload payload = AttributePayload.empty();
        for (Characteristic c : grouped.all()) {
            if (!c.isExternalAttribute() || c.getAttributeSlug().isEmpty() || c.getValue().isEmpty()) continue;
            if (payload.attributes().containsKey(c.getAttributeSlug())) continue;
            payload.attributes().put(c.getAttributeSlug(), valueNormalizer.forAttribute(c.getValue()));
            payload.attributesData().put(c.getAttributeSlug(), rules.getAttributeVisibility());
        }

        if (rules.declaresDimensions()) {
            Optional<String> dimensions = DimensionMerger.mergeDimensions(grouped.all());
            dimensions.ifPresent(d -> {
                payload.attributes().put(rules.getDimensionsSlug(), d);
                payload.attributesData().put(rules.getDimensionsSlug(), rules.getAttributeVisibility());
            });
        }
        log.debug("Extracted {} attributes", payload.attributes().size());
        return payload;
    }

    /**
     * Extracts configured named fields (weight, width, ...). Fields are checked in
     * configured order; for each field the first characteristic whose normalized key
     * contains any normalized keyword wins.
     */
    public Map<String, String> extractFields(GroupingResult grouped) {
        Map<String, String> extracted = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> field : rules.getExtractFields().entrySet()) {
            String value = findFirst(grouped.all(), field.getValue());
            if (value != null) extracted.put(field.getKey(), value);
        }
        log.debug("Extracted fields: {}", extracted.keySet());
        return extracted;
    }

    private String findFirst(List<Characteristic> characteristics, List<String> keywords) {
        for (Characteristic c : characteristics) {
            if (c.getValue().isEmpty()) continue;
            String key = KeyNormalizer.normalize(c.getKey());
            for (String keyword : keywords) {
                String k = KeyNormalizer.normalize(keyword);
                if (!k.isEmpty() && key.contains(k)) return c.getValue();
            }
        }
        return null;
    }
}
