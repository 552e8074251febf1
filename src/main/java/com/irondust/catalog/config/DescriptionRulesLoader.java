package com.irondust.catalog.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.irondust.catalog.model.DescriptionRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@link DescriptionRules} from a JSON resource.
 *
 * <p>Object field order in the file is significant (vocabulary matching and
 * field extraction take the first hit) and is preserved. A missing or unreadable
 * file is not fatal: the loader logs a warning and returns
 * {@link DescriptionRules#minimal()}.
 */
public class DescriptionRulesLoader {
    private static final Logger log = LoggerFactory.getLogger(DescriptionRulesLoader.class);

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public DescriptionRulesLoader(ObjectMapper objectMapper) {
        this(objectMapper, new DefaultResourceLoader());
    }

    public DescriptionRulesLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    public DescriptionRules load(String location) {
        if (location == null || location.isBlank()) {
            log.warn("No description rules location configured, using built-in minimal rules");
            return DescriptionRules.minimal();
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Description rules not found at {}, using built-in minimal rules", location);
            return DescriptionRules.minimal();
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            DescriptionRules rules = fromJson(root);
            log.info("Loaded description rules from {}: {} group rules, {} vocabulary entries",
                location, rules.getGroupRules().size(), rules.getVocabulary().size());
            return rules;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load description rules from {}: {}. Using built-in minimal rules", location, e.toString());
            return DescriptionRules.minimal();
        }
    }

    DescriptionRules fromJson(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("rules document must be a JSON object");
        }
        DescriptionRules.Builder b = DescriptionRules.builder();

        for (JsonNode rule : root.path("groups")) {
            String group = rule.path("group").asText("");
            if (group.isBlank()) continue;
            b.groupRule(textList(rule.path("keywords")), group);
        }
        b.defaultGroup(root.path("default_group").asText(null));

        JsonNode vocabulary = root.path("attributes");
        for (Iterator<Map.Entry<String, JsonNode>> it = vocabulary.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            b.vocabularyEntry(e.getKey(), e.getValue().asText());
        }
        if (root.hasNonNull("dimensions_slug")) {
            b.dimensionsSlug(root.path("dimensions_slug").asText());
        }

        JsonNode fields = root.path("extract_fields");
        for (Iterator<Map.Entry<String, JsonNode>> it = fields.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            b.extractField(e.getKey(), textList(e.getValue()));
        }

        JsonNode booleans = root.path("booleans");
        if (booleans.path("display").isObject()) b.displayBooleans(textMap(booleans.path("display")));
        if (booleans.path("attribute").isObject()) b.attributeBooleans(textMap(booleans.path("attribute")));

        JsonNode documents = root.path("documents");
        textMap(documents.path("icons")).forEach(b::fileIcon);
        textMap(documents.path("file_type_labels")).forEach(b::fileTypeLabel);
        textMap(documents.path("name_words")).forEach(b::documentNameWord);
        textMap(documents.path("headings")).forEach(b::documentHeading);
        if (documents.hasNonNull("default_icon")) b.defaultIcon(documents.path("default_icon").asText());
        if (documents.hasNonNull("default_name_word")) b.defaultDocumentWord(documents.path("default_name_word").asText());
        if (documents.hasNonNull("icons_path")) b.iconsPath(documents.path("icons_path").asText());

        JsonNode info = root.path("additional_info");
        b.additionalInfoFields(
            info.path("code_field").asText(null),
            info.path("barcode_field").asText(null),
            info.path("exclusive_field").asText(null));
        b.exclusiveToken(info.path("exclusive_token").asText(null));

        if (root.hasNonNull("attribute_visibility")) b.attributeVisibility(root.path("attribute_visibility").asText());
        return b.build();
    }

    private static List<String> textList(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || !node.isArray()) return out;
        for (JsonNode n : node) {
            if (n.isTextual()) out.add(n.asText());
        }
        return out;
    }

    private static Map<String, String> textMap(JsonNode node) {
        Map<String, String> out = new LinkedHashMap<>();
        if (node == null || !node.isObject()) return out;
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), e.getValue().asText());
        }
        return out;
    }
}
