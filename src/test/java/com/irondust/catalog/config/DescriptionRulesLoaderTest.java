package com.irondust.catalog.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.irondust.catalog.model.DescriptionRules;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DescriptionRulesLoaderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final DescriptionRulesLoader loader = new DescriptionRulesLoader(mapper);

    @Test
    public void loadsBundledRulesPreservingOrder() {
        DescriptionRules rules = loader.load("classpath:description-rules.json");

        assertEquals(9, rules.getGroupRules().size());
        assertEquals("Габариты и вес", rules.groupDisplayOrder().get(0));
        assertEquals("Другие характеристики", rules.groupDisplayOrder().get(rules.groupDisplayOrder().size() - 1));
        assertEquals("Цвет корпуса", rules.getVocabulary().keySet().iterator().next());
        assertEquals("pa_color", rules.getVocabulary().get("Цвет корпуса"));
        assertTrue(rules.declaresDimensions());
        assertEquals(List.of("weight", "width", "height", "length"), List.copyOf(rules.getExtractFields().keySet()));
        assertEquals("pdf-icon.png", rules.getFileIcons().get("pdf"));
        assertEquals("document-icon.png", rules.getDefaultIcon());
        assertEquals("/wp-content/uploads/2026/02/", rules.getIconsPath());
        assertEquals("Чертежи и схемы", rules.getDocumentHeadings().get("Чертежи"));
        assertEquals("НС-код", rules.getCodeField());
    }

    @Test
    public void missingFileFallsBackToMinimalRules() {
        DescriptionRules rules = loader.load("classpath:no-such-rules.json");
        assertTrue(rules.getGroupRules().isEmpty());
        assertTrue(rules.getVocabulary().isEmpty());
        assertEquals(DescriptionRules.DEFAULT_GROUP, rules.getDefaultGroup());
        assertEquals("Да", rules.getDisplayBooleans().get("yes"));
        assertEquals("no", rules.getAttributeBooleans().get("нет"));

        assertTrue(loader.load("  ").getGroupRules().isEmpty());
        assertTrue(new DescriptionRulesLoader(mapper, new DefaultResourceLoader()).load(null).getVocabulary().isEmpty());
    }

    @Test
    public void parsesPartialDocument() throws Exception {
        String json = "{"
                + "\"groups\": [{\"group\": \"Электрика\", \"keywords\": [\"МОЩНОСТЬ\", 5]}, {\"group\": \"\", \"keywords\": [\"x\"]}],"
                + "\"attributes\": {\"Мощность\": \"pa_power\"},"
                + "\"documents\": {\"icons\": {\".PDF\": \"pdf.png\"}, \"file_type_labels\": {\"pdf\": \" (PDF)\"}}"
                + "}";
        DescriptionRules rules = loader.fromJson(mapper.readTree(json));

        assertEquals(1, rules.getGroupRules().size());
        assertEquals(List.of("мощность"), rules.getGroupRules().get(0).keywords());
        assertEquals(List.of("Электрика", "Другие характеристики"), rules.groupDisplayOrder());
        assertFalse(rules.declaresDimensions());
        assertEquals("pdf.png", rules.getFileIcons().get("pdf"));
        assertEquals("1:0|0", rules.getAttributeVisibility());
        assertEquals("Документ", rules.getDefaultDocumentWord());
    }

    @Test
    public void rejectsNonObjectDocument() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> loader.fromJson(mapper.readTree("[1, 2]")));
    }
}
