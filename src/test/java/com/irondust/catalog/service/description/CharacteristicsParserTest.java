package com.irondust.catalog.service.description;

import com.irondust.catalog.TestRules;
import com.irondust.catalog.model.Characteristic;
import com.irondust.catalog.model.DescriptionRules;
import com.irondust.catalog.model.GroupingResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class CharacteristicsParserTest {

    private static final String RAW = "Цвет корпуса: Белый; Мощность: 2 кВт; Страна производства: РОССИЯ; "
            + "Ширина: 94 см; Высота: 22 см; Глубина: 12 см; Вес: 3,5 кг";

    private final CharacteristicsParser parser = new CharacteristicsParser(TestRules.bundled());

    @Test
    public void groupsKeepTextOrderAndCountStats() {
        DescriptionStats stats = new DescriptionStats();
        GroupingResult grouped = parser.parseAndGroup(RAW, stats);

        assertEquals(7, grouped.size());
        assertEquals(List.of("Ширина", "Высота", "Глубина", "Вес"),
                grouped.get("Габариты и вес").stream().map(Characteristic::getKey).collect(Collectors.toList()));
        assertEquals("Внешний вид", grouped.all().get(0).getGroup());

        assertEquals(7, stats.getCharacteristicsParsed());
        assertEquals(7, stats.getCharacteristicsGrouped());
        assertEquals(3, stats.getAttributesMatched());
    }

    @Test
    public void attributesIncludeMergedDimensions() {
        CharacteristicsParser.AttributePayload payload = parser.extractAttributes(parser.parseAndGroup(RAW, null));

        assertEquals("Белый", payload.attributes().get("pa_color"));
        assertEquals("2 кВт", payload.attributes().get("pa_power"));
        assertEquals("РОССИЯ", payload.attributes().get("pa_country"));
        assertEquals("94 см x 22 см x 12 см", payload.attributes().get("pa_dimensions"));
        assertEquals(4, payload.attributes().size());
        assertEquals("1:0|0", payload.attributesData().get("pa_dimensions"));
        assertEquals(payload.attributes().keySet(), payload.attributesData().keySet());
    }

    @Test
    public void mergedDimensionsReplaceDirectValue() {
        GroupingResult grouped = parser.parseAndGroup("Габариты: 10x20x30; Ширина: 94 см", null);
        assertEquals("94 см", parser.extractAttributes(grouped).attributes().get("pa_dimensions"));
    }

    @Test
    public void noDimensionsWithoutDeclaredSlug() {
        CharacteristicsParser p = new CharacteristicsParser(DescriptionRules.builder()
                .vocabularyEntry("Цвет корпуса", "pa_color")
                .build());
        Map<String, String> attributes = p.extractAttributes(p.parseAndGroup(RAW, null)).attributes();
        assertEquals(Map.of("pa_color", "Белый"), attributes);
    }

    @Test
    public void firstValuePerSlugWinsAndBooleansUseLatinTokens() {
        CharacteristicsParser p = new CharacteristicsParser(DescriptionRules.builder()
                .vocabularyEntry("Цвет корпуса", "pa_color")
                .vocabularyEntry("Пульт ДУ", "pa_remote")
                .build());
        GroupingResult grouped = p.parseAndGroup("Цвет корпуса: Белый; Цвет корпуса: Черный; Пульт ДУ: Да", null);
        Map<String, String> attributes = p.extractAttributes(grouped).attributes();
        assertEquals("Белый", attributes.get("pa_color"));
        assertEquals("yes", attributes.get("pa_remote"));
    }

    @Test
    public void extractsConfiguredFields() {
        Map<String, String> fields = parser.extractFields(parser.parseAndGroup(RAW, null));
        assertEquals(Map.of(
                "weight", "3,5 кг",
                "width", "94 см",
                "height", "22 см",
                "length", "12 см"), fields);
        assertEquals(List.of("weight", "width", "height", "length"), List.copyOf(fields.keySet()));
    }

    @Test
    public void emptyInputGivesEmptyResults() {
        GroupingResult grouped = parser.parseAndGroup("", null);
        assertTrue(grouped.isEmpty());
        assertTrue(parser.extractAttributes(grouped).attributes().isEmpty());
        assertTrue(parser.extractFields(grouped).isEmpty());
    }
}
