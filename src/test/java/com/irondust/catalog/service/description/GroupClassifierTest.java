package com.irondust.catalog.service.description;

import com.irondust.catalog.TestRules;
import com.irondust.catalog.model.DescriptionRules;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GroupClassifierTest {

    @Test
    public void firstConfiguredRuleWinsOnOverlap() {
        DescriptionRules weightFirst = DescriptionRules.builder()
                .groupRule(List.of("вес"), "Габариты и вес")
                .groupRule(List.of("упаков"), "Упаковка")
                .build();
        DescriptionRules packagingFirst = DescriptionRules.builder()
                .groupRule(List.of("упаков"), "Упаковка")
                .groupRule(List.of("вес"), "Габариты и вес")
                .build();

        assertEquals("Габариты и вес", new GroupClassifier(weightFirst).classify("Вес упаковки"));
        assertEquals("Упаковка", new GroupClassifier(packagingFirst).classify("Вес упаковки"));
    }

    @Test
    public void keywordsAreCaseInsensitive() {
        DescriptionRules rules = DescriptionRules.builder()
                .groupRule(List.of("МОЩНОСТЬ"), "Электрика")
                .build();
        assertEquals("Электрика", new GroupClassifier(rules).classify("Мощность двигателя"));
    }

    @Test
    public void unmatchedAndEmptyKeysGoToDefaultGroup() {
        GroupClassifier classifier = new GroupClassifier(TestRules.bundled());
        assertEquals("Другие характеристики", classifier.classify("Экосертификат"));
        assertEquals("Другие характеристики", classifier.classify(""));
        assertEquals("Другие характеристики", classifier.classify(null));
        assertEquals("Другие характеристики", classifier.classify("???"));
    }

    @Test
    public void bundledRulesClassifyTypicalKeys() {
        GroupClassifier classifier = new GroupClassifier(TestRules.bundled());
        assertEquals("Технические характеристики", classifier.classify("Мощность"));
        assertEquals("Внешний вид", classifier.classify("Цвет корпуса"));
        assertEquals("Общие сведения", classifier.classify("Страна производства"));
        assertEquals("Безопасность", classifier.classify("Защита"));
        assertEquals("Управление", classifier.classify("Управление"));
        assertEquals("Габариты и вес", classifier.classify("Ширина"));
    }
}
