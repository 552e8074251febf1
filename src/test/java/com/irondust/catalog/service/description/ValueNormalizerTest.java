package com.irondust.catalog.service.description;

import com.irondust.catalog.model.DescriptionRules;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ValueNormalizerTest {

    private final ValueNormalizer normalizer = new ValueNormalizer(DescriptionRules.minimal());

    @Test
    public void collapsesWhitespace() {
        assertEquals("2 кВт", normalizer.normalize("  2   кВт "));
        assertEquals("", normalizer.normalize(null));
    }

    @Test
    public void displayUsesCyrillicYesNo() {
        assertEquals("Да", normalizer.forDisplay("yes"));
        assertEquals("Да", normalizer.forDisplay("YES"));
        assertEquals("Да", normalizer.forDisplay(" True "));
        assertEquals("Нет", normalizer.forDisplay("no"));
        assertEquals("Нет", normalizer.forDisplay("false"));
        assertEquals("Белый", normalizer.forDisplay("Белый"));
        assertEquals("Да", normalizer.forDisplay("Да"), "already Cyrillic stays as is");
    }

    @Test
    public void attributeKeepsLatinYesNo() {
        assertEquals("yes", normalizer.forAttribute("Да"));
        assertEquals("yes", normalizer.forAttribute("yes"));
        assertEquals("yes", normalizer.forAttribute("TRUE"));
        assertEquals("no", normalizer.forAttribute("нет"));
        assertEquals("no", normalizer.forAttribute("no"));
        assertEquals("no", normalizer.forAttribute("False"));
        assertEquals("Белый", normalizer.forAttribute("Белый"));
    }

    @Test
    public void sameValueBranchesPerConsumer() {
        assertEquals("Да", normalizer.forDisplay("yes"));
        assertEquals("yes", normalizer.forAttribute("yes"));
        assertEquals("Нет", normalizer.forDisplay("no"));
        assertEquals("no", normalizer.forAttribute("no"));
    }
}
