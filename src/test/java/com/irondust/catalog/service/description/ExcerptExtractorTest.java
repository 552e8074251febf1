package com.irondust.catalog.service.description;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ExcerptExtractorTest {

    @Test
    public void longBodyIsCutAtWordBoundary() {
        String body = "<p>" + "слово ".repeat(84).trim() + "</p>";
        assertTrue(body.length() >= 500);

        String excerpt = ExcerptExtractor.extract(body, 200);
        assertTrue(excerpt.endsWith("..."));
        assertTrue(excerpt.length() <= 203);
        String cut = excerpt.substring(0, excerpt.length() - 3);
        assertTrue(cut.endsWith("слово"), "cut must not split a word");
        assertFalse(excerpt.contains("<"));
    }

    @Test
    public void hardCutsWhenThereIsNoLateSpace() {
        String excerpt = ExcerptExtractor.extract("<p>" + "a".repeat(500) + "</p>", 200);
        assertEquals("a".repeat(200) + "...", excerpt);
    }

    @Test
    public void shortTextIsReturnedWithoutMarkup() {
        String excerpt = ExcerptExtractor.extract("<h3>Заголовок</h3><p>Текст &amp; ещё</p>");
        assertEquals("Заголовок Текст & ещё", excerpt);
    }

    @Test
    public void nonBreakingSpacesBecomeSpaces() {
        assertEquals("Цена по запросу", ExcerptExtractor.extract("<p>Цена&nbsp;по&nbsp;запросу</p>"));
    }

    @Test
    public void customLengthUsesSameCutRule() {
        assertEquals("Один два...", ExcerptExtractor.extract("<p>Один два три четыре</p>", 10));
    }

    @Test
    public void emptyHtmlYieldsEmptyExcerpt() {
        assertEquals("", ExcerptExtractor.extract(""));
        assertEquals("", ExcerptExtractor.extract(null));
    }
}
