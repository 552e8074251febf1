package com.irondust.catalog.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MarkupUtilsTest {

    @Test
    public void escapesMarkupAndQuotes() {
        assertEquals("&lt;a href=&quot;x&quot;&gt;&amp;&lt;/a&gt;", MarkupUtils.esc("<a href=\"x\">&</a>"));
        assertEquals("", MarkupUtils.esc(null));
    }

    @Test
    public void detectsTags() {
        assertTrue(MarkupUtils.containsMarkup("<p>text</p>"));
        assertTrue(MarkupUtils.containsMarkup("line<br>"));
        assertFalse(MarkupUtils.containsMarkup("a < b"));
        assertFalse(MarkupUtils.containsMarkup(null));
    }
}
