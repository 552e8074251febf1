package com.irondust.catalog.service.description.section;

/**
 * Outcome of rendering one section: either HTML ({@link #ok}) or a reason the
 * block was left out ({@link #skipped}). Only non-empty {@code ok} results make
 * it into the description.
 */
public record SectionResult(String section, String html, String skipReason) {

    public static SectionResult ok(String section, String html) {
        return new SectionResult(section, html != null ? html : "", null);
    }

    public static SectionResult skipped(String section, String reason) {
        return new SectionResult(section, "", reason != null ? reason : "unknown");
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    public boolean hasContent() {
        return !isSkipped() && !html.isBlank();
    }
}
