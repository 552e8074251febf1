package com.irondust.catalog.model;

/**
 * Metadata derived from one document URL.
 *
 * <p>The extension is lower-cased and has no leading dot ("pdf"); it is empty
 * when the filename has none. The readable name depends on product context and
 * is attached by the documents section via {@link #withReadableName(String)}.
 */
public record DocumentEntry(String url,
                            String filename,
                            String extension,
                            String icon,
                            String fileTypeLabel,
                            String readableName) {

    public DocumentEntry withReadableName(String name) {
        return new DocumentEntry(url, filename, extension, icon, fileTypeLabel, name);
    }
}
