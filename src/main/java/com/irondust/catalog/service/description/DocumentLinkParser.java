package com.irondust.catalog.service.description;

import com.irondust.catalog.model.DescriptionRules;
import com.irondust.catalog.model.DocumentEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses a comma-separated list of document URLs into {@link DocumentEntry} metadata:
 * filename, lower-cased extension, icon and file-type label.
 *
 * <p>The readable name is left empty; it depends on the product name and the
 * document type, which the documents section supplies.
 */
public class DocumentLinkParser {
    private static final Logger log = LoggerFactory.getLogger(DocumentLinkParser.class);

    private final DescriptionRules rules;

    public DocumentLinkParser(DescriptionRules rules) {
        this.rules = rules;
    }

    public List<DocumentEntry> parse(String urlList) {
        if (urlList == null || urlList.isBlank()) return List.of();
        List<DocumentEntry> out = new ArrayList<>();
        for (String part : urlList.split(",")) {
            String url = part.trim();
            if (url.isEmpty()) continue;

            String filename = filenameOf(url);
            String extension = extensionOf(filename);
            String icon = rules.getFileIcons().getOrDefault(extension, rules.getDefaultIcon());
            String label = rules.getFileTypeLabels().getOrDefault(extension, "");
            out.add(new DocumentEntry(url, filename, extension, icon, label, ""));
        }
        log.debug("Parsed {} document links", out.size());
        return out;
    }

    static String filenameOf(String url) {
        String path;
        try {
            path = new URI(url).getPath();
        } catch (URISyntaxException e) {
            // Spaces and similar characters are common in spreadsheet URLs
            log.debug("Not a strict URI, stripping manually: {}", url);
            path = stripQueryAndFragment(url);
        }
        if (path == null) path = stripQueryAndFragment(url);
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    static String extensionOf(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot <= 0 || dot == filename.length() - 1) return "";
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static String stripQueryAndFragment(String url) {
        String s = url;
        int hash = s.indexOf('#');
        if (hash >= 0) s = s.substring(0, hash);
        int q = s.indexOf('?');
        if (q >= 0) s = s.substring(0, q);
        int scheme = s.indexOf("://");
        if (scheme >= 0) {
            int firstSlash = s.indexOf('/', scheme + 3);
            s = firstSlash >= 0 ? s.substring(firstSlash) : "";
        }
        return s;
    }
}
