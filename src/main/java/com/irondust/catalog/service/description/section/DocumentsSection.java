package com.irondust.catalog.service.description.section;

import com.irondust.catalog.model.DescriptionRules;
import com.irondust.catalog.model.DocumentEntry;
import com.irondust.catalog.model.ProductRecord;
import com.irondust.catalog.service.description.DescriptionStats;
import com.irondust.catalog.service.description.DocumentLinkParser;
import com.irondust.catalog.util.ProductNameUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.irondust.catalog.util.MarkupUtils.esc;

/**
 * Documentation links grouped by document type (drawings, manuals, certificates, ...).
 *
 * <p>Each link shows the file icon and a readable name built from the type's
 * default word and the product name, e.g. "Инструкция Конвектор ЭВУБ-2 (PDF)".
 */
public class DocumentsSection implements DescriptionSection {
    static final String HEADING = "Документация";

    private final DescriptionRules rules;
    private final DocumentLinkParser linkParser;

    public DocumentsSection(DescriptionRules rules, DocumentLinkParser linkParser) {
        this.rules = rules;
        this.linkParser = linkParser;
    }

    @Override
    public boolean supports(ProductRecord product) {
        return product.getDocuments().values().stream().anyMatch(v -> v != null && !v.isBlank());
    }

    @Override
    public String render(ProductRecord product, DescriptionStats stats) {
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, String> docs : product.getDocuments().entrySet()) {
            String docType = docs.getKey() != null ? docs.getKey() : "";
            List<DocumentEntry> entries = linkParser.parse(docs.getValue());
            if (entries.isEmpty()) continue;

            parts.add("<h4>" + esc(rules.getDocumentHeadings().getOrDefault(docType, docType)) + "</h4>");
            parts.add("<ul>");
            for (DocumentEntry entry : entries) {
                DocumentEntry named = entry.withReadableName(readableName(docType, product.getName()));
                parts.add(item(named));
            }
            parts.add("</ul>");
        }
        if (parts.isEmpty()) return "";
        return "<h3>" + HEADING + "</h3>\n" + String.join("\n", parts);
    }

    /** Default word for the document type followed by the sanitized product name. */
    String readableName(String docType, String productName) {
        String word = rules.getDocumentNameWords().getOrDefault(docType, rules.getDefaultDocumentWord());
        String name = ProductNameUtils.sanitizeForDocumentName(productName);
        return name.isEmpty() ? word : word + " " + name;
    }

    private String item(DocumentEntry doc) {
        String alt = doc.extension().toUpperCase(Locale.ROOT);
        return "<li>"
            + "<img src=\"" + esc(rules.getIconsPath() + doc.icon()) + "\" width=\"32\" height=\"32\" alt=\"" + esc(alt)
            + "\" style=\"vertical-align: middle; margin-right: 8px;\" />"
            + "<a href=\"" + esc(doc.url()) + "\" target=\"_blank\" rel=\"noopener noreferrer\">"
            + esc(doc.readableName() + doc.fileTypeLabel()) + "</a>"
            + "</li>";
    }
}
