package com.irondust.catalog.service.description.section;

import com.irondust.catalog.model.AdditionalInfo;
import com.irondust.catalog.model.DescriptionRules;
import com.irondust.catalog.model.ProductRecord;
import com.irondust.catalog.service.description.DescriptionStats;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static com.irondust.catalog.util.MarkupUtils.esc;

/**
 * Product code, barcodes and the exclusive-product marker.
 */
public class AdditionalInfoSection implements DescriptionSection {
    static final String CODE_LABEL = "Код товара";
    static final String BARCODES_LABEL = "Штрих-коды";
    static final String EXCLUSIVE_MARKER = "Эксклюзивный товар";

    private static final Pattern BARCODE_SEPARATOR = Pattern.compile("\\s*/\\s*");

    private final DescriptionRules rules;

    public AdditionalInfoSection(DescriptionRules rules) {
        this.rules = rules;
    }

    @Override
    public boolean supports(ProductRecord product) {
        return !product.getAdditionalInfo().resolve(rules).isEmpty();
    }

    @Override
    public String render(ProductRecord product, DescriptionStats stats) {
        AdditionalInfo info = product.getAdditionalInfo().resolve(rules);
        List<String> parts = new ArrayList<>();

        String code = info.getCode().trim();
        if (!code.isEmpty()) {
            parts.add("<p><strong>" + CODE_LABEL + ":</strong> " + esc(code) + "</p>");
        }

        List<String> barcodes = splitBarcodes(info.getBarcodes());
        if (!barcodes.isEmpty()) {
            parts.add("<p><strong>" + BARCODES_LABEL + ":</strong> " + esc(String.join(", ", barcodes)) + "</p>");
        }

        if (isExclusive(info.getExclusive())) {
            parts.add("<p><strong>" + EXCLUSIVE_MARKER + "</strong></p>");
        }
        return String.join("\n", parts);
    }

    static List<String> splitBarcodes(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) return out;
        for (String code : BARCODE_SEPARATOR.split(raw.trim())) {
            String c = code.trim();
            if (!c.isEmpty()) out.add(c);
        }
        return out;
    }

    /**
     * Accepts "Да" as well as the labelled spreadsheet form "Эксклюзив - Да".
     * The prefix is stripped only when it is the configured exclusivity column label.
     */
    boolean isExclusive(String raw) {
        if (raw == null || raw.isBlank()) return false;
        String value = raw.trim();
        int dash = value.indexOf(" - ");
        if (dash >= 0 && value.substring(0, dash).trim().equalsIgnoreCase(rules.getExclusiveField())) {
            value = value.substring(dash + 3).trim();
        }
        return value.equalsIgnoreCase(rules.getExclusiveToken());
    }
}
