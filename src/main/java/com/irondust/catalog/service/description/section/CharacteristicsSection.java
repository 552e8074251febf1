package com.irondust.catalog.service.description.section;

import com.irondust.catalog.model.Characteristic;
import com.irondust.catalog.model.DescriptionRules;
import com.irondust.catalog.model.GroupingResult;
import com.irondust.catalog.model.ProductRecord;
import com.irondust.catalog.service.description.CharacteristicsParser;
import com.irondust.catalog.service.description.DescriptionStats;
import com.irondust.catalog.service.description.ValueNormalizer;

import java.util.ArrayList;
import java.util.List;

import static com.irondust.catalog.util.MarkupUtils.esc;

/**
 * Technical characteristics, one heading and list per display group.
 *
 * <p>Groups appear in configured rule order with the default group last; empty
 * groups are left out. Boolean-like values are shown as Да/Нет.
 */
public class CharacteristicsSection implements DescriptionSection {
    static final String HEADING = "Технические характеристики";

    private final DescriptionRules rules;
    private final CharacteristicsParser parser;
    private final ValueNormalizer valueNormalizer;

    public CharacteristicsSection(DescriptionRules rules, CharacteristicsParser parser) {
        this.rules = rules;
        this.parser = parser;
        this.valueNormalizer = new ValueNormalizer(rules);
    }

    @Override
    public boolean supports(ProductRecord product) {
        return !product.getCharacteristicsRaw().isBlank();
    }

    @Override
    public String render(ProductRecord product, DescriptionStats stats) {
        GroupingResult grouped = parser.parseAndGroup(product.getCharacteristicsRaw(), stats);
        return render(grouped);
    }

    String render(GroupingResult grouped) {
        if (grouped.isEmpty()) return "";

        List<String> parts = new ArrayList<>();
        for (String group : rules.groupDisplayOrder()) {
            List<Characteristic> items = grouped.get(group);
            if (items.isEmpty()) continue;
            parts.add("<h4>" + esc(group) + "</h4>");
            parts.add("<ul>");
            for (Characteristic c : items) {
                parts.add(item(c));
            }
            parts.add("</ul>");
        }
        if (parts.isEmpty()) return "";
        return "<h3>" + HEADING + "</h3>\n" + String.join("\n", parts);
    }

    private String item(Characteristic c) {
        if (c.getValue().isEmpty()) {
            return "<li>" + esc(c.getKey()) + "</li>";
        }
        return "<li><strong>" + esc(c.getKey()) + ":</strong> " + esc(valueNormalizer.forDisplay(c.getValue())) + "</li>";
    }
}
