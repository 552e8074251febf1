package com.irondust.catalog.service.description;

import com.irondust.catalog.model.DescriptionRules;
import com.irondust.catalog.model.GroupRule;

/**
 * Assigns a characteristic key to a display group.
 *
 * <p>Rules are checked in configured order and the first rule with any keyword
 * contained in the normalized key wins, so rule order is the tie-break when a
 * key matches several rules ("Вес упаковки" matches both "вес" and "упаковка").
 * Keys no rule matches, including empty keys, go to the default group.
 */
public class GroupClassifier {
    private final DescriptionRules rules;

    public GroupClassifier(DescriptionRules rules) {
        this.rules = rules;
    }

    public String classify(String key) {
        String normalized = KeyNormalizer.normalize(key);
        if (normalized.isEmpty()) return rules.getDefaultGroup();

        for (GroupRule rule : rules.getGroupRules()) {
            for (String keyword : rule.keywords()) {
                if (normalized.contains(keyword)) {
                    return rule.group();
                }
            }
        }
        return rules.getDefaultGroup();
    }
}
