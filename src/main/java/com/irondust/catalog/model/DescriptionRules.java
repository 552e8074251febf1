package com.irondust.catalog.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only configuration shared by every description build.
 *
 * <p>Loaded once at startup (see {@code DescriptionRulesLoader}) and passed into
 * each component constructor. Instances are immutable: all collections are
 * unmodifiable copies, and ordered collections keep the configured order
 * because order is a tie-break for group classification, vocabulary matching
 * and field extraction.
 *
 * <h3>Contents</h3>
 * <ul>
 *   <li><strong>groupRules</strong> - ordered (keywords, group) classification rules</li>
 *   <li><strong>defaultGroup</strong> - group for characteristics no rule matches</li>
 *   <li><strong>vocabulary</strong> - external key to attribute slug, insertion ordered</li>
 *   <li><strong>dimensionsSlug</strong> - slug of the merged width x height x length attribute</li>
 *   <li><strong>extractFields</strong> - field name to matching keywords</li>
 *   <li><strong>displayBooleans / attributeBooleans</strong> - boolean token tables for the two renderings</li>
 *   <li><strong>fileIcons / fileTypeLabels</strong> - per-extension document metadata</li>
 *   <li><strong>documentNameWords / documentHeadings</strong> - per-document-type wording</li>
 * </ul>
 */
public final class DescriptionRules {
    public static final String DEFAULT_GROUP = "Другие характеристики";
    public static final String DEFAULT_DIMENSIONS_SLUG = "pa_dimensions";

    private final List<GroupRule> groupRules;
    private final String defaultGroup;
    private final Map<String, String> vocabulary;
    private final String dimensionsSlug;
    private final Map<String, List<String>> extractFields;
    private final Map<String, String> displayBooleans;
    private final Map<String, String> attributeBooleans;
    private final Map<String, String> fileIcons;
    private final String defaultIcon;
    private final Map<String, String> fileTypeLabels;
    private final Map<String, String> documentNameWords;
    private final String defaultDocumentWord;
    private final Map<String, String> documentHeadings;
    private final String iconsPath;
    private final String codeField;
    private final String barcodeField;
    private final String exclusiveField;
    private final String exclusiveToken;
    private final String attributeVisibility;

    private DescriptionRules(Builder b) {
        this.groupRules = Collections.unmodifiableList(new ArrayList<>(b.groupRules));
        this.defaultGroup = b.defaultGroup;
        this.vocabulary = frozen(b.vocabulary);
        this.dimensionsSlug = b.dimensionsSlug;
        Map<String, List<String>> fields = new LinkedHashMap<>();
        b.extractFields.forEach((k, v) -> fields.put(k, List.copyOf(v)));
        this.extractFields = Collections.unmodifiableMap(fields);
        this.displayBooleans = frozenLowerKeys(b.displayBooleans);
        this.attributeBooleans = frozenLowerKeys(b.attributeBooleans);
        this.fileIcons = frozenLowerKeys(b.fileIcons);
        this.defaultIcon = b.defaultIcon;
        this.fileTypeLabels = frozenLowerKeys(b.fileTypeLabels);
        this.documentNameWords = frozen(b.documentNameWords);
        this.defaultDocumentWord = b.defaultDocumentWord;
        this.documentHeadings = frozen(b.documentHeadings);
        this.iconsPath = b.iconsPath;
        this.codeField = b.codeField;
        this.barcodeField = b.barcodeField;
        this.exclusiveField = b.exclusiveField;
        this.exclusiveToken = b.exclusiveToken;
        this.attributeVisibility = b.attributeVisibility;
    }

    /**
     * Built-in fallback used when the rules file cannot be loaded: no classification
     * rules (everything lands in the default group), empty vocabulary, but working
     * boolean tables and document wording.
     */
    public static DescriptionRules minimal() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a builder pre-filled with this instance's values. */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.groupRules = new ArrayList<>(groupRules);
        b.defaultGroup = defaultGroup;
        b.vocabulary = new LinkedHashMap<>(vocabulary);
        b.dimensionsSlug = dimensionsSlug;
        b.extractFields = new LinkedHashMap<>(extractFields);
        b.displayBooleans = new LinkedHashMap<>(displayBooleans);
        b.attributeBooleans = new LinkedHashMap<>(attributeBooleans);
        b.fileIcons = new LinkedHashMap<>(fileIcons);
        b.defaultIcon = defaultIcon;
        b.fileTypeLabels = new LinkedHashMap<>(fileTypeLabels);
        b.documentNameWords = new LinkedHashMap<>(documentNameWords);
        b.defaultDocumentWord = defaultDocumentWord;
        b.documentHeadings = new LinkedHashMap<>(documentHeadings);
        b.iconsPath = iconsPath;
        b.codeField = codeField;
        b.barcodeField = barcodeField;
        b.exclusiveField = exclusiveField;
        b.exclusiveToken = exclusiveToken;
        b.attributeVisibility = attributeVisibility;
        return b;
    }

    public List<GroupRule> getGroupRules() { return groupRules; }
    public String getDefaultGroup() { return defaultGroup; }
    public Map<String, String> getVocabulary() { return vocabulary; }
    public String getDimensionsSlug() { return dimensionsSlug; }
    public Map<String, List<String>> getExtractFields() { return extractFields; }
    public Map<String, String> getDisplayBooleans() { return displayBooleans; }
    public Map<String, String> getAttributeBooleans() { return attributeBooleans; }
    public Map<String, String> getFileIcons() { return fileIcons; }
    public String getDefaultIcon() { return defaultIcon; }
    public Map<String, String> getFileTypeLabels() { return fileTypeLabels; }
    public Map<String, String> getDocumentNameWords() { return documentNameWords; }
    public String getDefaultDocumentWord() { return defaultDocumentWord; }
    public Map<String, String> getDocumentHeadings() { return documentHeadings; }
    public String getIconsPath() { return iconsPath; }
    public String getCodeField() { return codeField; }
    public String getBarcodeField() { return barcodeField; }
    public String getExclusiveField() { return exclusiveField; }
    public String getExclusiveToken() { return exclusiveToken; }
    public String getAttributeVisibility() { return attributeVisibility; }

    /** Group names in display order: configured rule order, default group last. */
    public List<String> groupDisplayOrder() {
        List<String> order = new ArrayList<>();
        for (GroupRule rule : groupRules) {
            if (!order.contains(rule.group())) order.add(rule.group());
        }
        order.remove(defaultGroup);
        order.add(defaultGroup);
        return order;
    }

    /** True when the vocabulary declares the merged-dimensions slug. */
    public boolean declaresDimensions() {
        return dimensionsSlug != null && !dimensionsSlug.isBlank() && vocabulary.containsValue(dimensionsSlug);
    }

    private static Map<String, String> frozen(Map<String, String> m) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }

    private static Map<String, String> frozenLowerKeys(Map<String, String> m) {
        Map<String, String> out = new LinkedHashMap<>();
        m.forEach((k, v) -> out.put(k.toLowerCase(Locale.ROOT), v));
        return Collections.unmodifiableMap(out);
    }

    public static final class Builder {
        private List<GroupRule> groupRules = new ArrayList<>();
        private String defaultGroup = DEFAULT_GROUP;
        private Map<String, String> vocabulary = new LinkedHashMap<>();
        private String dimensionsSlug = DEFAULT_DIMENSIONS_SLUG;
        private Map<String, List<String>> extractFields = new LinkedHashMap<>();
        private Map<String, String> displayBooleans = new LinkedHashMap<>(Map.of(
            "yes", "Да", "true", "Да", "no", "Нет", "false", "Нет"));
        private Map<String, String> attributeBooleans = new LinkedHashMap<>(Map.of(
            "да", "yes", "yes", "yes", "true", "yes", "нет", "no", "no", "no", "false", "no"));
        private Map<String, String> fileIcons = new LinkedHashMap<>();
        private String defaultIcon = "";
        private Map<String, String> fileTypeLabels = new LinkedHashMap<>();
        private Map<String, String> documentNameWords = new LinkedHashMap<>(Map.of(
            "Чертежи", "Чертеж",
            "Инструкции", "Инструкция",
            "Сертификаты", "Сертификат",
            "Промоматериалы", "Промо-материал",
            "Видео", "Видео"));
        private String defaultDocumentWord = "Документ";
        private Map<String, String> documentHeadings = new LinkedHashMap<>();
        private String iconsPath = "";
        private String codeField = "НС-код";
        private String barcodeField = "Штрих код";
        private String exclusiveField = "Эксклюзив";
        private String exclusiveToken = "да";
        private String attributeVisibility = "1:0|0";

        private Builder() {}

        public Builder groupRule(List<String> keywords, String group) {
            List<String> lowered = new ArrayList<>();
            for (String k : keywords) {
                if (k != null && !k.isBlank()) lowered.add(k.toLowerCase(Locale.ROOT));
            }
            this.groupRules.add(new GroupRule(lowered, group));
            return this;
        }

        public Builder clearGroupRules() { this.groupRules.clear(); return this; }

        public Builder defaultGroup(String defaultGroup) {
            if (defaultGroup != null && !defaultGroup.isBlank()) this.defaultGroup = defaultGroup;
            return this;
        }

        public Builder vocabularyEntry(String externalKey, String slug) {
            this.vocabulary.put(externalKey, slug);
            return this;
        }

        public Builder clearVocabulary() { this.vocabulary.clear(); return this; }

        public Builder dimensionsSlug(String slug) { this.dimensionsSlug = slug; return this; }

        public Builder extractField(String field, List<String> keywords) {
            this.extractFields.put(field, new ArrayList<>(keywords));
            return this;
        }

        public Builder displayBooleans(Map<String, String> table) {
            this.displayBooleans = new LinkedHashMap<>(table);
            return this;
        }

        public Builder attributeBooleans(Map<String, String> table) {
            this.attributeBooleans = new LinkedHashMap<>(table);
            return this;
        }

        public Builder fileIcon(String extension, String icon) {
            this.fileIcons.put(stripDot(extension), icon);
            return this;
        }

        public Builder defaultIcon(String icon) { this.defaultIcon = icon != null ? icon : ""; return this; }

        public Builder fileTypeLabel(String extension, String label) {
            this.fileTypeLabels.put(stripDot(extension), label);
            return this;
        }

        public Builder documentNameWord(String docType, String word) {
            this.documentNameWords.put(docType, word);
            return this;
        }

        public Builder defaultDocumentWord(String word) {
            if (word != null && !word.isBlank()) this.defaultDocumentWord = word;
            return this;
        }

        public Builder documentHeading(String docType, String heading) {
            this.documentHeadings.put(docType, heading);
            return this;
        }

        public Builder iconsPath(String iconsPath) { this.iconsPath = iconsPath != null ? iconsPath : ""; return this; }

        public Builder additionalInfoFields(String codeField, String barcodeField, String exclusiveField) {
            if (codeField != null) this.codeField = codeField;
            if (barcodeField != null) this.barcodeField = barcodeField;
            if (exclusiveField != null) this.exclusiveField = exclusiveField;
            return this;
        }

        public Builder exclusiveToken(String token) {
            if (token != null && !token.isBlank()) this.exclusiveToken = token;
            return this;
        }

        public Builder attributeVisibility(String flags) {
            if (flags != null) this.attributeVisibility = flags;
            return this;
        }

        public DescriptionRules build() {
            return new DescriptionRules(this);
        }

        private static String stripDot(String extension) {
            if (extension == null) return "";
            return extension.startsWith(".") ? extension.substring(1) : extension;
        }
    }
}
