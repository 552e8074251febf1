package com.irondust.catalog.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.NotBlank;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Represents one catalog product as handed over by the spreadsheet ingestion step.
 * This is the only input of the description pipeline.
 *
 * <p>ProductRecord carries:
 * <ul>
 *   <li>Identity (name, sku)</li>
 *   <li>The raw semicolon-delimited characteristics string</li>
 *   <li>The raw article HTML</li>
 *   <li>Document URL lists keyed by document type (e.g. "Чертежи", "Инструкции")</li>
 *   <li>Additional info codes (product code, barcodes, exclusivity flag)</li>
 * </ul>
 *
 * <p>Every getter returns a non-null value so that callers branch on emptiness
 * instead of on presence. The record is never modified by the pipeline.
 *
 * @see DescriptionResult
 * @see com.irondust.catalog.service.description.DescriptionAssembler
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProductRecord {
    /** Product display name */
    private String name;

    /** Stock keeping unit, used as the product id in logs and diagnostics */
    private String sku;

    /** Raw characteristics, e.g. "Цвет корпуса: Белый; Мощность: 2 кВт" */
    private String characteristicsRaw;

    /** Raw article HTML (may be plain text) */
    private String descriptionRaw;

    /** Document type to comma-separated URL list, in display order; the type becomes the block heading */
    private Map<@NotBlank(message = "document type must not be blank") String, String> documents = new LinkedHashMap<>();

    /** Product code, barcodes and exclusivity flag */
    private AdditionalInfo additionalInfo = new AdditionalInfo();

    public ProductRecord() {}

    public ProductRecord(String name, String sku, String characteristicsRaw, String descriptionRaw) {
        this.name = name;
        this.sku = sku;
        this.characteristicsRaw = characteristicsRaw;
        this.descriptionRaw = descriptionRaw;
    }

    public String getName() { return name != null ? name : ""; }
    public void setName(String name) { this.name = name; }
    public String getSku() { return sku != null ? sku : ""; }
    public void setSku(String sku) { this.sku = sku; }
    public String getCharacteristicsRaw() { return characteristicsRaw != null ? characteristicsRaw : ""; }
    public void setCharacteristicsRaw(String characteristicsRaw) { this.characteristicsRaw = characteristicsRaw; }
    public String getDescriptionRaw() { return descriptionRaw != null ? descriptionRaw : ""; }
    public void setDescriptionRaw(String descriptionRaw) { this.descriptionRaw = descriptionRaw; }

    public Map<String, String> getDocuments() { return documents != null ? documents : Map.of(); }
    public void setDocuments(Map<String, String> documents) {
        this.documents = documents != null ? new LinkedHashMap<>(documents) : new LinkedHashMap<>();
    }

    public AdditionalInfo getAdditionalInfo() { return additionalInfo != null ? additionalInfo : new AdditionalInfo(); }
    public void setAdditionalInfo(AdditionalInfo additionalInfo) { this.additionalInfo = additionalInfo; }

    /**
     * Adds one document URL list, keeping insertion order.
     */
    public ProductRecord addDocuments(String docType, String urlList) {
        if (this.documents == null) this.documents = new LinkedHashMap<>();
        this.documents.put(docType, urlList);
        return this;
    }

    /** Identifier used in logs: the SKU when present, otherwise the name. */
    public String logId() {
        if (sku != null && !sku.isBlank()) return sku;
        if (name != null && !name.isBlank()) return name;
        return "n/a";
    }
}
