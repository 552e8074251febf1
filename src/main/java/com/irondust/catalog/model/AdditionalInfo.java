package com.irondust.catalog.model;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Auxiliary code fields rendered in the "additional info" block of a description.
 *
 * <p>Barcodes arrive slash-delimited ("4601234567890 / 4601234567891"); the
 * exclusivity flag is a yes/no word, optionally prefixed with its label
 * ("Эксклюзив - Да").
 *
 * <p>Two JSON shapes are accepted: the explicit {@code {"code", "barcodes", "exclusive"}}
 * object, and the spreadsheet row shape keyed by column name
 * ({@code {"НС-код": "...", "Штрих код": "..."}}). Column entries are kept
 * aside until {@link #resolve(DescriptionRules)} maps them through the
 * configured column names.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AdditionalInfo {
    private String code;
    private String barcodes;
    private String exclusive;

    private final Map<String, String> columns = new LinkedHashMap<>();

    public AdditionalInfo() {}

    public AdditionalInfo(String code, String barcodes, String exclusive) {
        this.code = code;
        this.barcodes = barcodes;
        this.exclusive = exclusive;
    }

    /**
     * Builds the record from a spreadsheet-shaped map using the column names
     * configured in the rules (e.g. "НС-код", "Штрих код", "Эксклюзив").
     * Unknown keys are ignored; missing keys leave the field empty.
     */
    public static AdditionalInfo fromMap(Map<String, String> fields, DescriptionRules rules) {
        if (fields == null || fields.isEmpty()) return new AdditionalInfo();
        return new AdditionalInfo(
            fields.get(rules.getCodeField()),
            fields.get(rules.getBarcodeField()),
            fields.get(rules.getExclusiveField())
        );
    }

    public String getCode() { return code != null ? code : ""; }
    public void setCode(String code) { this.code = code; }
    public String getBarcodes() { return barcodes != null ? barcodes : ""; }
    public void setBarcodes(String barcodes) { this.barcodes = barcodes; }
    public String getExclusive() { return exclusive != null ? exclusive : ""; }
    public void setExclusive(String exclusive) { this.exclusive = exclusive; }

    /** Collects any JSON property other than code/barcodes/exclusive as a spreadsheet column. */
    @JsonAnySetter
    public void setColumn(String column, String value) {
        if (column != null) columns.put(column, value);
    }

    @JsonIgnore
    public Map<String, String> getColumns() { return Collections.unmodifiableMap(columns); }

    /**
     * Returns the effective record: explicit fields win, blank ones are filled
     * from the spreadsheet columns named in {@code rules}.
     */
    public AdditionalInfo resolve(DescriptionRules rules) {
        if (columns.isEmpty()) return this;
        AdditionalInfo fromColumns = fromMap(columns, rules);
        return new AdditionalInfo(
            firstNonBlank(code, fromColumns.code),
            firstNonBlank(barcodes, fromColumns.barcodes),
            firstNonBlank(exclusive, fromColumns.exclusive)
        );
    }

    @JsonIgnore
    public boolean isEmpty() {
        return getCode().isBlank() && getBarcodes().isBlank() && getExclusive().isBlank();
    }

    private static String firstNonBlank(String explicit, String column) {
        return explicit != null && !explicit.isBlank() ? explicit : column;
    }
}
