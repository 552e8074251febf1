package com.irondust.catalog.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The unit handed back to the export step for one product.
 *
 * <ul>
 *   <li><strong>content</strong> - assembled HTML description</li>
 *   <li><strong>excerpt</strong> - markup-free summary of the content</li>
 *   <li><strong>attributes</strong> - attribute slug to value (boolean-like values as yes/no)</li>
 *   <li><strong>attributesData</strong> - attribute slug to visibility flags, e.g. "1:0|0"</li>
 *   <li><strong>extractedFields</strong> - named fields such as weight, width, height, length</li>
 *   <li><strong>diagnostics</strong> - sections that were skipped and why</li>
 * </ul>
 *
 * <p>Field naming, ordering and CSV quoting belong to the export step.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DescriptionResult {
    private String content = "";
    private String excerpt = "";
    private Map<String, String> attributes = new LinkedHashMap<>();
    private Map<String, String> attributesData = new LinkedHashMap<>();
    private Map<String, String> extractedFields = new LinkedHashMap<>();
    private List<Warn> diagnostics = new ArrayList<>();

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content != null ? content : ""; }
    public String getExcerpt() { return excerpt; }
    public void setExcerpt(String excerpt) { this.excerpt = excerpt != null ? excerpt : ""; }
    public Map<String, String> getAttributes() { return attributes; }
    public void setAttributes(Map<String, String> attributes) { this.attributes = attributes; }
    public Map<String, String> getAttributesData() { return attributesData; }
    public void setAttributesData(Map<String, String> attributesData) { this.attributesData = attributesData; }
    public Map<String, String> getExtractedFields() { return extractedFields; }
    public void setExtractedFields(Map<String, String> extractedFields) { this.extractedFields = extractedFields; }
    public List<Warn> getDiagnostics() { return diagnostics; }
    public void setDiagnostics(List<Warn> diagnostics) { this.diagnostics = diagnostics; }

    public boolean hasDiagnostics() {
        return diagnostics != null && !diagnostics.isEmpty();
    }
}
