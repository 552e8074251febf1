package com.irondust.catalog.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Represents a problem encountered while building one product description.
 *
 * <p>Warnings never abort a build. They are attached to the
 * {@link DescriptionResult} and collected by the run statistics so a batch
 * report can list what was skipped and why.
 *
 * <h3>Warning Types</h3>
 * <ul>
 *   <li><strong>SECTION_SKIPPED</strong> - an optional description block failed and was omitted</li>
 *   <li><strong>ATTRIBUTES_FAILED</strong> - the attribute payload or extracted fields could not be built</li>
 *   <li><strong>BUILD_FAILED</strong> - the build degraded to the cleaned article only</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Warn {
    public static final String SECTION_SKIPPED = "SECTION_SKIPPED";
    public static final String ATTRIBUTES_FAILED = "ATTRIBUTES_FAILED";
    public static final String BUILD_FAILED = "BUILD_FAILED";

    /** Product identifier (SKU, or name when the SKU is empty) */
    private String productId;

    /** Warning code for categorization */
    private String code;

    /** Section or field the warning refers to */
    private String field;

    /** Human-readable warning message */
    private String message;

    /** Exception text or offending input */
    private String evidence;

    public Warn() {}

    public Warn(String productId, String code, String field, String message, String evidence) {
        this.productId = productId;
        this.code = code;
        this.field = field;
        this.message = message;
        this.evidence = evidence;
    }

    public String getProductId() { return productId; }
    public void setProductId(String productId) { this.productId = productId; }
    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }
    public String getField() { return field; }
    public void setField(String field) { this.field = field; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public String getEvidence() { return evidence; }
    public void setEvidence(String evidence) { this.evidence = evidence; }

    public static Warn sectionSkipped(String productId, String section, String evidence) {
        return new Warn(productId, SECTION_SKIPPED, section,
            String.format("Section '%s' failed and was omitted", section), evidence);
    }

    public static Warn attributesFailed(String productId, String evidence) {
        return new Warn(productId, ATTRIBUTES_FAILED, "attributes",
            "Attribute payload could not be built", evidence);
    }

    public static Warn buildFailed(String productId, String evidence) {
        return new Warn(productId, BUILD_FAILED, null,
            "Description degraded to the cleaned article", evidence);
    }

    @Override
    public String toString() {
        return String.format("%s [%s] %s: %s", code, productId, field != null ? field : "-", message);
    }
}
