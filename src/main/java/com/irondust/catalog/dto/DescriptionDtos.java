package com.irondust.catalog.dto;

import com.irondust.catalog.model.DescriptionResult;
import com.irondust.catalog.model.Warn;

import java.util.List;
import java.util.Map;

public class DescriptionDtos {

    /** Per-product entry of a batch report */
    public static class ProductReport {
        private String sku;
        private DescriptionResult result; // null when the product failed entirely
        private String error;

        public ProductReport() {}

        public ProductReport(String sku, DescriptionResult result, String error) {
            this.sku = sku;
            this.result = result;
            this.error = error;
        }

        public String getSku() { return sku; }
        public void setSku(String sku) { this.sku = sku; }
        public DescriptionResult getResult() { return result; }
        public void setResult(DescriptionResult result) { this.result = result; }
        public String getError() { return error; }
        public void setError(String error) { this.error = error; }
    }

    /** Overall report returned by the batch endpoint */
    public static class BatchReport {
        private int processed; // products with a result
        private int failed; // products that produced no result at all
        private List<Warn> errors; // skipped sections and failed builds
        private Map<String, Object> stats; // run counters
        private List<ProductReport> products; // in input order

        public int getProcessed() { return processed; }
        public void setProcessed(int processed) { this.processed = processed; }
        public int getFailed() { return failed; }
        public void setFailed(int failed) { this.failed = failed; }
        public List<Warn> getErrors() { return errors; }
        public void setErrors(List<Warn> errors) { this.errors = errors; }
        public Map<String, Object> getStats() { return stats; }
        public void setStats(Map<String, Object> stats) { this.stats = stats; }
        public List<ProductReport> getProducts() { return products; }
        public void setProducts(List<ProductReport> products) { this.products = products; }
    }

    /** Loaded rules overview for the admin view */
    public static class RulesSummary {
        private List<String> groupOrder;
        private String defaultGroup;
        private Map<String, String> vocabulary;
        private String dimensionsSlug;
        private List<String> extractFields;

        public List<String> getGroupOrder() { return groupOrder; }
        public void setGroupOrder(List<String> groupOrder) { this.groupOrder = groupOrder; }
        public String getDefaultGroup() { return defaultGroup; }
        public void setDefaultGroup(String defaultGroup) { this.defaultGroup = defaultGroup; }
        public Map<String, String> getVocabulary() { return vocabulary; }
        public void setVocabulary(Map<String, String> vocabulary) { this.vocabulary = vocabulary; }
        public String getDimensionsSlug() { return dimensionsSlug; }
        public void setDimensionsSlug(String dimensionsSlug) { this.dimensionsSlug = dimensionsSlug; }
        public List<String> getExtractFields() { return extractFields; }
        public void setExtractFields(List<String> extractFields) { this.extractFields = extractFields; }
    }
}
