package com.irondust.catalog.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "description")
public class DescriptionProperties {
    /**
     * Location of the rules JSON (classification rules, attribute vocabulary,
     * document tables). Any Spring resource location; defaults to the bundled file.
     */
    private String rulesLocation = "classpath:description-rules.json";
    /**
     * Maximum excerpt length in characters.
     */
    @Min(1)
    private int excerptMaxLength = 200;
    /**
     * Base URL prefix for document icons. Overrides the value in the rules file when set.
     */
    private String iconsPath;
    /**
     * Number of products built concurrently by the batch endpoint.
     */
    @Min(1)
    private int batchParallelism = 4;

    public String getRulesLocation() {
        return rulesLocation;
    }

    public void setRulesLocation(String rulesLocation) {
        this.rulesLocation = rulesLocation;
    }

    public int getExcerptMaxLength() {
        return excerptMaxLength;
    }

    public void setExcerptMaxLength(int excerptMaxLength) {
        this.excerptMaxLength = excerptMaxLength;
    }

    public String getIconsPath() {
        return iconsPath;
    }

    public void setIconsPath(String iconsPath) {
        this.iconsPath = iconsPath;
    }

    public int getBatchParallelism() {
        return batchParallelism;
    }

    public void setBatchParallelism(int batchParallelism) {
        this.batchParallelism = batchParallelism;
    }
}
