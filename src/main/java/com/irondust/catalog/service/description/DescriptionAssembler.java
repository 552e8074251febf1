package com.irondust.catalog.service.description;

import com.irondust.catalog.config.DescriptionProperties;
import com.irondust.catalog.model.DescriptionResult;
import com.irondust.catalog.model.DescriptionRules;
import com.irondust.catalog.model.GroupingResult;
import com.irondust.catalog.model.ProductRecord;
import com.irondust.catalog.model.Warn;
import com.irondust.catalog.service.description.section.AdditionalInfoSection;
import com.irondust.catalog.service.description.section.ArticleSection;
import com.irondust.catalog.service.description.section.CharacteristicsSection;
import com.irondust.catalog.service.description.section.DescriptionSection;
import com.irondust.catalog.service.description.section.DocumentsSection;
import com.irondust.catalog.service.description.section.SectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Assembles the full HTML description, excerpt and attribute payload of one product.
 *
 * <h3>Assembly Flow</h3>
 * <ol>
 *   <li><strong>Article</strong> - cleaned raw article HTML</li>
 *   <li><strong>Characteristics</strong> - grouped technical characteristics</li>
 *   <li><strong>Documents</strong> - documentation links per document type</li>
 *   <li><strong>Additional info</strong> - product code, barcodes, exclusivity</li>
 *   <li><strong>Excerpt</strong> - markup-free summary of the assembled content</li>
 *   <li><strong>Attributes</strong> - attribute payload, merged dimensions, extracted fields</li>
 * </ol>
 *
 * <p>Every section is optional and independently guarded: a section that throws
 * is logged, recorded as a {@link Warn} and left out, and the build carries on.
 * {@link #build} never throws; in the worst case the result holds the cleaned
 * article and its excerpt.
 *
 * <p>The assembler holds only immutable rules, so a single instance serves
 * concurrent builds.
 *
 * @see DescriptionSection
 * @see CharacteristicsParser
 */
@Service
public class DescriptionAssembler {
    private static final Logger log = LoggerFactory.getLogger(DescriptionAssembler.class);

    private static final String BLOCK_SEPARATOR = "\n\n";

    /** Ordered description sections */
    private final List<DescriptionSection> sections;

    private final CharacteristicsParser characteristicsParser;
    private final int excerptMaxLength;

    @Autowired
    public DescriptionAssembler(DescriptionRules rules, DescriptionProperties properties) {
        this(rules, properties.getExcerptMaxLength());
    }

    public DescriptionAssembler(DescriptionRules rules, int excerptMaxLength) {
        this.characteristicsParser = new CharacteristicsParser(rules);
        this.excerptMaxLength = excerptMaxLength > 0 ? excerptMaxLength : ExcerptExtractor.DEFAULT_MAX_LENGTH;
        this.sections = List.of(
            new ArticleSection(),
            new CharacteristicsSection(rules, characteristicsParser),
            new DocumentsSection(rules, new DocumentLinkParser(rules)),
            new AdditionalInfoSection(rules)
        );
    }

    DescriptionAssembler(DescriptionRules rules, int excerptMaxLength, List<DescriptionSection> sections) {
        this.characteristicsParser = new CharacteristicsParser(rules);
        this.excerptMaxLength = excerptMaxLength > 0 ? excerptMaxLength : ExcerptExtractor.DEFAULT_MAX_LENGTH;
        this.sections = List.copyOf(sections);
    }

    public DescriptionResult build(ProductRecord product) {
        return build(product, new DescriptionStats());
    }

    /**
     * Builds the description of one product.
     *
     * @param product The product record from the ingestion step
     * @param stats Caller-owned statistics, may be shared across parallel builds
     * @return A freshly built result; never null
     */
    public DescriptionResult build(ProductRecord product, DescriptionStats stats) {
        DescriptionStats runStats = stats != null ? stats : new DescriptionStats();
        DescriptionResult result = new DescriptionResult();
        if (product == null) return result;

        String productId = product.logId();
        log.debug("Building description for product {}", productId);

        try {
            List<String> blocks = new ArrayList<>();
            for (DescriptionSection section : sections) {
                SectionResult rendered = renderSection(section, product, runStats, result);
                if (rendered.hasContent()) blocks.add(rendered.html());
            }
            String content = String.join(BLOCK_SEPARATOR, blocks);
            result.setContent(content);
            result.setExcerpt(ExcerptExtractor.extract(content, excerptMaxLength));

            applyAttributes(product, result, runStats);

            runStats.recordDescription(content.length());
            log.debug("Built description for product {}: {} chars, excerpt {} chars, {} attributes",
                productId, content.length(), result.getExcerpt().length(), result.getAttributes().size());
        } catch (RuntimeException e) {
            log.error("Description build failed for product {}: {}", productId, e.getMessage(), e);
            Warn warn = Warn.buildFailed(productId, e.toString());
            result.getDiagnostics().add(warn);
            runStats.recordError(warn);

            String article = ArticleHtmlCleaner.clean(product.getDescriptionRaw());
            result.setContent(article);
            result.setExcerpt(ExcerptExtractor.extract(article, excerptMaxLength));
        }
        return result;
    }

    private SectionResult renderSection(DescriptionSection section, ProductRecord product,
                                        DescriptionStats stats, DescriptionResult result) {
        try {
            if (!section.supports(product)) {
                return SectionResult.ok(section.getName(), "");
            }
            return SectionResult.ok(section.getName(), section.render(product, stats));
        } catch (RuntimeException e) {
            log.error("Error rendering {} for product {}: {}", section.getName(), product.logId(), e.getMessage(), e);
            Warn warn = Warn.sectionSkipped(product.logId(), section.getName(), e.toString());
            result.getDiagnostics().add(warn);
            stats.recordError(warn);
            return SectionResult.skipped(section.getName(), e.toString());
        }
    }

    private void applyAttributes(ProductRecord product, DescriptionResult result, DescriptionStats stats) {
        String raw = product.getCharacteristicsRaw();
        if (raw.isBlank()) return;
        try {
            // Counted once already by the characteristics section
            GroupingResult grouped = characteristicsParser.parseAndGroup(raw, null);
            CharacteristicsParser.AttributePayload payload = characteristicsParser.extractAttributes(grouped);
            Map<String, String> fields = characteristicsParser.extractFields(grouped);
            result.setAttributes(payload.attributes());
            result.setAttributesData(payload.attributesData());
            result.setExtractedFields(fields);
        } catch (RuntimeException e) {
            log.error("Attribute extraction failed for product {}: {}", product.logId(), e.getMessage(), e);
            Warn warn = Warn.attributesFailed(product.logId(), e.toString());
            result.getDiagnostics().add(warn);
            stats.recordError(warn);
        }
    }

    /** Parses and groups characteristics without building a description. */
    public GroupingResult group(String characteristicsRaw) {
        return characteristicsParser.parseAndGroup(characteristicsRaw, null);
    }
}
