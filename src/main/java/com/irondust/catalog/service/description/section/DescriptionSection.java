package com.irondust.catalog.service.description.section;

import com.irondust.catalog.model.ProductRecord;
import com.irondust.catalog.service.description.DescriptionStats;

/**
 * One optional block of a product description.
 *
 * <p>Sections are rendered in the order the assembler holds them and joined with
 * a blank line. Each section decides on its own whether it has anything to show.
 *
 * <h3>Section Lifecycle</h3>
 * <ol>
 *   <li><strong>supports()</strong> - quick check whether the product has input for this block</li>
 *   <li><strong>render()</strong> - produce the HTML; an empty string means "omit"</li>
 * </ol>
 *
 * <h3>Implementation Guidelines</h3>
 * <ul>
 *   <li>Sections are <strong>deterministic</strong> and do not modify the product</li>
 *   <li>Sections may throw; the assembler catches, logs and omits the block</li>
 *   <li>Sections hold no per-product state and may be shared across threads</li>
 * </ul>
 *
 * @see SectionResult
 * @see com.irondust.catalog.service.description.DescriptionAssembler
 */
public interface DescriptionSection {
    /**
     * Checks whether the product carries any input for this section.
     *
     * @param product The product being described
     * @return true if {@link #render} should be called
     */
    boolean supports(ProductRecord product);

    /**
     * Renders the section HTML.
     *
     * @param product The product being described
     * @param stats Run statistics to update
     * @return The HTML block, or an empty string when there is nothing to show
     */
    String render(ProductRecord product, DescriptionStats stats);

    /**
     * Name used in logs and diagnostics. Defaults to the simple class name.
     */
    default String getName() {
        return this.getClass().getSimpleName();
    }
}
