package com.irondust.catalog.service.description.section;

import com.irondust.catalog.model.ProductRecord;
import com.irondust.catalog.service.description.ArticleHtmlCleaner;
import com.irondust.catalog.service.description.DescriptionStats;

/**
 * The cleaned article HTML that opens the description.
 */
public class ArticleSection implements DescriptionSection {

    @Override
    public boolean supports(ProductRecord product) {
        return !product.getDescriptionRaw().isBlank();
    }

    @Override
    public String render(ProductRecord product, DescriptionStats stats) {
        return ArticleHtmlCleaner.clean(product.getDescriptionRaw());
    }
}
