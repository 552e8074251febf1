package com.irondust.catalog.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ProductRecordTest {

    @Test
    public void blankDocumentTypeIsRejected() {
        ProductRecord product = new ProductRecord("Конвектор", "SKU-1", "", "")
                .addDocuments(" ", "https://example.com/manual.pdf");
        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            Validator validator = factory.getValidator();
            Set<ConstraintViolation<ProductRecord>> violations = validator.validate(product);
            assertEquals(1, violations.size());
            assertEquals("document type must not be blank", violations.iterator().next().getMessage());
        }
    }

    @Test
    public void namedDocumentTypesAndEmptyProductAreValid() {
        ProductRecord product = new ProductRecord("Конвектор", "SKU-1", "", "")
                .addDocuments("Инструкции", "https://example.com/manual.pdf");
        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            Validator validator = factory.getValidator();
            assertTrue(validator.validate(product).isEmpty());
            assertTrue(validator.validate(new ProductRecord()).isEmpty());
        }
    }

    @Test
    public void readsSpreadsheetShapedAdditionalInfo() throws Exception {
        String json = "{\"sku\":\"S-1\",\"additionalInfo\":{\"НС-код\":\"НС-7\",\"Штрих код\":\"111 / 222\",\"Склад\":\"Москва\"}}";
        ProductRecord product = new ObjectMapper().readValue(json, ProductRecord.class);

        AdditionalInfo raw = product.getAdditionalInfo();
        assertTrue(raw.isEmpty());
        assertEquals("НС-7", raw.getColumns().get("НС-код"));

        AdditionalInfo info = raw.resolve(DescriptionRules.builder().build());
        assertEquals("НС-7", info.getCode());
        assertEquals("111 / 222", info.getBarcodes());
        assertEquals("", info.getExclusive());
    }

    @Test
    public void readsExplicitAdditionalInfo() throws Exception {
        String json = "{\"additionalInfo\":{\"code\":\"НС-1\",\"exclusive\":\"Да\"}}";
        AdditionalInfo info = new ObjectMapper().readValue(json, ProductRecord.class).getAdditionalInfo();
        assertEquals("НС-1", info.getCode());
        assertEquals("Да", info.getExclusive());
        assertTrue(info.getColumns().isEmpty());
    }

    @Test
    public void additionalInfoJsonHasOnlyItsFields() {
        AdditionalInfo info = new AdditionalInfo("НС-1", null, null);
        info.setColumn("Склад", "Москва");
        JsonNode json = new ObjectMapper().valueToTree(info);
        assertEquals("НС-1", json.path("code").asText());
        assertFalse(json.has("empty"));
        assertFalse(json.has("columns"));
        assertFalse(json.has("Склад"));
    }
}
