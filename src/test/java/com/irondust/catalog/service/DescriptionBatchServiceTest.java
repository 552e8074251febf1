package com.irondust.catalog.service;

import com.irondust.catalog.TestRules;
import com.irondust.catalog.model.ProductRecord;
import com.irondust.catalog.model.Warn;
import com.irondust.catalog.service.description.DescriptionAssembler;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DescriptionBatchServiceTest {

    private final DescriptionBatchService service =
            new DescriptionBatchService(new DescriptionAssembler(TestRules.bundled(), 200), 2);

    @Test
    public void continuesPastFailedItemAndKeepsOrder() {
        List<ProductRecord> products = new ArrayList<>();
        products.add(new ProductRecord("Конвектор", "SKU-1", "Цвет корпуса: Белый", "<p>Текст</p>"));
        products.add(null);
        products.add(new ProductRecord("Радиатор", "SKU-3", "Мощность: 1 кВт", ""));

        StepVerifier.create(service.process(products))
                .assertNext(report -> {
                    assertEquals(2, report.getProcessed());
                    assertEquals(1, report.getFailed());
                    assertEquals(3, report.getProducts().size());

                    assertEquals("SKU-1", report.getProducts().get(0).getSku());
                    assertEquals("Белый", report.getProducts().get(0).getResult().getAttributes().get("pa_color"));
                    assertNull(report.getProducts().get(1).getResult());
                    assertTrue(report.getProducts().get(1).getError().contains("product is null"));
                    assertEquals("SKU-3", report.getProducts().get(2).getSku());

                    assertEquals(1, report.getErrors().size());
                    assertEquals(Warn.BUILD_FAILED, report.getErrors().get(0).getCode());
                    assertEquals(2L, report.getStats().get("descriptions_built"));
                })
                .verifyComplete();
    }

    @Test
    public void emptyBatchYieldsEmptyReport() {
        StepVerifier.create(service.process(List.of()))
                .assertNext(report -> {
                    assertEquals(0, report.getProcessed());
                    assertEquals(0, report.getFailed());
                    assertTrue(report.getProducts().isEmpty());
                })
                .verifyComplete();

        StepVerifier.create(service.process(null))
                .assertNext(report -> assertEquals(0, report.getProcessed()))
                .verifyComplete();
    }
}
