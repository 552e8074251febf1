package com.irondust.catalog.service.description;

import com.irondust.catalog.model.Characteristic;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class DimensionMergerTest {

    private static Characteristic c(String key, String value) {
        return new Characteristic(key, value, "Габариты и вес", false, "");
    }

    @Test
    public void mergesAllAxesInWidthHeightLengthOrder() {
        Optional<String> merged = DimensionMerger.mergeDimensions(List.of(
                c("Глубина", "12 см"),
                c("Высота", "22 см"),
                c("Ширина", "94 см")));
        assertEquals(Optional.of("94 см x 22 см x 12 см"), merged);
    }

    @Test
    public void joinsOnlyPresentAxes() {
        assertEquals(Optional.of("22 см"), DimensionMerger.mergeDimensions(List.of(c("Высота", "22 см"))));
        assertEquals(Optional.of("40 см x 1,5 м"),
                DimensionMerger.mergeDimensions(List.of(c("Ширина, см", "40 см"), c("Длина кабеля", "1,5 м"))));
    }

    @Test
    public void firstValueWinsForDuplicateAxis() {
        Optional<String> merged = DimensionMerger.mergeDimensions(List.of(
                c("Высота", "22 см"),
                c("Высота с ножками", "30 см")));
        assertEquals(Optional.of("22 см"), merged);
    }

    @Test
    public void absentWhenNoAxisFound() {
        assertTrue(DimensionMerger.mergeDimensions(List.of(c("Цвет", "Белый"))).isEmpty());
        assertTrue(DimensionMerger.mergeDimensions(List.of(c("Ширина", " "))).isEmpty());
        assertTrue(DimensionMerger.mergeDimensions(List.of()).isEmpty());
        assertTrue(DimensionMerger.mergeDimensions(null).isEmpty());
    }
}
