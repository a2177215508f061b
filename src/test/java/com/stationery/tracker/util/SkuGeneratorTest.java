package com.stationery.tracker.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SkuGeneratorTest {

    private final SkuGenerator generator = new SkuGenerator();

    @Test
    void generate_ShouldCombineCategoryNameYearAndSequence() {
        String sku = generator.generate("Pens", "Blue Ballpoint", LocalDate.of(2024, 3, 5), 0, s -> false);

        assertEquals("PEN-BLU-24-001", sku);
    }

    @Test
    void generate_ShouldStripSymbolsBeforeAbbreviating() {
        String sku = generator.generate("Erasers & Correctors", "A4 paper (80g)", LocalDate.of(2025, 1, 1), 11,
                s -> false);

        assertEquals("ERA-A4P-25-012", sku);
    }

    @Test
    void generate_ShouldAppendCounterWhileTaken() {
        Set<String> taken = Set.of("PEN-RED-24-003", "PEN-RED-24-003-1");

        String sku = generator.generate("Pens", "Red", LocalDate.of(2024, 6, 1), 2, taken::contains);

        assertEquals("PEN-RED-24-003-2", sku);
    }

    @Test
    void abbreviate_ShouldHandleShortAndMissingValues() {
        assertEquals("AB", SkuGenerator.abbreviate("ab"));
        assertEquals("", SkuGenerator.abbreviate(null));
        assertEquals("", SkuGenerator.abbreviate("&&"));
    }
}
