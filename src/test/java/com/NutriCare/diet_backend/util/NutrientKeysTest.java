package com.NutriCare.diet_backend.util;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NutrientKeysTest {

    @Test
    void namesCollapseWhitespaceAndFoldCase() {
        assertEquals("Brown Rice", NutrientKeys.displayName("  Brown   Rice "));
        assertEquals("brown rice", NutrientKeys.catalogKey("  BROWN rice"));
        assertNull(NutrientKeys.catalogKey(null));
    }

    @Test
    void lookupIsCaseInsensitiveAndKeepsUnknownApart() {
        Map<String, Double> nutrients = new HashMap<>();
        nutrients.put("Vitamin C", 12.0);
        nutrients.put("Iron", 0.0);

        assertEquals(12.0, NutrientKeys.lookup(nutrients, "vitamin  c"));
        assertEquals(0.0, NutrientKeys.lookup(nutrients, "IRON"));
        assertNull(NutrientKeys.lookup(nutrients, "Fiber"));
    }

    @Test
    void negativeOrNonFiniteAmountsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> NutrientKeys.requireNonNegative(Map.of("Protein", -1.0), "Rice"));
        assertThrows(IllegalArgumentException.class,
                () -> NutrientKeys.requireNonNegative(Map.of("Protein", Double.NaN), "Rice"));
        assertDoesNotThrow(() -> NutrientKeys.requireNonNegative(Map.of("Protein", 0.0), "Rice"));
    }
}
