package com.NutriCare.diet_backend.util;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Name handling shared by the catalog and the analysis pipeline. Food names, profile names and
 * nutrient names all match case-insensitively and ignore surrounding or repeated whitespace;
 * the original spelling is kept for display.
 */
public final class NutrientKeys {

    private NutrientKeys() {
        // Utility class, no instantiation
    }

    public static String displayName(String raw) {
        if (raw == null) {
            return null;
        }
        return raw.trim().replaceAll("\\s+", " ");
    }

    public static String catalogKey(String raw) {
        String display = displayName(raw);
        return display == null ? null : display.toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive map with deterministic (alphabetical) iteration order.
     */
    public static <V> TreeMap<String, V> newNutrientMap() {
        return new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    }

    public static <V> V lookup(Map<String, V> values, String nutrientName) {
        if (values == null || nutrientName == null) {
            return null;
        }
        V direct = values.get(nutrientName);
        if (direct != null) {
            return direct;
        }
        String wanted = catalogKey(nutrientName);
        for (Map.Entry<String, V> entry : values.entrySet()) {
            if (wanted.equals(catalogKey(entry.getKey()))) {
                return entry.getValue();
            }
        }
        return null;
    }

    public static void requireNonNegative(Map<String, Double> values, String owner) {
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            Double amount = entry.getValue();
            if (amount == null || amount.isNaN() || amount.isInfinite() || amount < 0) {
                throw new IllegalArgumentException(
                        owner + " has an invalid amount for " + entry.getKey() + ": " + amount);
            }
        }
    }
}
