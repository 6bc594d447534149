package com.NutriCare.diet_backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum MealCategory {
    BREAKFAST("Breakfast"),
    MORNING_SNACKS("Morning Snacks"),
    LUNCH("Lunch"),
    EVENING_SNACKS("Evening Snacks"),
    DINNER("Dinner");

    private final String label;

    MealCategory(String label) {
        this.label = label;
    }

    /**
     * Accepts the display label ("Morning Snacks"), the constant name ("MORNING_SNACKS")
     * or common variants ("morning-snack"). Returns null when nothing matches.
     */
    @JsonCreator
    public static MealCategory fromString(String text) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }

        String input = text.trim().toLowerCase().replace('_', ' ').replace('-', ' ').replaceAll("\\s+", " ");

        for (MealCategory category : MealCategory.values()) {
            if (category.label.equalsIgnoreCase(input)) {
                return category;
            }
        }

        switch (input) {
            case "morning snack":
            case "mid morning snack":
                return MORNING_SNACKS;
            case "evening snack":
            case "afternoon snack":
            case "afternoon snacks":
                return EVENING_SNACKS;
            case "supper":
                return DINNER;
            default:
                return null;
        }
    }

    public static String getAvailableCategories() {
        StringBuilder sb = new StringBuilder();
        for (MealCategory category : MealCategory.values()) {
            sb.append(category.label).append(", ");
        }
        if (sb.length() > 0) {
            sb.setLength(sb.length() - 2);
        }
        return sb.toString();
    }

    @JsonValue
    @Override
    public String toString() {
        return label;
    }
}
