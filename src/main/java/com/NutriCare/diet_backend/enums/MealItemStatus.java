package com.NutriCare.diet_backend.enums;

import lombok.Getter;

/**
 * Kitchen execution state of one meal plan item. The prepared/delivered flags exposed to
 * clients are derived from this value, so a delivered-but-unprepared item cannot exist.
 */
@Getter
public enum MealItemStatus {
    PENDING("Pending", false, false),
    PREPARED("Prepared", true, false),
    DELIVERED("Delivered", true, true);

    private final String label;
    private final boolean prepared;
    private final boolean delivered;

    MealItemStatus(String label, boolean prepared, boolean delivered) {
        this.label = label;
        this.prepared = prepared;
        this.delivered = delivered;
    }
}
