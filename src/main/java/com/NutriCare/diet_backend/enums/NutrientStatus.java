package com.NutriCare.diet_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public enum NutrientStatus {
    DEFICIT("Deficit"),
    EXCESS("Excess"),
    MEETS_TARGET("Meets Target"),
    NOT_DETERMINABLE("Not Determinable");

    private final String label;

    NutrientStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getValue() {
        return label;
    }
}
