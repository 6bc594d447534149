package com.NutriCare.diet_backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Role {
    ADMIN,
    DIETITIAN,
    KITCHEN_STAFF;

    @JsonValue
    public String getValue() {
        return this.name().toLowerCase();
    }

    public static Role fromClaim(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase().replace('-', '_');
        if (normalized.startsWith("ROLE_")) {
            normalized = normalized.substring("ROLE_".length());
        }
        try {
            return Role.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
