package com.NutriCare.diet_backend.enums;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MealCategoryTest {

    @Test
    void parsesLabelsConstantNamesAndVariants() {
        assertEquals(MealCategory.MORNING_SNACKS, MealCategory.fromString("Morning Snacks"));
        assertEquals(MealCategory.MORNING_SNACKS, MealCategory.fromString("MORNING_SNACKS"));
        assertEquals(MealCategory.EVENING_SNACKS, MealCategory.fromString("evening-snack"));
        assertEquals(MealCategory.DINNER, MealCategory.fromString(" dinner "));
    }

    @Test
    void unknownCategoryIsNull() {
        assertNull(MealCategory.fromString("Brunch"));
        assertNull(MealCategory.fromString(""));
    }

    @Test
    void rolesAcceptPrefixedClaims() {
        assertEquals(Role.KITCHEN_STAFF, Role.fromClaim("ROLE_kitchen-staff"));
        assertEquals(Role.DIETITIAN, Role.fromClaim("dietitian"));
        assertNull(Role.fromClaim("pharmacist"));
    }
}
