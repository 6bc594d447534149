package com.NutriCare.diet_backend.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateMealPlanRequest {

    @NotNull(message = "Patient ID is required")
    private Long patientId;

    // Keyed by category label, e.g. {"Breakfast": [{"foodName": "Egg", "quantity": 2}]}
    @NotNull(message = "Meal plan is required")
    private Map<String, List<@Valid MealPlanItemRequest>> mealPlan;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MealPlanItemRequest {

        @NotBlank(message = "Food name is required")
        @Size(max = 255, message = "Food name must not exceed 255 characters")
        private String foodName;

        @NotNull(message = "Quantity is required")
        @Positive(message = "Quantity must be greater than 0")
        private Double quantity;
    }
}
