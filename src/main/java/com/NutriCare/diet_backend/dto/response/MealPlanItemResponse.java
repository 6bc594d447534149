package com.NutriCare.diet_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MealPlanItemResponse {
    private UUID id;
    private String mealCategory;
    private String foodName;
    private Double quantity;
    private String status;
    private boolean prepared;
    private boolean delivered;
}
