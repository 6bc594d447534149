package com.NutriCare.diet_backend.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CalculateNutritionRequest {

    @NotNull(message = "Selected foods are required")
    @Size(min = 1, message = "At least one food must be selected")
    private List<@Valid FoodSelection> selectedFoods;

    @NotBlank(message = "RDA profile name is required")
    private String rdaProfileName;
}
