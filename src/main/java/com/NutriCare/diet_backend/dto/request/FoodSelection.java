package com.NutriCare.diet_backend.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FoodSelection {

    @NotBlank(message = "Food name is required")
    @Size(max = 255, message = "Food name must not exceed 255 characters")
    private String foodName;

    // Multiplier of the catalog serving size; fractional servings are allowed.
    @NotNull(message = "Quantity is required")
    @Positive(message = "Quantity must be greater than 0")
    private Double quantity;
}
