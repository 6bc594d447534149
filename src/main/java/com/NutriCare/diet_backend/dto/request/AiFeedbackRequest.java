package com.NutriCare.diet_backend.dto.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AiFeedbackRequest {

    // Usually the report returned by /api/nutrition/calculate, passed through untouched.
    @NotEmpty(message = "Nutritional summary is required")
    private Map<String, Object> nutritionalSummary;

    @Size(max = 2000, message = "Co-morbidities must not exceed 2000 characters")
    private String coMorbidities;

    @Size(max = 1000, message = "Diet preference must not exceed 1000 characters")
    private String dietPreference;
}
