package com.NutriCare.diet_backend.controller;

import com.NutriCare.diet_backend.dto.request.AiFeedbackRequest;
import com.NutriCare.diet_backend.dto.request.CalculateNutritionRequest;
import com.NutriCare.diet_backend.dto.response.ApiResponse;
import com.NutriCare.diet_backend.dto.response.FeedbackResponse;
import com.NutriCare.diet_backend.dto.response.NutritionReportResponse;
import com.NutriCare.diet_backend.service.NutritionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/nutrition")
@RequiredArgsConstructor
public class NutritionController {

    private final NutritionService nutritionService;

    @PostMapping("/calculate")
    @PreAuthorize("hasAnyRole('ADMIN', 'DIETITIAN')")
    public ResponseEntity<ApiResponse<NutritionReportResponse>> calculate(
            @Valid @RequestBody CalculateNutritionRequest request) {
        return ResponseEntity.ok(ApiResponse.success(nutritionService.calculate(request)));
    }

    @PostMapping("/feedback")
    @PreAuthorize("hasAnyRole('ADMIN', 'DIETITIAN')")
    public ResponseEntity<ApiResponse<FeedbackResponse>> feedback(@Valid @RequestBody AiFeedbackRequest request) {
        return ResponseEntity.ok(ApiResponse.success(nutritionService.requestFeedback(request)));
    }
}
