package com.NutriCare.diet_backend.controller;

import com.NutriCare.diet_backend.dto.request.CreateMealPlanRequest;
import com.NutriCare.diet_backend.dto.response.ApiResponse;
import com.NutriCare.diet_backend.dto.response.KitchenSummaryResponse;
import com.NutriCare.diet_backend.dto.response.MealPlanResponse;
import com.NutriCare.diet_backend.service.MealPlanService;
import com.NutriCare.diet_backend.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/meal-plans")
@RequiredArgsConstructor
public class MealPlanController {

    private final MealPlanService mealPlanService;

    @PostMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'DIETITIAN')")
    public ResponseEntity<ApiResponse<MealPlanResponse>> createPlan(@Valid @RequestBody CreateMealPlanRequest request) {
        MealPlanResponse mealPlan = mealPlanService.createPlan(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(mealPlan, Constants.SUCCESS_PLAN_SENT));
    }

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'DIETITIAN', 'KITCHEN_STAFF')")
    public ResponseEntity<ApiResponse<List<MealPlanResponse>>> listPlans(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(ApiResponse.success(mealPlanService.listPlans(date)));
    }

    @GetMapping("/kitchen-summary")
    @PreAuthorize("hasAnyRole('ADMIN', 'DIETITIAN', 'KITCHEN_STAFF')")
    public ResponseEntity<ApiResponse<KitchenSummaryResponse>> kitchenSummary(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(ApiResponse.success(mealPlanService.kitchenSummary(date)));
    }

    @GetMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'DIETITIAN', 'KITCHEN_STAFF')")
    public ResponseEntity<ApiResponse<MealPlanResponse>> getPlan(@PathVariable UUID id) {
        return ResponseEntity.ok(ApiResponse.success(mealPlanService.getPlan(id)));
    }
}
