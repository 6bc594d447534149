package com.NutriCare.diet_backend.controller;

import com.NutriCare.diet_backend.dto.request.UpdateMealPlanItemStatusRequest;
import com.NutriCare.diet_backend.dto.response.ApiResponse;
import com.NutriCare.diet_backend.dto.response.MealPlanItemResponse;
import com.NutriCare.diet_backend.service.MealPlanService;
import com.NutriCare.diet_backend.util.Constants;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/meal-plan-items")
@RequiredArgsConstructor
public class MealPlanItemController {

    private final MealPlanService mealPlanService;

    @PatchMapping("/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'DIETITIAN', 'KITCHEN_STAFF')")
    public ResponseEntity<ApiResponse<MealPlanItemResponse>> updateStatus(
            @PathVariable UUID id,
            @RequestBody UpdateMealPlanItemStatusRequest request) {
        MealPlanItemResponse item = mealPlanService.updateItemStatus(id, request);
        return ResponseEntity.ok(ApiResponse.success(item, Constants.SUCCESS_ITEM_UPDATED));
    }
}
