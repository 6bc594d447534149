package com.NutriCare.diet_backend.controller;

import com.NutriCare.diet_backend.dto.response.ApiResponse;
import com.NutriCare.diet_backend.dto.response.FoodResponse;
import com.NutriCare.diet_backend.dto.response.IngestionReport;
import com.NutriCare.diet_backend.dto.response.RdaProfileResponse;
import com.NutriCare.diet_backend.service.CatalogIngestionService;
import com.NutriCare.diet_backend.service.CatalogService;
import com.NutriCare.diet_backend.util.Constants;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@RestController
@RequestMapping("/api/catalog")
@RequiredArgsConstructor
public class CatalogController {

    private final CatalogService catalogService;
    private final CatalogIngestionService catalogIngestionService;

    @PostMapping(value = "/foods/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @PreAuthorize("hasAnyRole('ADMIN', 'DIETITIAN')")
    public ResponseEntity<ApiResponse<IngestionReport>> uploadFoods(@RequestParam("file") MultipartFile file) {
        IngestionReport report = catalogIngestionService.ingestFoods(file);
        return ResponseEntity.ok(ApiResponse.success(report, Constants.SUCCESS_FOODS_UPLOADED));
    }

    @PostMapping(value = "/rda-profiles/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @PreAuthorize("hasAnyRole('ADMIN', 'DIETITIAN')")
    public ResponseEntity<ApiResponse<IngestionReport>> uploadRdaProfiles(@RequestParam("file") MultipartFile file) {
        IngestionReport report = catalogIngestionService.ingestRdaProfiles(file);
        return ResponseEntity.ok(ApiResponse.success(report, Constants.SUCCESS_RDA_UPLOADED));
    }

    @GetMapping("/foods")
    @PreAuthorize("hasAnyRole('ADMIN', 'DIETITIAN', 'KITCHEN_STAFF')")
    public ResponseEntity<ApiResponse<List<FoodResponse>>> listFoods() {
        return ResponseEntity.ok(ApiResponse.success(catalogService.listFoods()));
    }

    @GetMapping("/foods/{name}")
    @PreAuthorize("hasAnyRole('ADMIN', 'DIETITIAN', 'KITCHEN_STAFF')")
    public ResponseEntity<ApiResponse<FoodResponse>> getFood(@PathVariable String name) {
        return ResponseEntity.ok(ApiResponse.success(catalogService.getFood(name)));
    }

    @GetMapping("/rda-profiles")
    @PreAuthorize("hasAnyRole('ADMIN', 'DIETITIAN', 'KITCHEN_STAFF')")
    public ResponseEntity<ApiResponse<List<String>>> listProfileNames() {
        return ResponseEntity.ok(ApiResponse.success(catalogService.listProfileNames()));
    }

    @GetMapping("/rda-profiles/{name}")
    @PreAuthorize("hasAnyRole('ADMIN', 'DIETITIAN', 'KITCHEN_STAFF')")
    public ResponseEntity<ApiResponse<RdaProfileResponse>> getProfile(@PathVariable String name) {
        return ResponseEntity.ok(ApiResponse.success(catalogService.getProfile(name)));
    }
}
