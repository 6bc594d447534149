package com.NutriCare.diet_backend.dto.response;

import com.NutriCare.diet_backend.enums.NutrientStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NutritionReportResponse {
    private List<ResolvedMenuItem> selectedMenu;
    private Map<String, Double> totalNutrients;
    private String rdaProfileName;
    private Map<String, Double> rdaTargets;
    private Map<String, Double> nutrientComparison;
    private Map<String, NutrientStatus> nutrientStatus;
    private String finalSummary;
}
