package com.NutriCare.diet_backend.dto.response;

import com.NutriCare.diet_backend.enums.NutrientStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComparisonReport {
    private String profileName;
    private Map<String, Double> targets;
    // total - target; null when the total is unknown
    private Map<String, Double> comparison;
    private Map<String, NutrientStatus> statuses;
    private int deficitCount;
    private int excessCount;
    private int meetsTargetCount;
    private int notDeterminableCount;
    private String summary;
}
