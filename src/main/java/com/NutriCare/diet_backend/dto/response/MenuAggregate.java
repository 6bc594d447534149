package com.NutriCare.diet_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Totals for one menu. A null total means at least one selected food has no value for
 * that nutrient, so the sum cannot be known.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MenuAggregate {
    private List<ResolvedMenuItem> resolvedItems;
    private Map<String, Double> totals;
}
