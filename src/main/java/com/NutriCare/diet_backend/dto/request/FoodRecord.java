package com.NutriCare.diet_backend.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One food row of an upload batch. Nutrients hold only known amounts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FoodRecord {
    private String name;
    private String servingSize;
    private Map<String, Double> nutrients;
}
