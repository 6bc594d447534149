package com.NutriCare.diet_backend.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial status update; a null field leaves that flag as it is.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateMealPlanItemStatusRequest {
    private Boolean prepared;
    private Boolean delivered;
}
