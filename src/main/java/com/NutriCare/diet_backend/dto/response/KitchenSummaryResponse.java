package com.NutriCare.diet_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KitchenSummaryResponse {
    private LocalDate date;
    private int planCount;
    private int itemCount;
    private int preparedCount;
    private int deliveredCount;
    private int unpreparedCount;
    private int notDeliveredCount;
    private Map<String, Long> pendingByCategory;
}
