package com.NutriCare.diet_backend.exception;

import com.NutriCare.diet_backend.enums.MealItemStatus;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Getter
public class InvalidTransitionException extends ApiException {
    private final UUID itemId;
    private final MealItemStatus currentStatus;
    private final String requestedChange;

    public InvalidTransitionException(UUID itemId, MealItemStatus currentStatus, String requestedChange) {
        super(String.format("Cannot apply '%s' to meal plan item %s while it is %s",
                        requestedChange, itemId, currentStatus.getLabel()),
                HttpStatus.CONFLICT,
                "INVALID_TRANSITION");
        this.itemId = itemId;
        this.currentStatus = currentStatus;
        this.requestedChange = requestedChange;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("itemId", itemId);
        details.put("currentStatus", currentStatus.getLabel());
        details.put("requestedChange", requestedChange);
        return details;
    }
}
