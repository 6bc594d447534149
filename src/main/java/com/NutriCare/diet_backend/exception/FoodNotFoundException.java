package com.NutriCare.diet_backend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Map;

@Getter
public class FoodNotFoundException extends ApiException {
    private final String foodName;

    public FoodNotFoundException(String foodName) {
        super(String.format("Food item '%s' not found in foods data.", foodName),
                HttpStatus.NOT_FOUND,
                "FOOD_NOT_FOUND");
        this.foodName = foodName;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("foodName", String.valueOf(foodName));
    }
}
