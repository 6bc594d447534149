package com.NutriCare.diet_backend.util;

public class Constants {

    private Constants() {
        // Utility class, no instantiation
    }

    // Sheet columns
    public static final String FOOD_NAME_COLUMN = "FoodName";
    public static final String SERVING_SIZE_COLUMN = "ServingSize";
    public static final String PROFILE_NAME_COLUMN = "ProfileName";
    public static final String NUTRIENT_COLUMN_PLACEHOLDER = "<at least one nutrient column>";

    // Comparison
    public static final double COMPARISON_TOLERANCE = 1e-9;

    // Success Messages
    public static final String SUCCESS_FOODS_UPLOADED = "Foods data uploaded and processed successfully.";
    public static final String SUCCESS_RDA_UPLOADED = "RDA data uploaded and processed successfully.";
    public static final String SUCCESS_PLAN_SENT = "Meal plan sent to kitchen dashboard successfully";
    public static final String SUCCESS_ITEM_UPDATED = "Meal plan item status updated successfully.";

    // Error Messages
    public static final String ERROR_NO_FOODS = "No food data available. Please upload foods.xlsx.";
    public static final String ERROR_NO_RDA = "No RDA data available. Please upload rda.xlsx.";
}
