package com.NutriCare.diet_backend.enums.converter;

import com.NutriCare.diet_backend.enums.MealCategory;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class MealCategoryConverter implements AttributeConverter<MealCategory, String> {

    @Override
    public String convertToDatabaseColumn(MealCategory category) {
        if (category == null) {
            return null;
        }
        return category.getLabel();
    }

    @Override
    public MealCategory convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.trim().isEmpty()) {
            return null;
        }
        MealCategory category = MealCategory.fromString(dbData);
        if (category == null) {
            throw new IllegalStateException("Unknown meal category stored: " + dbData);
        }
        return category;
    }
}
