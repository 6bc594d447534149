package com.NutriCare.diet_backend.service;

import com.NutriCare.diet_backend.dto.request.FoodSelection;
import com.NutriCare.diet_backend.dto.response.MenuAggregate;
import com.NutriCare.diet_backend.dto.response.ResolvedMenuItem;
import com.NutriCare.diet_backend.exception.FoodNotFoundException;
import com.NutriCare.diet_backend.exception.ValidationException;
import com.NutriCare.diet_backend.model.FoodItem;
import com.NutriCare.diet_backend.util.NutrientKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Sums the nutrient vectors of a menu, each food weighted by its quantity in servings.
 * <p>
 * Unknown dominates: if any selected food has no value for a nutrient, that nutrient's total
 * is null. Nutrients carried by other catalog foods but by none of the selected ones are
 * reported as null too. An unknown food fails the whole call.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NutritionAggregator {

    private final CatalogService catalogService;

    public MenuAggregate aggregate(List<FoodSelection> menu) {
        if (menu == null || menu.isEmpty()) {
            throw new ValidationException("At least one food must be selected");
        }

        Map<String, FoodItem> catalog = catalogService.findFoodsByNames(menu.stream()
                .map(FoodSelection::getFoodName)
                .filter(name -> name != null)
                .collect(Collectors.toList()));

        List<FoodItem> foods = new ArrayList<>();
        List<ResolvedMenuItem> resolvedItems = new ArrayList<>();
        for (FoodSelection selection : menu) {
            requireValidQuantity(selection);
            FoodItem food = catalog.get(NutrientKeys.catalogKey(selection.getFoodName()));
            if (food == null) {
                throw new FoodNotFoundException(selection.getFoodName());
            }
            foods.add(food);
            resolvedItems.add(ResolvedMenuItem.builder()
                    .foodName(food.getName())
                    .quantity(selection.getQuantity())
                    .servingSize(food.getServingSize())
                    .build());
        }

        Set<String> nutrientNames = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        nutrientNames.addAll(catalogService.catalogNutrientNames());
        for (FoodItem food : foods) {
            nutrientNames.addAll(food.getNutrients().keySet());
        }

        Map<String, Double> totals = NutrientKeys.newNutrientMap();
        for (String nutrient : nutrientNames) {
            totals.put(nutrient, sum(nutrient, foods, menu));
        }

        log.debug("Aggregated {} menu lines over {} nutrients", menu.size(), totals.size());
        return MenuAggregate.builder()
                .resolvedItems(resolvedItems)
                .totals(totals)
                .build();
    }

    private Double sum(String nutrient, List<FoodItem> foods, List<FoodSelection> menu) {
        double total = 0.0;
        for (int i = 0; i < foods.size(); i++) {
            Double perServing = foods.get(i).findNutrient(nutrient).orElse(null);
            if (perServing == null) {
                return null;
            }
            total += perServing * menu.get(i).getQuantity();
        }
        return total;
    }

    private void requireValidQuantity(FoodSelection selection) {
        Double quantity = selection.getQuantity();
        if (quantity == null || !(quantity > 0) || quantity.isInfinite()) {
            throw new ValidationException("Quantity for '" + selection.getFoodName() + "' must be greater than 0");
        }
    }
}
