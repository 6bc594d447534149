package com.NutriCare.diet_backend.service;

import com.NutriCare.diet_backend.dto.request.FoodSelection;
import com.NutriCare.diet_backend.dto.response.MenuAggregate;
import com.NutriCare.diet_backend.exception.FoodNotFoundException;
import com.NutriCare.diet_backend.exception.ValidationException;
import com.NutriCare.diet_backend.model.FoodItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class NutritionAggregatorTest {

    @Mock
    private CatalogService catalogService;

    @InjectMocks
    private NutritionAggregator aggregator;

    private final Map<String, FoodItem> catalog = new HashMap<>();

    @BeforeEach
    void setup() {
        catalog.put("rice", food("Rice", "1 cup", Map.of("Calories", 200.0, "Protein", 4.0)));
        catalog.put("dal", food("Dal", "1 bowl", Map.of("Calories", 150.0, "Protein", 9.0, "Fiber", 3.0)));

        when(catalogService.findFoodsByNames(any())).thenAnswer(invocation -> {
            Collection<String> names = invocation.getArgument(0);
            Map<String, FoodItem> found = new HashMap<>();
            for (String name : names) {
                FoodItem food = catalog.get(name.trim().toLowerCase());
                if (food != null) {
                    found.put(food.getNameKey(), food);
                }
            }
            return found;
        });
        Set<String> nutrientNames = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        nutrientNames.addAll(List.of("Calories", "Protein", "Fiber"));
        when(catalogService.catalogNutrientNames()).thenReturn(nutrientNames);
    }

    @Test
    void riceAndDalTotalsLeaveFiberUnknown() {
        MenuAggregate result = aggregator.aggregate(List.of(
                new FoodSelection("Rice", 2.0),
                new FoodSelection("Dal", 1.0)));

        assertEquals(550.0, result.getTotals().get("Calories"), 1e-9);
        assertEquals(17.0, result.getTotals().get("Protein"), 1e-9);
        assertTrue(result.getTotals().containsKey("Fiber"));
        assertNull(result.getTotals().get("Fiber"));
    }

    @Test
    void resolvedItemsEchoServingSizeAndCatalogCasing() {
        MenuAggregate result = aggregator.aggregate(List.of(
                new FoodSelection("rice", 2.0),
                new FoodSelection("DAL", 0.5)));

        assertEquals(2, result.getResolvedItems().size());
        assertEquals("Rice", result.getResolvedItems().get(0).getFoodName());
        assertEquals("1 cup", result.getResolvedItems().get(0).getServingSize());
        assertEquals(0.5, result.getResolvedItems().get(1).getQuantity(), 1e-9);
    }

    @Test
    void doublingQuantitiesDoublesTotals() {
        MenuAggregate single = aggregator.aggregate(List.of(new FoodSelection("Dal", 1.5)));
        MenuAggregate doubled = aggregator.aggregate(List.of(new FoodSelection("Dal", 3.0)));

        for (Map.Entry<String, Double> entry : single.getTotals().entrySet()) {
            assertEquals(entry.getValue() * 2, doubled.getTotals().get(entry.getKey()), 1e-9, entry.getKey());
        }
    }

    @Test
    void unknownFoodFailsWholeMenu() {
        FoodNotFoundException ex = assertThrows(FoodNotFoundException.class, () -> aggregator.aggregate(List.of(
                new FoodSelection("Rice", 1.0),
                new FoodSelection("Soup", 1.0))));
        assertEquals("Soup", ex.getFoodName());
    }

    @Test
    void nutrientOnlyKnownForOtherCatalogFoodsIsUnknown() {
        catalog.put("milk", food("Milk", "1 glass", Map.of("Calories", 120.0, "Calcium", 300.0)));
        Set<String> nutrientNames = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        nutrientNames.addAll(List.of("Calories", "Protein", "Fiber", "Calcium"));
        when(catalogService.catalogNutrientNames()).thenReturn(nutrientNames);

        MenuAggregate result = aggregator.aggregate(List.of(new FoodSelection("Dal", 1.0)));

        assertEquals(150.0, result.getTotals().get("Calories"), 1e-9);
        assertTrue(result.getTotals().containsKey("Calcium"));
        assertNull(result.getTotals().get("Calcium"));
    }

    @Test
    void rejectsEmptyMenuAndNonPositiveQuantity() {
        assertThrows(ValidationException.class, () -> aggregator.aggregate(List.of()));
        assertThrows(ValidationException.class,
                () -> aggregator.aggregate(List.of(new FoodSelection("Rice", 0.0))));
    }

    private FoodItem food(String name, String servingSize, Map<String, Double> nutrients) {
        return FoodItem.builder()
                .name(name)
                .nameKey(name.toLowerCase())
                .servingSize(servingSize)
                .nutrients(new HashMap<>(nutrients))
                .build();
    }
}
