package com.NutriCare.diet_backend.service;

import com.NutriCare.diet_backend.dto.request.CreateMealPlanRequest;
import com.NutriCare.diet_backend.dto.request.UpdateMealPlanItemStatusRequest;
import com.NutriCare.diet_backend.dto.response.KitchenSummaryResponse;
import com.NutriCare.diet_backend.dto.response.MealPlanItemResponse;
import com.NutriCare.diet_backend.dto.response.MealPlanResponse;
import com.NutriCare.diet_backend.dto.response.PatientSummary;
import com.NutriCare.diet_backend.enums.MealCategory;
import com.NutriCare.diet_backend.enums.MealItemStatus;
import com.NutriCare.diet_backend.exception.ApiException;
import com.NutriCare.diet_backend.exception.FoodNotFoundException;
import com.NutriCare.diet_backend.exception.InvalidTransitionException;
import com.NutriCare.diet_backend.exception.ResourceNotFoundException;
import com.NutriCare.diet_backend.exception.ValidationException;
import com.NutriCare.diet_backend.model.FoodItem;
import com.NutriCare.diet_backend.model.MealPlan;
import com.NutriCare.diet_backend.model.MealPlanItem;
import com.NutriCare.diet_backend.model.Patient;
import com.NutriCare.diet_backend.repository.MealPlanItemRepository;
import com.NutriCare.diet_backend.repository.MealPlanRepository;
import com.NutriCare.diet_backend.repository.PatientRepository;
import com.NutriCare.diet_backend.util.DateUtil;
import com.NutriCare.diet_backend.util.NutrientKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class MealPlanService {

    private final MealPlanRepository mealPlanRepository;
    private final MealPlanItemRepository mealPlanItemRepository;
    private final PatientRepository patientRepository;
    private final CatalogService catalogService;
    private final ModelMapper modelMapper;
    private final Clock clock;

    /**
     * Sends a menu to the kitchen: the plan and all of its items are written in one
     * transaction, or nothing is.
     */
    @Transactional
    public MealPlanResponse createPlan(CreateMealPlanRequest request) {
        Patient patient = patientRepository.findById(request.getPatientId())
                .orElseThrow(() -> new ResourceNotFoundException("Patient", "id", request.getPatientId()));

        Map<MealCategory, List<CreateMealPlanRequest.MealPlanItemRequest>> byCategory = groupByCategory(request);
        if (byCategory.isEmpty()) {
            throw new ApiException("Meal plan must contain at least one item", HttpStatus.BAD_REQUEST,
                    "EMPTY_MEAL_PLAN");
        }

        List<String> foodNames = new ArrayList<>();
        byCategory.values().forEach(items -> items.forEach(item -> foodNames.add(item.getFoodName())));
        Map<String, FoodItem> catalog = catalogService.findFoodsByNames(foodNames);

        MealPlan mealPlan = MealPlan.builder()
                .patient(patient)
                .createdAt(LocalDateTime.now(clock))
                .build();

        for (Map.Entry<MealCategory, List<CreateMealPlanRequest.MealPlanItemRequest>> entry : byCategory.entrySet()) {
            for (CreateMealPlanRequest.MealPlanItemRequest itemRequest : entry.getValue()) {
                FoodItem food = catalog.get(NutrientKeys.catalogKey(itemRequest.getFoodName()));
                if (food == null) {
                    throw new FoodNotFoundException(itemRequest.getFoodName());
                }
                mealPlan.addItem(MealPlanItem.pending(entry.getKey(), food.getName(), itemRequest.getQuantity()));
            }
        }

        MealPlan savedPlan = mealPlanRepository.save(mealPlan);
        log.info("Meal plan {} sent to kitchen for patient {} with {} items",
                savedPlan.getId(), patient.getId(), savedPlan.getItems().size());
        return mapToMealPlanResponse(savedPlan);
    }

    /**
     * All plans, or only those created on the given calendar day (application time zone),
     * oldest first. A day with no plans yields an empty list.
     */
    @Transactional(readOnly = true)
    public List<MealPlanResponse> listPlans(LocalDate date) {
        return findPlans(date).stream()
                .map(this::mapToMealPlanResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public MealPlanResponse getPlan(UUID id) {
        MealPlan mealPlan = mealPlanRepository.findWithItemsById(id)
                .orElseThrow(() -> new ResourceNotFoundException("MealPlan", "id", id));
        return mapToMealPlanResponse(mealPlan);
    }

    /**
     * Applies a partial {prepared, delivered} update under a row lock on the item, so two
     * kitchen workers ticking the same dish are serialized.
     */
    @Transactional
    public MealPlanItemResponse updateItemStatus(UUID itemId, UpdateMealPlanItemStatusRequest request) {
        MealPlanItem item = mealPlanItemRepository.findByIdForUpdate(itemId)
                .orElseThrow(() -> new ResourceNotFoundException("MealPlanItem", "id", itemId));

        MealItemStatus before = item.getStatus();
        applyStatusChange(item, request.getPrepared(), request.getDelivered());

        if (item.getStatus() != before) {
            log.info("Meal plan item {} moved from {} to {}", itemId, before, item.getStatus());
        } else {
            log.debug("Meal plan item {} unchanged ({})", itemId, before);
        }
        return mapToItemResponse(item);
    }

    @Transactional(readOnly = true)
    public KitchenSummaryResponse kitchenSummary(LocalDate date) {
        List<MealPlan> plans = findPlans(date);

        Map<String, Long> pendingByCategory = new LinkedHashMap<>();
        for (MealCategory category : MealCategory.values()) {
            pendingByCategory.put(category.getLabel(), 0L);
        }

        int itemCount = 0;
        int prepared = 0;
        int delivered = 0;
        for (MealPlan plan : plans) {
            for (MealPlanItem item : plan.getItems()) {
                itemCount++;
                if (item.isPrepared()) {
                    prepared++;
                }
                if (item.isDelivered()) {
                    delivered++;
                }
                if (item.getStatus() == MealItemStatus.PENDING) {
                    pendingByCategory.merge(item.getMealCategory().getLabel(), 1L, Long::sum);
                }
            }
        }

        return KitchenSummaryResponse.builder()
                .date(date)
                .planCount(plans.size())
                .itemCount(itemCount)
                .preparedCount(prepared)
                .deliveredCount(delivered)
                .unpreparedCount(itemCount - prepared)
                .notDeliveredCount(itemCount - delivered)
                .pendingByCategory(pendingByCategory)
                .build();
    }

    static void applyStatusChange(MealPlanItem item, Boolean prepared, Boolean delivered) {
        if (Boolean.TRUE.equals(delivered)) {
            if (Boolean.FALSE.equals(prepared)) {
                throw new InvalidTransitionException(item.getId(), item.getStatus(), "prepared=false, delivered=true");
            }
            item.markDelivered();
            return;
        }
        if (Boolean.FALSE.equals(delivered)) {
            item.markNotDelivered();
        }
        if (Boolean.TRUE.equals(prepared)) {
            item.markPrepared();
        } else if (Boolean.FALSE.equals(prepared)) {
            item.markUnprepared();
        }
    }

    private List<MealPlan> findPlans(LocalDate date) {
        if (date == null) {
            return mealPlanRepository.findAllWithItems();
        }
        return mealPlanRepository.findCreatedBetweenWithItems(
                DateUtil.getStartOfDay(date), DateUtil.getStartOfNextDay(date));
    }

    // Category order follows the day (Breakfast first); items keep request order within a category.
    private Map<MealCategory, List<CreateMealPlanRequest.MealPlanItemRequest>> groupByCategory(
            CreateMealPlanRequest request) {
        Map<MealCategory, List<CreateMealPlanRequest.MealPlanItemRequest>> byCategory = new EnumMap<>(MealCategory.class);
        if (request.getMealPlan() == null) {
            return byCategory;
        }
        for (Map.Entry<String, List<CreateMealPlanRequest.MealPlanItemRequest>> entry : request.getMealPlan().entrySet()) {
            MealCategory category = MealCategory.fromString(entry.getKey());
            if (category == null) {
                throw new ValidationException("Unknown meal category '" + entry.getKey() + "'. Available categories: "
                        + MealCategory.getAvailableCategories());
            }
            if (entry.getValue() == null || entry.getValue().isEmpty()) {
                continue;
            }
            for (CreateMealPlanRequest.MealPlanItemRequest item : entry.getValue()) {
                if (item == null || item.getFoodName() == null || item.getFoodName().trim().isEmpty()) {
                    throw new ValidationException("Every meal plan item needs a food name");
                }
                Double quantity = item.getQuantity();
                if (quantity == null || !(quantity > 0) || quantity.isInfinite()) {
                    throw new ValidationException("Quantity for '" + item.getFoodName() + "' must be greater than 0");
                }
            }
            byCategory.computeIfAbsent(category, key -> new ArrayList<>()).addAll(entry.getValue());
        }
        return byCategory;
    }

    private MealPlanResponse mapToMealPlanResponse(MealPlan mealPlan) {
        PatientSummary patient = mealPlan.getPatient() == null
                ? null
                : modelMapper.map(mealPlan.getPatient(), PatientSummary.class);

        List<MealPlanItemResponse> items = mealPlan.getItems().stream()
                .sorted(Comparator.comparingInt(MealPlanItem::getPosition))
                .map(this::mapToItemResponse)
                .collect(Collectors.toList());

        return MealPlanResponse.builder()
                .id(mealPlan.getId())
                .createdAt(mealPlan.getCreatedAt())
                .patient(patient)
                .items(items)
                .build();
    }

    private MealPlanItemResponse mapToItemResponse(MealPlanItem item) {
        return MealPlanItemResponse.builder()
                .id(item.getId())
                .mealCategory(item.getMealCategory().getLabel())
                .foodName(item.getFoodName())
                .quantity(item.getQuantity())
                .status(item.getStatus().getLabel())
                .prepared(item.isPrepared())
                .delivered(item.isDelivered())
                .build();
    }
}
