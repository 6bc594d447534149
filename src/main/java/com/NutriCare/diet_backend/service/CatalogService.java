package com.NutriCare.diet_backend.service;

import com.NutriCare.diet_backend.dto.request.FoodRecord;
import com.NutriCare.diet_backend.dto.request.RdaProfileRecord;
import com.NutriCare.diet_backend.dto.response.CatalogUpsertResult;
import com.NutriCare.diet_backend.dto.response.FoodResponse;
import com.NutriCare.diet_backend.dto.response.RdaProfileResponse;
import com.NutriCare.diet_backend.exception.ApiException;
import com.NutriCare.diet_backend.exception.FoodNotFoundException;
import com.NutriCare.diet_backend.exception.ProfileNotFoundException;
import com.NutriCare.diet_backend.exception.ResourceNotFoundException;
import com.NutriCare.diet_backend.exception.ValidationException;
import com.NutriCare.diet_backend.model.FoodItem;
import com.NutriCare.diet_backend.model.RdaProfile;
import com.NutriCare.diet_backend.repository.FoodItemRepository;
import com.NutriCare.diet_backend.repository.RdaProfileRepository;
import com.NutriCare.diet_backend.util.Constants;
import com.NutriCare.diet_backend.util.NutrientKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Food and RDA profile catalog. Names are unique case-insensitively; uploads upsert by name,
 * each batch in a single transaction so readers see all of it or none of it.
 */
@Service
@Slf4j
public class CatalogService {

    private static final long BASE_RETRY_DELAY_MS = 100;

    private final FoodItemRepository foodItemRepository;
    private final RdaProfileRepository rdaProfileRepository;
    private final TransactionTemplate upsertTxTemplate;
    private final int maxRetries;

    public CatalogService(FoodItemRepository foodItemRepository,
                          RdaProfileRepository rdaProfileRepository,
                          PlatformTransactionManager transactionManager,
                          @Value("${app.catalog.upsert-max-retries:3}") int maxRetries) {
        this.foodItemRepository = foodItemRepository;
        this.rdaProfileRepository = rdaProfileRepository;
        this.upsertTxTemplate = new TransactionTemplate(transactionManager);
        this.maxRetries = Math.max(1, maxRetries);
    }

    public CatalogUpsertResult upsertFoods(List<FoodRecord> records) {
        Map<String, FoodRecord> batch = dedupeByName(records, FoodRecord::getName);
        for (FoodRecord record : batch.values()) {
            requireValidAmounts(record.getNutrients(), "Food '" + record.getName() + "'");
        }
        CatalogUpsertResult result = executeWithRetry("foods", () -> applyFoods(batch));
        log.info("Food catalog upsert applied: {} created, {} updated", result.getCreated(), result.getUpdated());
        return result;
    }

    public CatalogUpsertResult upsertRdaProfiles(List<RdaProfileRecord> records) {
        Map<String, RdaProfileRecord> batch = dedupeByName(records, RdaProfileRecord::getName);
        for (RdaProfileRecord record : batch.values()) {
            requireValidAmounts(record.getTargets(), "RDA profile '" + record.getName() + "'");
        }
        CatalogUpsertResult result = executeWithRetry("RDA profiles", () -> applyRdaProfiles(batch));
        log.info("RDA profile upsert applied: {} created, {} updated", result.getCreated(), result.getUpdated());
        return result;
    }

    @Transactional(readOnly = true)
    public FoodResponse getFood(String name) {
        return mapToFoodResponse(findFood(name));
    }

    @Transactional(readOnly = true)
    public FoodItem findFood(String name) {
        return foodItemRepository.findByNameKey(NutrientKeys.catalogKey(name))
                .orElseThrow(() -> new FoodNotFoundException(name));
    }

    @Transactional(readOnly = true)
    public List<FoodResponse> listFoods() {
        List<FoodItem> foods = foodItemRepository.findAllByOrderByNameKeyAsc();
        if (foods.isEmpty()) {
            throw new ResourceNotFoundException(Constants.ERROR_NO_FOODS, "CATALOG_EMPTY");
        }
        return foods.stream()
                .map(this::mapToFoodResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<String> listProfileNames() {
        List<String> names = rdaProfileRepository.findAllNames();
        if (names.isEmpty()) {
            throw new ResourceNotFoundException(Constants.ERROR_NO_RDA, "CATALOG_EMPTY");
        }
        return names;
    }

    @Transactional(readOnly = true)
    public RdaProfileResponse getProfile(String name) {
        RdaProfile profile = findProfile(name);
        return RdaProfileResponse.builder()
                .name(profile.getName())
                .targets(sortedCopy(profile.getTargets()))
                .build();
    }

    @Transactional(readOnly = true)
    public RdaProfile findProfile(String name) {
        return rdaProfileRepository.findByNameKey(NutrientKeys.catalogKey(name))
                .orElseThrow(() -> new ProfileNotFoundException(name));
    }

    /**
     * Resolves the given names in one query. The result is keyed by catalog key; names with no
     * catalog entry are simply absent.
     */
    @Transactional(readOnly = true)
    public Map<String, FoodItem> findFoodsByNames(Collection<String> names) {
        Set<String> keys = names.stream()
                .map(NutrientKeys::catalogKey)
                .filter(key -> key != null && !key.isEmpty())
                .collect(Collectors.toSet());
        if (keys.isEmpty()) {
            return new HashMap<>();
        }
        return foodItemRepository.findByNameKeyIn(keys).stream()
                .collect(Collectors.toMap(FoodItem::getNameKey, Function.identity()));
    }

    /**
     * Every nutrient name that at least one catalog food carries, case-insensitively distinct.
     */
    @Transactional(readOnly = true)
    public Set<String> catalogNutrientNames() {
        Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        names.addAll(foodItemRepository.findAllNutrientNames());
        return names;
    }

    private CatalogUpsertResult applyFoods(Map<String, FoodRecord> batch) {
        Map<String, FoodItem> existing = foodItemRepository.findByNameKeyIn(batch.keySet()).stream()
                .collect(Collectors.toMap(FoodItem::getNameKey, Function.identity()));

        List<FoodItem> toSave = new ArrayList<>();
        int created = 0;
        int updated = 0;
        for (Map.Entry<String, FoodRecord> entry : batch.entrySet()) {
            FoodRecord record = entry.getValue();
            String displayName = NutrientKeys.displayName(record.getName());
            Map<String, Double> nutrients = displayKeyed(record.getNutrients());

            FoodItem food = existing.get(entry.getKey());
            if (food == null) {
                food = FoodItem.builder()
                        .name(displayName)
                        .nameKey(entry.getKey())
                        .servingSize(record.getServingSize())
                        .nutrients(nutrients)
                        .build();
                created++;
            } else {
                food.replaceWith(displayName, record.getServingSize(), nutrients);
                updated++;
            }
            toSave.add(food);
        }
        foodItemRepository.saveAllAndFlush(toSave);
        return new CatalogUpsertResult(created, updated);
    }

    private CatalogUpsertResult applyRdaProfiles(Map<String, RdaProfileRecord> batch) {
        Map<String, RdaProfile> existing = rdaProfileRepository.findByNameKeyIn(batch.keySet()).stream()
                .collect(Collectors.toMap(RdaProfile::getNameKey, Function.identity()));

        List<RdaProfile> toSave = new ArrayList<>();
        int created = 0;
        int updated = 0;
        for (Map.Entry<String, RdaProfileRecord> entry : batch.entrySet()) {
            RdaProfileRecord record = entry.getValue();
            String displayName = NutrientKeys.displayName(record.getName());
            Map<String, Double> targets = displayKeyed(record.getTargets());

            RdaProfile profile = existing.get(entry.getKey());
            if (profile == null) {
                profile = RdaProfile.builder()
                        .name(displayName)
                        .nameKey(entry.getKey())
                        .targets(targets)
                        .build();
                created++;
            } else {
                profile.replaceWith(displayName, targets);
                updated++;
            }
            toSave.add(profile);
        }
        rdaProfileRepository.saveAllAndFlush(toSave);
        return new CatalogUpsertResult(created, updated);
    }

    /**
     * Runs one upsert batch in its own transaction. A batch that collides with a concurrent
     * batch on the unique name key, or on a row version, is rolled back and re-applied.
     */
    private CatalogUpsertResult executeWithRetry(String catalogName, Supplier<CatalogUpsertResult> batch) {
        int attempt = 1;
        while (true) {
            try {
                return upsertTxTemplate.execute(status -> batch.get());
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                if (attempt >= maxRetries) {
                    log.error("Upsert of {} failed after {} attempts", catalogName, attempt, e);
                    throw new ApiException("The catalog is being updated by another upload. Please retry.",
                            HttpStatus.CONFLICT, "CATALOG_BUSY", e);
                }
                long delay = BASE_RETRY_DELAY_MS * (1L << (attempt - 1));
                log.warn("Upsert of {} collided with a concurrent update, retrying ({}/{}) after {}ms",
                        catalogName, attempt, maxRetries, delay);
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ApiException("Catalog upsert interrupted", HttpStatus.SERVICE_UNAVAILABLE,
                            "CATALOG_BUSY", ie);
                }
                attempt++;
            }
        }
    }

    // Last record wins when a batch names the same entry twice.
    private static <T> Map<String, T> dedupeByName(List<T> records, Function<T, String> nameOf) {
        if (records == null || records.isEmpty()) {
            throw new ValidationException("No records to upsert");
        }
        Map<String, T> batch = new LinkedHashMap<>();
        for (T record : records) {
            String key = NutrientKeys.catalogKey(nameOf.apply(record));
            if (key == null || key.isEmpty()) {
                throw new ValidationException("Every catalog record needs a name");
            }
            batch.remove(key);
            batch.put(key, record);
        }
        return batch;
    }

    private static void requireValidAmounts(Map<String, Double> amounts, String owner) {
        if (amounts == null) {
            return;
        }
        try {
            NutrientKeys.requireNonNegative(amounts, owner);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage());
        }
    }

    private static Map<String, Double> displayKeyed(Map<String, Double> amounts) {
        Map<String, Double> result = new HashMap<>();
        if (amounts == null) {
            return result;
        }
        Set<String> seen = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (Map.Entry<String, Double> entry : amounts.entrySet()) {
            String nutrient = NutrientKeys.displayName(entry.getKey());
            if (nutrient == null || nutrient.isEmpty() || !seen.add(nutrient)) {
                continue;
            }
            result.put(nutrient, entry.getValue());
        }
        return result;
    }

    private static Map<String, Double> sortedCopy(Map<String, Double> amounts) {
        Map<String, Double> sorted = NutrientKeys.newNutrientMap();
        sorted.putAll(amounts);
        return sorted;
    }

    private FoodResponse mapToFoodResponse(FoodItem food) {
        return FoodResponse.builder()
                .name(food.getName())
                .servingSize(food.getServingSize())
                .nutrients(sortedCopy(food.getNutrients()))
                .build();
    }
}
