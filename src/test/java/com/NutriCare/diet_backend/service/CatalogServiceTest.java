package com.NutriCare.diet_backend.service;

import com.NutriCare.diet_backend.dto.request.FoodRecord;
import com.NutriCare.diet_backend.dto.request.RdaProfileRecord;
import com.NutriCare.diet_backend.dto.response.CatalogUpsertResult;
import com.NutriCare.diet_backend.exception.ApiException;
import com.NutriCare.diet_backend.model.FoodItem;
import com.NutriCare.diet_backend.repository.FoodItemRepository;
import com.NutriCare.diet_backend.repository.RdaProfileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CatalogServiceTest {

    private static final int MAX_RETRIES = 3;

    @Mock
    private FoodItemRepository foodItemRepository;
    @Mock
    private RdaProfileRepository rdaProfileRepository;
    @Mock
    private PlatformTransactionManager transactionManager;

    private CatalogService catalogService;

    @BeforeEach
    void setup() {
        catalogService = new CatalogService(foodItemRepository, rdaProfileRepository, transactionManager, MAX_RETRIES);
        when(foodItemRepository.findByNameKeyIn(any())).thenReturn(List.of());
        when(rdaProfileRepository.findByNameKeyIn(any())).thenReturn(List.of());
    }

    @Test
    void batchLosingNameRaceIsReappliedAsUpdate() {
        Map<String, Double> before = new HashMap<>();
        before.put("Calories", 180.0);
        FoodItem insertedConcurrently = FoodItem.builder()
                .name("Rice")
                .nameKey("rice")
                .servingSize("1 cup")
                .nutrients(before)
                .build();
        when(foodItemRepository.findByNameKeyIn(any()))
                .thenReturn(List.of())
                .thenReturn(List.of(insertedConcurrently));
        when(foodItemRepository.saveAllAndFlush(any()))
                .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"))
                .thenReturn(List.of());

        CatalogUpsertResult result = catalogService.upsertFoods(List.of(
                food("Rice", 200.0), food("Dal", 150.0)));

        assertEquals(1, result.getCreated());
        assertEquals(1, result.getUpdated());
        assertEquals(200.0, insertedConcurrently.getNutrients().get("Calories"));
        verify(foodItemRepository, times(2)).saveAllAndFlush(any());
        verify(transactionManager).rollback(any());
        verify(transactionManager).commit(any());
    }

    @Test
    void persistentCollisionGivesUpAfterConfiguredAttempts() {
        when(foodItemRepository.saveAllAndFlush(any()))
                .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"));

        ApiException ex = assertThrows(ApiException.class,
                () -> catalogService.upsertFoods(List.of(food("Rice", 200.0))));

        assertEquals("CATALOG_BUSY", ex.getErrorCode());
        assertEquals(HttpStatus.CONFLICT, ex.getStatus());
        verify(foodItemRepository, times(MAX_RETRIES)).saveAllAndFlush(any());
        verify(transactionManager, times(MAX_RETRIES)).rollback(any());
        verify(transactionManager, never()).commit(any());
    }

    @Test
    void profileVersionConflictIsRetried() {
        when(rdaProfileRepository.saveAllAndFlush(any()))
                .thenThrow(new OptimisticLockingFailureException("row was updated by another transaction"))
                .thenReturn(List.of());

        CatalogUpsertResult result = catalogService.upsertRdaProfiles(List.of(RdaProfileRecord.builder()
                .name("Adult-Male")
                .targets(Map.of("Calories", 2000.0))
                .build()));

        assertEquals(1, result.getCreated());
        verify(rdaProfileRepository, times(2)).saveAllAndFlush(any());
    }

    @Test
    void otherFailuresAreNotRetried() {
        when(foodItemRepository.saveAllAndFlush(any())).thenThrow(new IllegalStateException("connection lost"));

        assertThrows(IllegalStateException.class, () -> catalogService.upsertFoods(List.of(food("Rice", 200.0))));

        verify(foodItemRepository, times(1)).saveAllAndFlush(any());
    }

    private FoodRecord food(String name, double calories) {
        return FoodRecord.builder()
                .name(name)
                .servingSize("1 cup")
                .nutrients(Map.of("Calories", calories))
                .build();
    }
}
