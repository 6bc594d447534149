package com.NutriCare.diet_backend.repository;

import com.NutriCare.diet_backend.model.MealPlanItem;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface MealPlanItemRepository extends JpaRepository<MealPlanItem, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM MealPlanItem i WHERE i.id = :id")
    Optional<MealPlanItem> findByIdForUpdate(@Param("id") UUID id);
}
