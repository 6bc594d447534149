package com.NutriCare.diet_backend.repository;

import com.NutriCare.diet_backend.model.MealPlan;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MealPlanRepository extends JpaRepository<MealPlan, UUID> {

    @Query("SELECT DISTINCT mp FROM MealPlan mp " +
            "LEFT JOIN FETCH mp.patient " +
            "LEFT JOIN FETCH mp.items " +
            "WHERE mp.id = :id")
    Optional<MealPlan> findWithItemsById(@Param("id") UUID id);

    @Query("SELECT DISTINCT mp FROM MealPlan mp " +
            "LEFT JOIN FETCH mp.patient " +
            "LEFT JOIN FETCH mp.items " +
            "ORDER BY mp.createdAt ASC")
    List<MealPlan> findAllWithItems();

    // [start, end) so that the whole calendar day is covered
    @Query("SELECT DISTINCT mp FROM MealPlan mp " +
            "LEFT JOIN FETCH mp.patient " +
            "LEFT JOIN FETCH mp.items " +
            "WHERE mp.createdAt >= :start AND mp.createdAt < :end " +
            "ORDER BY mp.createdAt ASC")
    List<MealPlan> findCreatedBetweenWithItems(@Param("start") LocalDateTime start,
                                               @Param("end") LocalDateTime end);
}
