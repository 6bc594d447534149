package com.NutriCare.diet_backend.repository;

import com.NutriCare.diet_backend.model.FoodItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FoodItemRepository extends JpaRepository<FoodItem, UUID> {
    Optional<FoodItem> findByNameKey(String nameKey);

    List<FoodItem> findByNameKeyIn(Collection<String> nameKeys);

    List<FoodItem> findAllByOrderByNameKeyAsc();

    @Query("SELECT DISTINCT KEY(n) FROM FoodItem f JOIN f.nutrients n")
    List<String> findAllNutrientNames();
}
