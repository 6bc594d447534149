package com.NutriCare.diet_backend.model;

import com.NutriCare.diet_backend.enums.MealCategory;
import com.NutriCare.diet_backend.enums.MealItemStatus;
import com.NutriCare.diet_backend.exception.InvalidTransitionException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * A dish on a meal plan. Category, food and quantity are fixed at creation; only the
 * kitchen status moves, through the mark* transitions below.
 */
@Entity
@Table(name = "meal_plan_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MealPlanItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Setter(AccessLevel.PACKAGE)
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "meal_plan_id", nullable = false)
    private MealPlan mealPlan;

    @Column(name = "meal_category", nullable = false, updatable = false)
    private MealCategory mealCategory;

    // Free text, deliberately not a foreign key into the catalog.
    @Column(name = "food_name", nullable = false, updatable = false)
    private String foodName;

    @Column(nullable = false, updatable = false)
    private Double quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private MealItemStatus status = MealItemStatus.PENDING;

    @Setter(AccessLevel.PACKAGE)
    @Column(nullable = false)
    private int position;

    @Version
    private Long version;

    public static MealPlanItem pending(MealCategory mealCategory, String foodName, double quantity) {
        if (mealCategory == null) {
            throw new IllegalArgumentException("Meal category is required");
        }
        if (foodName == null || foodName.trim().isEmpty()) {
            throw new IllegalArgumentException("Food name is required");
        }
        if (!(quantity > 0) || Double.isInfinite(quantity)) {
            throw new IllegalArgumentException("Quantity must be greater than 0");
        }
        MealPlanItem item = new MealPlanItem();
        item.mealCategory = mealCategory;
        item.foodName = foodName.trim();
        item.quantity = quantity;
        item.status = MealItemStatus.PENDING;
        return item;
    }

    public boolean isPrepared() {
        return status.isPrepared();
    }

    public boolean isDelivered() {
        return status.isDelivered();
    }

    /**
     * Pending to Prepared. No-op when already prepared or delivered.
     */
    public boolean markPrepared() {
        if (status != MealItemStatus.PENDING) {
            return false;
        }
        status = MealItemStatus.PREPARED;
        return true;
    }

    /**
     * Moves to Delivered from any state. A pending dish is taken as prepared on delivery.
     */
    public boolean markDelivered() {
        if (status == MealItemStatus.DELIVERED) {
            return false;
        }
        status = MealItemStatus.DELIVERED;
        return true;
    }

    /**
     * Prepared back to Pending. Rejected while the dish is still marked delivered.
     */
    public boolean markUnprepared() {
        if (status == MealItemStatus.DELIVERED) {
            throw new InvalidTransitionException(id, status, "prepared=false");
        }
        if (status == MealItemStatus.PENDING) {
            return false;
        }
        status = MealItemStatus.PENDING;
        return true;
    }

    /**
     * Delivered back to Prepared; the dish stays prepared.
     */
    public boolean markNotDelivered() {
        if (status != MealItemStatus.DELIVERED) {
            return false;
        }
        status = MealItemStatus.PREPARED;
        return true;
    }
}
