package com.NutriCare.diet_backend.model;

import com.NutriCare.diet_backend.enums.MealCategory;
import com.NutriCare.diet_backend.enums.MealItemStatus;
import com.NutriCare.diet_backend.exception.InvalidTransitionException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MealPlanItemTest {

    @Test
    void startsPendingWithBothFlagsCleared() {
        MealPlanItem item = breakfastRice();
        assertEquals(MealItemStatus.PENDING, item.getStatus());
        assertFalse(item.isPrepared());
        assertFalse(item.isDelivered());
    }

    @Test
    void markPreparedTwiceIsSameAsOnce() {
        MealPlanItem item = breakfastRice();
        assertTrue(item.markPrepared());
        assertFalse(item.markPrepared());
        assertEquals(MealItemStatus.PREPARED, item.getStatus());
        assertTrue(item.isPrepared());
        assertFalse(item.isDelivered());
    }

    @Test
    void deliveringPendingItemAlsoMarksItPrepared() {
        MealPlanItem item = breakfastRice();
        assertTrue(item.markDelivered());
        assertTrue(item.isPrepared());
        assertTrue(item.isDelivered());
    }

    @Test
    void markPreparedDoesNotDemoteDeliveredItem() {
        MealPlanItem item = breakfastRice();
        item.markDelivered();
        assertFalse(item.markPrepared());
        assertEquals(MealItemStatus.DELIVERED, item.getStatus());
    }

    @Test
    void unpreparingDeliveredItemIsRejected() {
        MealPlanItem item = breakfastRice();
        item.markDelivered();

        InvalidTransitionException ex = assertThrows(InvalidTransitionException.class, item::markUnprepared);
        assertEquals(MealItemStatus.DELIVERED, ex.getCurrentStatus());
        assertEquals(MealItemStatus.DELIVERED, item.getStatus());
    }

    @Test
    void notDeliveredKeepsItemPrepared() {
        MealPlanItem item = breakfastRice();
        item.markDelivered();
        assertTrue(item.markNotDelivered());
        assertTrue(item.isPrepared());
        assertFalse(item.isDelivered());

        assertTrue(item.markUnprepared());
        assertEquals(MealItemStatus.PENDING, item.getStatus());
    }

    @Test
    void revertsOnUntouchedItemAreNoOps() {
        MealPlanItem item = breakfastRice();
        assertFalse(item.markUnprepared());
        assertFalse(item.markNotDelivered());
        assertEquals(MealItemStatus.PENDING, item.getStatus());
    }

    @Test
    void noReachableStateIsDeliveredButUnprepared() {
        for (MealItemStatus status : MealItemStatus.values()) {
            assertFalse(status.isDelivered() && !status.isPrepared(), status.name());
        }
    }

    @Test
    void rejectsNonPositiveQuantity() {
        assertThrows(IllegalArgumentException.class,
                () -> MealPlanItem.pending(MealCategory.LUNCH, "Rice", 0));
        assertThrows(IllegalArgumentException.class,
                () -> MealPlanItem.pending(MealCategory.LUNCH, "Rice", -1.5));
        assertThrows(IllegalArgumentException.class,
                () -> MealPlanItem.pending(MealCategory.LUNCH, "Rice", Double.NaN));
    }

    @Test
    void addingToPlanAssignsPositionsInOrder() {
        MealPlan plan = new MealPlan();
        plan.addItem(breakfastRice());
        plan.addItem(MealPlanItem.pending(MealCategory.DINNER, "Dal", 0.5));

        assertEquals(0, plan.getItems().get(0).getPosition());
        assertEquals(1, plan.getItems().get(1).getPosition());
        assertSame(plan, plan.getItems().get(1).getMealPlan());
        assertThrows(UnsupportedOperationException.class, () -> plan.getItems().clear());
    }

    private MealPlanItem breakfastRice() {
        return MealPlanItem.pending(MealCategory.BREAKFAST, "Rice", 2);
    }
}
