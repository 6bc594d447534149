package com.NutriCare.diet_backend.model;

import com.NutriCare.diet_backend.util.NutrientKeys;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * One catalog food. Nutrients form an open set keyed by the column header of the uploaded
 * sheet; a nutrient missing from the map is unknown, which is not the same as zero.
 */
@Entity
@Table(name = "food_items")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FoodItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(name = "name_key", nullable = false, unique = true)
    private String nameKey;

    private String servingSize;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "food_item_nutrients", joinColumns = @JoinColumn(name = "food_item_id"))
    @MapKeyColumn(name = "nutrient_name")
    @Column(name = "amount", nullable = false)
    @Builder.Default
    private Map<String, Double> nutrients = new HashMap<>();

    @Version
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public Optional<Double> findNutrient(String nutrientName) {
        return Optional.ofNullable(NutrientKeys.lookup(nutrients, nutrientName));
    }

    /**
     * Replaces label and nutrient values wholesale, keeping identity and version.
     */
    public void replaceWith(String displayName, String servingSize, Map<String, Double> newNutrients) {
        this.name = displayName;
        this.servingSize = servingSize;
        this.nutrients.clear();
        this.nutrients.putAll(newNutrients);
    }

    @PrePersist
    @PreUpdate
    private void normalize() {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Food name is required");
        }
        name = name.trim();
        nameKey = NutrientKeys.catalogKey(name);
        NutrientKeys.requireNonNegative(nutrients, "Food '" + name + "'");
    }

    @Override
    public String toString() {
        return "FoodItem{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", servingSize='" + servingSize + '\'' +
                ", nutrients=" + nutrients.size() +
                '}';
    }
}
