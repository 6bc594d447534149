package com.NutriCare.diet_backend.model;

import com.NutriCare.diet_backend.util.NutrientKeys;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "rda_profiles")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RdaProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(name = "name_key", nullable = false, unique = true)
    private String nameKey;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "rda_profile_targets", joinColumns = @JoinColumn(name = "rda_profile_id"))
    @MapKeyColumn(name = "nutrient_name")
    @Column(name = "amount", nullable = false)
    @Builder.Default
    private Map<String, Double> targets = new HashMap<>();

    @Version
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public void replaceWith(String displayName, Map<String, Double> newTargets) {
        this.name = displayName;
        this.targets.clear();
        this.targets.putAll(newTargets);
    }

    @PrePersist
    @PreUpdate
    private void normalize() {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Profile name is required");
        }
        name = name.trim();
        nameKey = NutrientKeys.catalogKey(name);
        NutrientKeys.requireNonNegative(targets, "RDA profile '" + name + "'");
    }
}
