package com.NutriCare.diet_backend.repository;

import com.NutriCare.diet_backend.model.RdaProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RdaProfileRepository extends JpaRepository<RdaProfile, UUID> {
    Optional<RdaProfile> findByNameKey(String nameKey);

    List<RdaProfile> findByNameKeyIn(Collection<String> nameKeys);

    @Query("SELECT p.name FROM RdaProfile p ORDER BY p.nameKey ASC")
    List<String> findAllNames();
}
