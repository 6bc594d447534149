package com.NutriCare.diet_backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

/**
 * Read-only view of the patient register. Patient records are created and edited by the
 * patient service; this backend only resolves references to them.
 */
@Entity
@Immutable
@Table(name = "patients")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Patient {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hospital_id", unique = true)
    private String hospitalId;

    private String name;
    private Integer age;
    private String sex;
}
