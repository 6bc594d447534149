package com.NutriCare.diet_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PatientSummary {
    private Long id;
    private String hospitalId;
    private String name;
    private Integer age;
    private String sex;
}
