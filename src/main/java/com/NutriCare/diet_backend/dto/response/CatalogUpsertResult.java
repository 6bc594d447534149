package com.NutriCare.diet_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CatalogUpsertResult {
    private int created;
    private int updated;

    public int getTotal() {
        return created + updated;
    }
}
