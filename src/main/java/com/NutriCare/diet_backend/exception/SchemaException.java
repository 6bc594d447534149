package com.NutriCare.diet_backend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.List;
import java.util.Map;

/**
 * Raised when an uploaded sheet lacks the columns needed to build catalog records.
 * Nothing from the offending upload is written.
 */
@Getter
public class SchemaException extends ApiException {
    private final List<String> missingColumns;

    public SchemaException(String sheetKind, List<String> missingColumns) {
        super(String.format("Missing required columns in %s sheet: %s", sheetKind, String.join(", ", missingColumns)),
                HttpStatus.BAD_REQUEST,
                "SCHEMA_ERROR");
        this.missingColumns = List.copyOf(missingColumns);
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("missingColumns", missingColumns);
    }
}
