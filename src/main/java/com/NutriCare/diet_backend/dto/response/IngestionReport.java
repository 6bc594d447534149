package com.NutriCare.diet_backend.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionReport {
    private String fileName;
    private String sheetKind;
    private List<String> nutrientColumns;
    private int processedCount;
    private int createdCount;
    private int updatedCount;
    private int skippedCount;
    private List<SkippedRow> skippedRows;
    private List<String> warnings;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SkippedRow {
        private int rowNumber;
        private String reason;
    }
}
