package com.NutriCare.diet_backend.service;

import com.NutriCare.diet_backend.dto.request.FoodRecord;
import com.NutriCare.diet_backend.dto.request.RdaProfileRecord;
import com.NutriCare.diet_backend.dto.response.CatalogUpsertResult;
import com.NutriCare.diet_backend.dto.response.IngestionReport;
import com.NutriCare.diet_backend.exception.ApiException;
import com.NutriCare.diet_backend.exception.SchemaException;
import com.NutriCare.diet_backend.util.Constants;
import com.NutriCare.diet_backend.util.FileUploadUtil;
import com.NutriCare.diet_backend.util.NutrientKeys;
import com.NutriCare.diet_backend.util.SpreadsheetReader;
import com.NutriCare.diet_backend.util.TabularSheet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns an uploaded foods or RDA workbook into catalog records and hands them to
 * {@link CatalogService} as one batch.
 * <p>
 * The identity column ({@code FoodName} / {@code ProfileName}) is required, and so is at least
 * one nutrient column; every other non-blank header is a nutrient. Empty or non-numeric
 * nutrient cells are recorded as unknown, never as zero. A row with no name is skipped and
 * reported; it does not fail the upload.
 */
@Service
@Slf4j
public class CatalogIngestionService {

    static final String FOODS_SHEET = "foods";
    static final String RDA_SHEET = "RDA";

    private final CatalogService catalogService;
    private final SpreadsheetReader spreadsheetReader;
    private final long maxFileSizeMb;

    public CatalogIngestionService(CatalogService catalogService,
                                   SpreadsheetReader spreadsheetReader,
                                   @Value("${app.upload.max-file-size-mb:10}") long maxFileSizeMb) {
        this.catalogService = catalogService;
        this.spreadsheetReader = spreadsheetReader;
        this.maxFileSizeMb = maxFileSizeMb;
    }

    public IngestionReport ingestFoods(MultipartFile file) {
        FileUploadUtil.requireSpreadsheet(file, maxFileSizeMb);
        TabularSheet sheet = readWorkbook(file);

        RowOutcome outcome = new RowOutcome();
        ColumnLayout layout = ColumnLayout.resolve(sheet.getHeaders(), Constants.FOOD_NAME_COLUMN,
                Constants.SERVING_SIZE_COLUMN);
        layout.dropTextColumns(sheet.getRows(), outcome.warnings);
        layout.requireComplete(FOODS_SHEET, Constants.FOOD_NAME_COLUMN);

        Map<String, FoodRecord> records = new LinkedHashMap<>();
        for (TabularSheet.Row row : sheet.getRows()) {
            String name = identityOf(row, layout, outcome, Constants.FOOD_NAME_COLUMN);
            if (name == null) {
                continue;
            }
            String servingSize = layout.optionalIndex < 0
                    ? null
                    : NutrientKeys.displayName(SpreadsheetReader.asText(row.cell(layout.optionalIndex)));
            FoodRecord record = FoodRecord.builder()
                    .name(name)
                    .servingSize(servingSize == null || servingSize.isEmpty() ? null : servingSize)
                    .nutrients(readAmounts(row, layout, name, outcome))
                    .build();
            putLastWins(records, name, record, row, outcome);
        }

        CatalogUpsertResult result = records.isEmpty()
                ? null
                : catalogService.upsertFoods(new ArrayList<>(records.values()));
        return finish(file, FOODS_SHEET, layout, outcome, result, records.size());
    }

    public IngestionReport ingestRdaProfiles(MultipartFile file) {
        FileUploadUtil.requireSpreadsheet(file, maxFileSizeMb);
        TabularSheet sheet = readWorkbook(file);

        RowOutcome outcome = new RowOutcome();
        ColumnLayout layout = ColumnLayout.resolve(sheet.getHeaders(), Constants.PROFILE_NAME_COLUMN, null);
        layout.dropTextColumns(sheet.getRows(), outcome.warnings);
        layout.requireComplete(RDA_SHEET, Constants.PROFILE_NAME_COLUMN);

        Map<String, RdaProfileRecord> records = new LinkedHashMap<>();
        for (TabularSheet.Row row : sheet.getRows()) {
            String name = identityOf(row, layout, outcome, Constants.PROFILE_NAME_COLUMN);
            if (name == null) {
                continue;
            }
            RdaProfileRecord record = RdaProfileRecord.builder()
                    .name(name)
                    .targets(readAmounts(row, layout, name, outcome))
                    .build();
            putLastWins(records, name, record, row, outcome);
        }

        CatalogUpsertResult result = records.isEmpty()
                ? null
                : catalogService.upsertRdaProfiles(new ArrayList<>(records.values()));
        return finish(file, RDA_SHEET, layout, outcome, result, records.size());
    }

    private TabularSheet readWorkbook(MultipartFile file) {
        try (InputStream in = file.getInputStream()) {
            return spreadsheetReader.read(in);
        } catch (IOException e) {
            throw new ApiException("Could not read uploaded file", HttpStatus.BAD_REQUEST, "UNREADABLE_FILE", e);
        }
    }

    private String identityOf(TabularSheet.Row row, ColumnLayout layout, RowOutcome outcome, String column) {
        if (row.isOverflowing()) {
            outcome.warnings.add("Row " + row.getRowNumber() + " has more cells than header columns; extra cells ignored");
        }
        String name = NutrientKeys.displayName(SpreadsheetReader.asText(row.cell(layout.identityIndex)));
        if (name == null || name.isEmpty()) {
            log.warn("Skipping row {}: empty {}", row.getRowNumber(), column);
            outcome.skipped.add(IngestionReport.SkippedRow.builder()
                    .rowNumber(row.getRowNumber())
                    .reason("Empty " + column)
                    .build());
            return null;
        }
        return name;
    }

    private Map<String, Double> readAmounts(TabularSheet.Row row, ColumnLayout layout, String owner,
                                            RowOutcome outcome) {
        Map<String, Double> amounts = new HashMap<>();
        for (Map.Entry<String, Integer> column : layout.nutrientColumns.entrySet()) {
            Object cell = row.cell(column.getValue());
            if (cell == null) {
                continue;
            }
            Double amount = toAmount(cell);
            if (amount == null) {
                outcome.warnings.add(String.format("Row %d (%s): %s value '%s' is not a valid amount; recorded as unknown",
                        row.getRowNumber(), owner, column.getKey(), SpreadsheetReader.asText(cell)));
                continue;
            }
            amounts.put(column.getKey(), amount);
        }
        return amounts;
    }

    private <T> void putLastWins(Map<String, T> records, String name, T record, TabularSheet.Row row,
                                 RowOutcome outcome) {
        String key = NutrientKeys.catalogKey(name);
        if (records.remove(key) != null) {
            outcome.warnings.add("Row " + row.getRowNumber() + " repeats '" + name + "'; the later row is kept");
        }
        records.put(key, record);
    }

    private IngestionReport finish(MultipartFile file, String sheetKind, ColumnLayout layout, RowOutcome outcome,
                                   CatalogUpsertResult result, int processed) {
        int created = result == null ? 0 : result.getCreated();
        int updated = result == null ? 0 : result.getUpdated();
        log.info("Ingested {} sheet '{}': {} processed ({} created, {} updated), {} skipped, {} warnings",
                sheetKind, file.getOriginalFilename(), processed, created, updated,
                outcome.skipped.size(), outcome.warnings.size());

        return IngestionReport.builder()
                .fileName(file.getOriginalFilename())
                .sheetKind(sheetKind)
                .nutrientColumns(new ArrayList<>(layout.nutrientColumns.keySet()))
                .processedCount(processed)
                .createdCount(created)
                .updatedCount(updated)
                .skippedCount(outcome.skipped.size())
                .skippedRows(outcome.skipped)
                .warnings(outcome.warnings)
                .build();
    }

    /**
     * Numeric cells pass through; text cells are parsed leniently ("1,200", " 3.5 ").
     * Returns null for anything that is not a finite, non-negative number.
     */
    static Double toAmount(Object cell) {
        Double value = null;
        if (cell instanceof Double) {
            value = (Double) cell;
        } else if (cell != null) {
            String text = cell.toString().trim().replace(",", "");
            if (!text.isEmpty()) {
                try {
                    value = Double.parseDouble(text);
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        }
        if (value == null || value.isNaN() || value.isInfinite() || value < 0) {
            return null;
        }
        return value;
    }

    // Header matching ignores case, spaces and underscores: "Food Name", "food_name", "FOODNAME".
    static String headerKey(String header) {
        return header == null ? "" : header.replaceAll("[\\s_]", "").toLowerCase(Locale.ROOT);
    }

    private static class RowOutcome {
        private final List<IngestionReport.SkippedRow> skipped = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
    }

    private static class ColumnLayout {
        private int identityIndex = -1;
        private int optionalIndex = -1;
        // nutrient display name -> column index, in sheet order
        private final Map<String, Integer> nutrientColumns = new LinkedHashMap<>();

        static ColumnLayout resolve(List<String> headers, String identityColumn, String optionalColumn) {
            ColumnLayout layout = new ColumnLayout();
            Set<String> seenNutrients = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
            for (int i = 0; i < headers.size(); i++) {
                String header = headers.get(i);
                if (header == null || header.isEmpty()) {
                    continue;
                }
                String key = headerKey(header);
                if (key.equals(headerKey(identityColumn))) {
                    if (layout.identityIndex < 0) {
                        layout.identityIndex = i;
                    }
                } else if (optionalColumn != null && key.equals(headerKey(optionalColumn))) {
                    if (layout.optionalIndex < 0) {
                        layout.optionalIndex = i;
                    }
                } else if (seenNutrients.add(header)) {
                    layout.nutrientColumns.put(header, i);
                }
            }
            return layout;
        }

        /**
         * Removes columns that hold values but not a single amount, such as "Notes" or "Category".
         * A column with no values at all stays: it names a nutrient that is unknown for every row.
         */
        void dropTextColumns(List<TabularSheet.Row> rows, List<String> warnings) {
            Iterator<Map.Entry<String, Integer>> columns = nutrientColumns.entrySet().iterator();
            while (columns.hasNext()) {
                Map.Entry<String, Integer> column = columns.next();
                boolean hasValue = false;
                boolean hasAmount = false;
                for (TabularSheet.Row row : rows) {
                    Object cell = row.cell(column.getValue());
                    if (cell == null) {
                        continue;
                    }
                    hasValue = true;
                    if (toAmount(cell) != null) {
                        hasAmount = true;
                        break;
                    }
                }
                if (hasValue && !hasAmount) {
                    log.warn("Ignoring column '{}': no numeric values", column.getKey());
                    warnings.add("Column '" + column.getKey() + "' has no numeric values; ignored");
                    columns.remove();
                }
            }
        }

        void requireComplete(String sheetKind, String identityColumn) {
            List<String> missing = new ArrayList<>();
            if (identityIndex < 0) {
                missing.add(identityColumn);
            }
            if (nutrientColumns.isEmpty()) {
                missing.add(Constants.NUTRIENT_COLUMN_PLACEHOLDER);
            }
            if (!missing.isEmpty()) {
                throw new SchemaException(sheetKind, missing);
            }
        }
    }
}
