package com.NutriCare.diet_backend.service;

import com.NutriCare.diet_backend.dto.request.FoodRecord;
import com.NutriCare.diet_backend.dto.request.RdaProfileRecord;
import com.NutriCare.diet_backend.dto.response.CatalogUpsertResult;
import com.NutriCare.diet_backend.dto.response.IngestionReport;
import com.NutriCare.diet_backend.exception.ApiException;
import com.NutriCare.diet_backend.exception.SchemaException;
import com.NutriCare.diet_backend.util.SpreadsheetReader;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.mock.web.MockMultipartFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CatalogIngestionServiceTest {

    private static final String XLSX = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    @Mock
    private CatalogService catalogService;

    private CatalogIngestionService ingestionService;

    @BeforeEach
    void setup() {
        ingestionService = new CatalogIngestionService(catalogService, new SpreadsheetReader(), 10);
        when(catalogService.upsertFoods(any())).thenAnswer(invocation ->
                new CatalogUpsertResult(((List<?>) invocation.getArgument(0)).size(), 0));
        when(catalogService.upsertRdaProfiles(any())).thenAnswer(invocation ->
                new CatalogUpsertResult(((List<?>) invocation.getArgument(0)).size(), 0));
    }

    @Test
    void readsFoodsAndKeepsBlankCellsUnknown() throws IOException {
        MockMultipartFile file = workbook("foods.xlsx",
                new Object[]{"FoodName", "ServingSize", "Calories", "Protein", "Fiber"},
                new Object[]{"Rice", "1 cup", 200, 4, null},
                new Object[]{"Dal", "1 bowl", 150, 9, 3});

        IngestionReport report = ingestionService.ingestFoods(file);

        List<FoodRecord> records = capturedFoods();
        assertEquals(2, records.size());
        FoodRecord rice = records.get(0);
        assertEquals("Rice", rice.getName());
        assertEquals("1 cup", rice.getServingSize());
        assertEquals(200.0, rice.getNutrients().get("Calories"));
        assertFalse(rice.getNutrients().containsKey("Fiber"));
        assertEquals(3.0, records.get(1).getNutrients().get("Fiber"));

        assertEquals(2, report.getProcessedCount());
        assertEquals(2, report.getCreatedCount());
        assertEquals(0, report.getSkippedCount());
        assertEquals(List.of("Calories", "Protein", "Fiber"), report.getNutrientColumns());
    }

    @Test
    void nonNumericAndNegativeCellsBecomeUnknownWithWarning() throws IOException {
        MockMultipartFile file = workbook("foods.xlsx",
                new Object[]{"FoodName", "Calories", "Protein"},
                new Object[]{"Curd", "n/a", -2},
                new Object[]{"Idli", "1,200", 2});

        IngestionReport report = ingestionService.ingestFoods(file);

        List<FoodRecord> records = capturedFoods();
        assertTrue(records.get(0).getNutrients().isEmpty());
        assertEquals(1200.0, records.get(1).getNutrients().get("Calories"));
        assertEquals(2, report.getWarnings().size());
    }

    @Test
    void rowsWithoutNameAreSkippedNotFatal() throws IOException {
        MockMultipartFile file = workbook("foods.xlsx",
                new Object[]{"FoodName", "Calories"},
                new Object[]{"Rice", 200},
                new Object[]{null, 120},
                new Object[]{"  ", 80});

        IngestionReport report = ingestionService.ingestFoods(file);

        assertEquals(1, report.getProcessedCount());
        assertEquals(2, report.getSkippedCount());
        assertEquals(3, report.getSkippedRows().get(0).getRowNumber());
        assertEquals(1, capturedFoods().size());
    }

    @Test
    void extraCellsBeyondHeaderAreReportedAndIgnored() throws IOException {
        MockMultipartFile file = workbook("foods.xlsx",
                new Object[]{"FoodName", "Calories"},
                new Object[]{"Rice", 200, 999});

        IngestionReport report = ingestionService.ingestFoods(file);

        assertEquals(1, report.getProcessedCount());
        assertEquals(1, report.getWarnings().size());
        assertEquals(1, capturedFoods().get(0).getNutrients().size());
    }

    @Test
    void freeTextColumnsAreNotTreatedAsNutrients() throws IOException {
        MockMultipartFile file = workbook("foods.xlsx",
                new Object[]{"FoodName", "Category", "Calories", "Notes", "Iron"},
                new Object[]{"Rice", "Grain", 200, "staple", null},
                new Object[]{"Dal", "Pulse", 150, null, null});

        IngestionReport report = ingestionService.ingestFoods(file);

        assertEquals(List.of("Calories", "Iron"), report.getNutrientColumns());
        assertEquals(List.of("Column 'Category' has no numeric values; ignored",
                "Column 'Notes' has no numeric values; ignored"), report.getWarnings());
        FoodRecord rice = capturedFoods().get(0);
        assertEquals(1, rice.getNutrients().size());
        assertEquals(200.0, rice.getNutrients().get("Calories"));
    }

    @Test
    void sheetWithOnlyTextColumnsIsSchemaError() throws IOException {
        MockMultipartFile file = workbook("foods.xlsx",
                new Object[]{"FoodName", "Notes"},
                new Object[]{"Rice", "staple"});

        SchemaException ex = assertThrows(SchemaException.class, () -> ingestionService.ingestFoods(file));
        assertEquals(1, ex.getMissingColumns().size());
        verify(catalogService, never()).upsertFoods(any());
    }

    @Test
    void servingSizeColumnIsOptional() throws IOException {
        MockMultipartFile file = workbook("foods.xlsx",
                new Object[]{"Food Name", "Calories"},
                new Object[]{"Rice", 200});

        ingestionService.ingestFoods(file);

        assertNull(capturedFoods().get(0).getServingSize());
    }

    @Test
    void laterDuplicateRowWins() throws IOException {
        MockMultipartFile file = workbook("foods.xlsx",
                new Object[]{"FoodName", "Calories"},
                new Object[]{"Rice", 200},
                new Object[]{"RICE", 210});

        IngestionReport report = ingestionService.ingestFoods(file);

        List<FoodRecord> records = capturedFoods();
        assertEquals(1, records.size());
        assertEquals(210.0, records.get(0).getNutrients().get("Calories"));
        assertEquals(1, report.getWarnings().size());
    }

    @Test
    void missingFoodNameColumnIsSchemaError() throws IOException {
        MockMultipartFile file = workbook("foods.xlsx",
                new Object[]{"Dish", "Calories"},
                new Object[]{"Rice", 200});

        SchemaException ex = assertThrows(SchemaException.class, () -> ingestionService.ingestFoods(file));
        assertEquals(List.of("FoodName"), ex.getMissingColumns());
        verify(catalogService, never()).upsertFoods(any());
    }

    @Test
    void sheetWithoutNutrientColumnsIsSchemaError() throws IOException {
        MockMultipartFile file = workbook("foods.xlsx",
                new Object[]{"FoodName", "ServingSize"},
                new Object[]{"Rice", "1 cup"});

        SchemaException ex = assertThrows(SchemaException.class, () -> ingestionService.ingestFoods(file));
        assertEquals(1, ex.getMissingColumns().size());
        assertEquals("SCHEMA_ERROR", ex.getErrorCode());
    }

    @Test
    void readsRdaProfiles() throws IOException {
        MockMultipartFile file = workbook("rda.xlsx",
                new Object[]{"ProfileName", "Calories", "Protein"},
                new Object[]{"Adult-Male", 2000, 50});

        IngestionReport report = ingestionService.ingestRdaProfiles(file);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<RdaProfileRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(catalogService).upsertRdaProfiles(captor.capture());
        RdaProfileRecord profile = captor.getValue().get(0);
        assertEquals("Adult-Male", profile.getName());
        assertEquals(50.0, profile.getTargets().get("Protein"));
        assertEquals("RDA", report.getSheetKind());
    }

    @Test
    void rdaSheetWithoutProfileNameIsSchemaError() throws IOException {
        MockMultipartFile file = workbook("rda.xlsx",
                new Object[]{"FoodName", "Calories"},
                new Object[]{"Adult-Male", 2000});

        SchemaException ex = assertThrows(SchemaException.class, () -> ingestionService.ingestRdaProfiles(file));
        assertEquals(List.of("ProfileName"), ex.getMissingColumns());
    }

    @Test
    void rejectsNonExcelAndEmptyUploads() {
        MockMultipartFile csv = new MockMultipartFile("file", "foods.csv", "text/csv", "FoodName,Calories".getBytes());
        ApiException wrongType = assertThrows(ApiException.class, () -> ingestionService.ingestFoods(csv));
        assertEquals("INVALID_FILE_TYPE", wrongType.getErrorCode());

        MockMultipartFile empty = new MockMultipartFile("file", "foods.xlsx", XLSX, new byte[0]);
        ApiException emptyFile = assertThrows(ApiException.class, () -> ingestionService.ingestFoods(empty));
        assertEquals("EMPTY_FILE", emptyFile.getErrorCode());
    }

    @Test
    void rejectsCorruptWorkbook() {
        MockMultipartFile corrupt = new MockMultipartFile("file", "foods.xlsx", XLSX, "not a workbook".getBytes());
        ApiException ex = assertThrows(ApiException.class, () -> ingestionService.ingestFoods(corrupt));
        assertEquals("UNREADABLE_FILE", ex.getErrorCode());
    }

    @SuppressWarnings("unchecked")
    private List<FoodRecord> capturedFoods() {
        ArgumentCaptor<List<FoodRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(catalogService).upsertFoods(captor.capture());
        return captor.getValue();
    }

    private MockMultipartFile workbook(String fileName, Object[]... rows) throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet("Sheet1");
            for (int r = 0; r < rows.length; r++) {
                Row row = sheet.createRow(r);
                for (int c = 0; c < rows[r].length; c++) {
                    Object value = rows[r][c];
                    if (value instanceof Number) {
                        row.createCell(c).setCellValue(((Number) value).doubleValue());
                    } else if (value != null) {
                        row.createCell(c).setCellValue(value.toString());
                    }
                }
            }
            workbook.write(out);
            return new MockMultipartFile("file", fileName, XLSX, out.toByteArray());
        }
    }
}
