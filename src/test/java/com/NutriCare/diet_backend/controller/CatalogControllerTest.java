package com.NutriCare.diet_backend.controller;

import com.NutriCare.diet_backend.dto.response.IngestionReport;
import com.NutriCare.diet_backend.exception.GlobalExceptionHandler;
import com.NutriCare.diet_backend.exception.ResourceNotFoundException;
import com.NutriCare.diet_backend.exception.SchemaException;
import com.NutriCare.diet_backend.service.CatalogIngestionService;
import com.NutriCare.diet_backend.service.CatalogService;
import com.NutriCare.diet_backend.util.Constants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CatalogControllerTest {

    @Mock
    private CatalogService catalogService;
    @Mock
    private CatalogIngestionService catalogIngestionService;

    @InjectMocks
    private CatalogController controller;

    private MockMvc mockMvc;

    private final MockMultipartFile foodsFile = new MockMultipartFile("file", "foods.xlsx",
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", new byte[]{1, 2, 3});

    @BeforeEach
    void setup() {
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void uploadReturnsIngestionCounts() throws Exception {
        when(catalogIngestionService.ingestFoods(any())).thenReturn(IngestionReport.builder()
                .fileName("foods.xlsx")
                .sheetKind("foods")
                .nutrientColumns(List.of("Calories", "Protein"))
                .processedCount(2)
                .createdCount(2)
                .skippedCount(1)
                .skippedRows(List.of(new IngestionReport.SkippedRow(4, "Empty FoodName")))
                .warnings(List.of())
                .build());

        mockMvc.perform(multipart("/api/catalog/foods/upload").file(foodsFile))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value(Constants.SUCCESS_FOODS_UPLOADED))
                .andExpect(jsonPath("$.data.createdCount").value(2))
                .andExpect(jsonPath("$.data.skippedRows[0].rowNumber").value(4));
    }

    @Test
    void missingColumnsAreListedInErrorBody() throws Exception {
        when(catalogIngestionService.ingestRdaProfiles(any()))
                .thenThrow(new SchemaException("RDA", List.of("ProfileName")));

        mockMvc.perform(multipart("/api/catalog/rda-profiles/upload").file(foodsFile))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("SCHEMA_ERROR"))
                .andExpect(jsonPath("$.details.missingColumns[0]").value("ProfileName"));
    }

    @Test
    void uploadWithoutFilePartIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/catalog/foods/upload"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_PARAMETER"));
    }

    @Test
    void emptyCatalogListingIsNotFound() throws Exception {
        when(catalogService.listFoods())
                .thenThrow(new ResourceNotFoundException(Constants.ERROR_NO_FOODS, "CATALOG_EMPTY"));

        mockMvc.perform(get("/api/catalog/foods"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("CATALOG_EMPTY"))
                .andExpect(jsonPath("$.message").value(Constants.ERROR_NO_FOODS));
    }
}
