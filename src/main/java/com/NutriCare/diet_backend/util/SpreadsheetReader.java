package com.NutriCare.diet_backend.util;

import com.NutriCare.diet_backend.exception.ApiException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
public class SpreadsheetReader {

    private final DataFormatter formatter = new DataFormatter();

    public TabularSheet read(InputStream inputStream) {
        try (Workbook workbook = WorkbookFactory.create(inputStream)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new ApiException("Workbook contains no sheets", HttpStatus.BAD_REQUEST, "EMPTY_FILE");
            }
            return readSheet(workbook.getSheetAt(0));
        } catch (IOException | EncryptedDocumentException | UnsupportedFileFormatException e) {
            log.warn("Failed to read workbook: {}", e.getMessage());
            throw new ApiException("Uploaded file is not a readable Excel workbook",
                    HttpStatus.BAD_REQUEST, "UNREADABLE_FILE", e);
        }
    }

    private TabularSheet readSheet(Sheet sheet) {
        int headerIndex = -1;
        List<String> headers = new ArrayList<>();
        for (int r = Math.max(0, sheet.getFirstRowNum()); r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            List<Object> cells = readCells(row);
            if (!isBlank(cells)) {
                headerIndex = r;
                for (Object cell : cells) {
                    headers.add(cell == null ? "" : NutrientKeys.displayName(asText(cell)));
                }
                break;
            }
        }

        if (headerIndex < 0) {
            throw new ApiException("Sheet '" + sheet.getSheetName() + "' has no header row",
                    HttpStatus.BAD_REQUEST, "EMPTY_FILE");
        }

        int width = trimmedWidth(headers);
        List<String> trimmedHeaders = new ArrayList<>(headers.subList(0, width));
        List<TabularSheet.Row> rows = new ArrayList<>();
        for (int r = headerIndex + 1; r <= sheet.getLastRowNum(); r++) {
            List<Object> cells = readCells(sheet.getRow(r));
            if (isBlank(cells)) {
                continue;
            }
            boolean overflowing = false;
            for (int c = width; c < cells.size(); c++) {
                if (cells.get(c) != null) {
                    overflowing = true;
                    break;
                }
            }
            List<Object> inWidth = new ArrayList<>(cells.subList(0, Math.min(width, cells.size())));
            rows.add(new TabularSheet.Row(r + 1, inWidth, overflowing));
        }

        log.debug("Read sheet '{}': {} columns, {} data rows", sheet.getSheetName(), width, rows.size());
        return new TabularSheet(trimmedHeaders, rows);
    }

    private List<Object> readCells(Row row) {
        List<Object> cells = new ArrayList<>();
        if (row == null || row.getLastCellNum() < 0) {
            return cells;
        }
        for (int c = 0; c < row.getLastCellNum(); c++) {
            cells.add(readCell(row.getCell(c)));
        }
        return cells;
    }

    private Object readCell(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case NUMERIC:
                if (org.apache.poi.ss.usermodel.DateUtil.isCellDateFormatted(cell)) {
                    return formatter.formatCellValue(cell);
                }
                return cell.getNumericCellValue();
            case STRING:
                String text = cell.getStringCellValue();
                return text == null || text.trim().isEmpty() ? null : text;
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                // BLANK, ERROR
                return null;
        }
    }

    private boolean isBlank(List<Object> cells) {
        for (Object cell : cells) {
            if (cell != null) {
                return false;
            }
        }
        return true;
    }

    private int trimmedWidth(List<String> headers) {
        int width = headers.size();
        while (width > 0 && headers.get(width - 1).isEmpty()) {
            width--;
        }
        return width;
    }

    /**
     * Text form of a cell; whole numbers lose their ".0" so a numeric food code reads "101".
     */
    public static String asText(Object cell) {
        if (cell == null) {
            return null;
        }
        if (cell instanceof Double) {
            double value = (Double) cell;
            if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
                return String.valueOf((long) value);
            }
            return String.valueOf(value);
        }
        return cell.toString();
    }
}
