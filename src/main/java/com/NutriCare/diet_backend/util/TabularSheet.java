package com.NutriCare.diet_backend.util;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * First sheet of an uploaded workbook: the header row plus every non-blank data row.
 * Cell values are {@code String}, {@code Double} or {@code null} for a blank cell.
 */
@Getter
@AllArgsConstructor
public class TabularSheet {

    private final List<String> headers;
    private final List<Row> rows;

    @Getter
    @AllArgsConstructor
    public static class Row {
        // 1-based, as shown in the spreadsheet application
        private final int rowNumber;
        private final List<Object> cells;
        private final boolean overflowing;

        public Object cell(int columnIndex) {
            return columnIndex < cells.size() ? cells.get(columnIndex) : null;
        }
    }
}
