package com.controlactas.service.output;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;

import java.math.BigDecimal;
import java.util.List;

/**
 * Appends a header and plain value rows to a sheet, top to bottom.
 */
public final class SheetWriter {

    private static final int COLUMN_WIDTH = 18 * 256;

    private final Sheet sheet;
    private final CellStyle headerStyle;
    private int nextRow;

    private SheetWriter(Sheet sheet, CellStyle headerStyle) {
        this.sheet = sheet;
        this.headerStyle = headerStyle;
    }

    /**
     * Creates the sheet, replacing one with the same name.
     */
    public static SheetWriter create(Workbook workbook, String name) {
        int existing = workbook.getSheetIndex(name);
        if (existing >= 0) {
            workbook.removeSheetAt(existing);
        }
        Sheet sheet = workbook.createSheet(name);
        Font bold = workbook.createFont();
        bold.setBold(true);
        CellStyle headerStyle = workbook.createCellStyle();
        headerStyle.setFont(bold);
        return new SheetWriter(sheet, headerStyle);
    }

    public SheetWriter header(List<String> names) {
        Row row = sheet.createRow(nextRow++);
        for (int i = 0; i < names.size(); i++) {
            Cell cell = row.createCell(i);
            cell.setCellValue(names.get(i));
            cell.setCellStyle(headerStyle);
            sheet.setColumnWidth(i, COLUMN_WIDTH);
        }
        return this;
    }

    public SheetWriter row(List<?> values) {
        Row row = sheet.createRow(nextRow++);
        for (int i = 0; i < values.size(); i++) {
            setValue(row.createCell(i), values.get(i));
        }
        return this;
    }

    static void setValue(Cell cell, Object value) {
        if (value == null) {
            cell.setBlank();
        } else if (value instanceof BigDecimal decimal) {
            cell.setCellValue(decimal.doubleValue());
        } else if (value instanceof Number number) {
            cell.setCellValue(number.doubleValue());
        } else {
            cell.setCellValue(value.toString());
        }
    }
}
