package com.controlactas.service.parsing;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Reads cell contents the way the certificate sheets need them. Formula cells are read
 * from the value cached by the spreadsheet application, never re-evaluated.
 */
final class CellValues {

    private CellValues() {}

    static Cell cell(Sheet sheet, int rowIndex, int columnIndex) {
        Row row = sheet.getRow(rowIndex);
        return row == null ? null : row.getCell(columnIndex);
    }

    static boolean isEmpty(Cell cell) {
        CellType type = effectiveType(cell);
        return type == CellType.BLANK
                || type == CellType.ERROR
                || (type == CellType.STRING && cell.getStringCellValue().isBlank());
    }

    /**
     * Text content, trimmed. Numbers are rendered without a trailing ".0".
     */
    static String text(Cell cell) {
        switch (effectiveType(cell)) {
            case STRING:
                return cell.getStringCellValue().trim();
            case NUMERIC:
                return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
            case BOOLEAN:
                return cell.getBooleanCellValue() ? "TRUE" : "FALSE";
            default:
                return "";
        }
    }

    /**
     * Monetary value: currency symbols and thousands separators are stripped from text cells.
     */
    static Optional<BigDecimal> amount(Cell cell) {
        return number(cell, true);
    }

    static Optional<BigDecimal> quantity(Cell cell) {
        return number(cell, false);
    }

    private static Optional<BigDecimal> number(Cell cell, boolean stripCurrency) {
        switch (effectiveType(cell)) {
            case NUMERIC:
                double value = cell.getNumericCellValue();
                if (Double.isNaN(value) || Double.isInfinite(value)) {
                    return Optional.empty();
                }
                return Optional.of(BigDecimal.valueOf(value));
            case STRING:
                String s = cell.getStringCellValue();
                if (stripCurrency) {
                    s = s.replace("$", "").replace(",", "");
                }
                return parse(s.trim());
            default:
                return Optional.empty();
        }
    }

    private static Optional<BigDecimal> parse(String s) {
        if (s.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(s));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static CellType effectiveType(Cell cell) {
        if (cell == null) {
            return CellType.BLANK;
        }
        CellType type = cell.getCellType();
        return type == CellType.FORMULA ? cell.getCachedFormulaResultType() : type;
    }
}
