package com.controlactas.service.output;

import com.controlactas.model.Category;
import com.controlactas.model.CellAnnotation;
import com.controlactas.model.Deviation;
import com.controlactas.service.parsing.ParsedCertificate;
import com.controlactas.service.reconciliation.CertificateReconciliation;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the verified copy of a certificate: deviating unit prices coloured
 * (red overpaid, blue underpaid) and a CUADRO_CANTIDADES sheet with the quantities
 * of each family and a TOTAL row.
 */
@Component
@Slf4j
public class VerifiedWorkbookWriter {

    public static final String QUANTITIES_SHEET = "CUADRO_CANTIDADES";
    static final String SUFFIX = "_verificado.xlsx";

    public Path write(ParsedCertificate certificate, CertificateReconciliation reconciliation, Path outputDir)
            throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(outputName(certificate.sourceFile()));

        try (InputStream in = Files.newInputStream(certificate.path());
             Workbook workbook = WorkbookFactory.create(in)) {
            Sheet sheet = workbook.getSheet(certificate.sheetName());
            if (sheet == null) {
                throw new IOException("Sheet '" + certificate.sheetName() + "' vanished from " + certificate.sourceFile());
            }
            applyAnnotations(workbook, sheet, reconciliation.annotations());
            writeQuantitySheet(workbook, reconciliation.categoryQuantities());
            workbook.setForceFormulaRecalculation(true);

            try (OutputStream out = Files.newOutputStream(target)) {
                workbook.write(out);
            }
        }
        log.debug("Wrote {} ({} annotated cells)", target.getFileName(), reconciliation.annotations().size());
        return target;
    }

    static String outputName(String sourceFile) {
        String lower = sourceFile.toLowerCase(Locale.ROOT);
        String stem = lower.endsWith(".xlsx") ? sourceFile.substring(0, sourceFile.length() - 5) : sourceFile;
        return stem + SUFFIX;
    }

    private void applyAnnotations(Workbook workbook, Sheet sheet, List<CellAnnotation> annotations) {
        // one derived style per (original style, deviation)
        Map<String, CellStyle> styles = new HashMap<>();
        for (CellAnnotation annotation : annotations) {
            Row row = sheet.getRow(annotation.rowIndex());
            if (row == null) {
                row = sheet.createRow(annotation.rowIndex());
            }
            Cell cell = row.getCell(annotation.columnIndex(), Row.MissingCellPolicy.CREATE_NULL_AS_BLANK);
            CellStyle base = cell.getCellStyle();
            String key = base.getIndex() + ":" + annotation.deviation();
            cell.setCellStyle(styles.computeIfAbsent(key, k -> coloured(workbook, base, annotation.deviation())));
        }
    }

    private static CellStyle coloured(Workbook workbook, CellStyle base, Deviation deviation) {
        Font baseFont = workbook.getFontAt(base.getFontIndex());
        Font font = workbook.createFont();
        font.setFontName(baseFont.getFontName());
        font.setFontHeightInPoints(baseFont.getFontHeightInPoints());
        font.setBold(baseFont.getBold());
        font.setItalic(baseFont.getItalic());
        if (font instanceof XSSFFont xssfFont) {
            xssfFont.setColor(new XSSFColor(HexFormat.of().parseHex(deviation.argbColor()), null));
        } else {
            font.setColor(deviation == Deviation.OVERPAID ? IndexedColors.RED.getIndex() : IndexedColors.BLUE.getIndex());
        }
        CellStyle style = workbook.createCellStyle();
        style.cloneStyleFrom(base);
        style.setFont(font);
        return style;
    }

    private static void writeQuantitySheet(Workbook workbook, Map<Category, List<BigDecimal>> quantities) {
        int existing = workbook.getSheetIndex(QUANTITIES_SHEET);
        if (existing >= 0) {
            workbook.removeSheetAt(existing);
        }
        Sheet sheet = workbook.createSheet(QUANTITIES_SHEET);
        Category[] categories = Category.values();

        Row header = sheet.createRow(0);
        int longest = 0;
        for (int i = 0; i < categories.length; i++) {
            header.createCell(i + 1).setCellValue(categories[i].label());
            longest = Math.max(longest, quantities.getOrDefault(categories[i], List.of()).size());
        }

        for (int i = 0; i < categories.length; i++) {
            List<BigDecimal> values = quantities.getOrDefault(categories[i], List.of());
            for (int r = 0; r < values.size(); r++) {
                Row row = sheet.getRow(r + 1);
                if (row == null) {
                    row = sheet.createRow(r + 1);
                }
                row.createCell(i + 1).setCellValue(values.get(r).doubleValue());
            }
        }

        int totalRowIndex = longest + 1;
        Row total = sheet.createRow(totalRowIndex);
        total.createCell(0).setCellValue("TOTAL");
        for (int i = 0; i < categories.length; i++) {
            Cell cell = total.createCell(i + 1);
            if (longest > 0) {
                String column = CellReference.convertNumToColString(i + 1);
                // data occupies sheet rows 2..totalRowIndex (one based)
                cell.setCellFormula("SUM(" + column + "2:" + column + totalRowIndex + ")");
            } else {
                cell.setCellValue(0);
            }
        }
    }
}
