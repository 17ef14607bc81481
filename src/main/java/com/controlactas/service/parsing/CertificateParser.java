package com.controlactas.service.parsing;

import com.controlactas.model.FailureKind;
import com.controlactas.model.LineItem;
import com.controlactas.service.text.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads the CORTE sheet of a payment certificate into line items.
 *
 * Layout: contractor name in C6 (or D6), two header rows at 8 and 9, data from row 10,
 * declared quantity in column I. Labor rows and rows without a usable price or quantity
 * are dropped from the line items, so the engine only ever sees complete items. Rows with
 * a usable quantity are also kept, unfiltered, as quantity rows.
 */
@Component
@Slf4j
public class CertificateParser {

    static final String SHEET_NAME = "CORTE";
    static final String DEFAULT_CONTRACTOR = "SIN NOMBRE";

    // zero based sheet coordinates
    static final int CONTRACTOR_ROW = 5;
    static final int CONTRACTOR_COLUMN = 2;
    static final int CONTRACTOR_FALLBACK_COLUMN = 3;
    static final int FIRST_HEADER_ROW = 7;
    static final int SECOND_HEADER_ROW = 8;
    static final int FIRST_DATA_ROW = 9;
    static final int QUANTITY_COLUMN = 8;

    static final String ITEM_HEADER = "ITEM";
    static final String DESCRIPTION_HEADER = "DESCRIPCION";
    static final String UNIT_HEADER = "UN";
    static final String PRICE_HEADER = "VALOR UNITARIO";

    public ParsedCertificate parse(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new CertificateParseException(FailureKind.UNREADABLE, "Not a file: " + path);
        }
        try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
            Sheet sheet = findCorteSheet(workbook)
                    .orElseThrow(() -> new CertificateParseException(FailureKind.MISSING_SHEET,
                            "No '" + SHEET_NAME + "' sheet in " + path.getFileName()));
            return parseSheet(path, sheet);
        } catch (IOException e) {
            throw new CertificateParseException(FailureKind.UNREADABLE,
                    "Cannot open " + path.getFileName() + ": " + e.getMessage(), e);
        } catch (CertificateParseException e) {
            throw e;
        } catch (RuntimeException e) {
            // POI signals corrupt or non-OOXML content with assorted runtime exceptions
            throw new CertificateParseException(FailureKind.UNREADABLE,
                    "Cannot read " + path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    static Optional<Sheet> findCorteSheet(Workbook workbook) {
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            String name = workbook.getSheetName(i);
            if (name.trim().equalsIgnoreCase(SHEET_NAME)) {
                return Optional.of(workbook.getSheetAt(i));
            }
        }
        return Optional.empty();
    }

    private ParsedCertificate parseSheet(Path path, Sheet sheet) {
        String sourceFile = path.getFileName().toString();
        HeaderColumnMap headers = HeaderColumnMap.read(sheet, FIRST_HEADER_ROW, SECOND_HEADER_ROW);

        int itemCol = headers.columnOr(ITEM_HEADER, 0);
        int descCol = headers.columnOr(DESCRIPTION_HEADER, 1);
        int unitCol = headers.columnOr(UNIT_HEADER, 3);
        int priceCol = headers.findContaining(PRICE_HEADER)
                .orElseThrow(() -> new CertificateParseException(FailureKind.MISSING_COLUMNS,
                        "No '" + PRICE_HEADER + "' column in " + sourceFile));

        String contractor = readContractor(sheet);
        ParseStatistics stats = new ParseStatistics();
        List<LineItem> items = new ArrayList<>();
        List<QuantityRow> quantityRows = new ArrayList<>();

        for (int row = FIRST_DATA_ROW; row <= sheet.getLastRowNum(); row++) {
            stats.rowScanned();
            String itemCode = CellValues.text(CellValues.cell(sheet, row, itemCol));
            String description = CellValues.text(CellValues.cell(sheet, row, descCol));
            if (itemCode.isEmpty() || description.isEmpty()) {
                stats.missingItemOrDescription();
                continue;
            }

            String normalized = TextNormalizer.normalizeText(description);
            if (normalized.isEmpty()) {
                stats.missingItemOrDescription();
                continue;
            }

            String unit = CellValues.text(CellValues.cell(sheet, row, unitCol));
            Optional<BigDecimal> quantity = CellValues.quantity(CellValues.cell(sheet, row, QUANTITY_COLUMN))
                    .filter(value -> value.signum() != 0);
            if (quantity.isPresent()) {
                quantityRows.add(new QuantityRow(itemCode, description, unit, quantity.get(), row));
            }

            if (isLaborRow(itemCode, normalized)) {
                stats.excludedLabor();
                continue;
            }

            Cell priceCell = CellValues.cell(sheet, row, priceCol);
            if (CellValues.isEmpty(priceCell)) {
                stats.missingPrice();
                continue;
            }
            Optional<BigDecimal> price = CellValues.amount(priceCell);
            if (price.isEmpty()) {
                stats.unparsablePrice();
                log.debug("{} row {}: unparsable unit price", sourceFile, row + 1);
                continue;
            }

            if (quantity.isEmpty()) {
                stats.invalidQuantity();
                continue;
            }

            items.add(new LineItem(itemCode, description, unit, price.get(), quantity.get(), sourceFile, row));
            stats.emitted();
        }

        log.debug("Parsed {}: contractor='{}' {}", sourceFile, contractor, stats);
        return new ParsedCertificate(path, contractor, sheet.getSheetName(), priceCol, List.copyOf(items),
                List.copyOf(quantityRows), stats);
    }

    /**
     * Labor lines are never price-checked.
     */
    static boolean isLaborRow(String itemCode, String normalizedDescription) {
        return normalizedDescription.contains("mano de obra")
                || normalizedDescription.contains("pea")
                || itemCode.toUpperCase(Locale.ROOT).contains("MR45");
    }

    private static String readContractor(Sheet sheet) {
        String name = CellValues.text(CellValues.cell(sheet, CONTRACTOR_ROW, CONTRACTOR_COLUMN));
        if (name.isEmpty()) {
            name = CellValues.text(CellValues.cell(sheet, CONTRACTOR_ROW, CONTRACTOR_FALLBACK_COLUMN));
        }
        return name.isEmpty() ? DEFAULT_CONTRACTOR : name;
    }
}
