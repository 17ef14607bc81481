package com.controlactas.repository;

import com.controlactas.model.Category;
import com.controlactas.model.CategoryTotals;
import com.controlactas.model.OperatingMode;
import com.controlactas.model.Period;
import com.controlactas.model.ReconciliationRecord;
import com.controlactas.service.aggregation.ReconciliationAggregator;
import com.controlactas.service.output.RegisterLayout;
import com.controlactas.service.output.SheetWriter;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-period ledger kept in datos/base_general.xlsx.
 * REGISTRO holds every flagged record, CANTIDADES the quantity totals per certificate.
 * A period is replaced as a whole, so re-running it never duplicates rows.
 */
@Component
@Slf4j
public class WorkbookLedgerStore {

    public static final String LEDGER_FILE = "base_general.xlsx";

    private final ReconciliationAggregator aggregator;

    public WorkbookLedgerStore(ReconciliationAggregator aggregator) {
        this.aggregator = aggregator;
    }

    public record Ledger(List<ReconciliationRecord> records, List<CategoryTotals> totals) {

        public static Ledger empty() {
            return new Ledger(List.of(), List.of());
        }
    }

    /**
     * Reads the ledger; a missing file is an empty ledger.
     *
     * @throws LedgerWriteException if the file exists but cannot be read
     */
    public Ledger load(Path dataDir) {
        Path file = dataDir.resolve(LEDGER_FILE);
        if (!Files.exists(file)) {
            return Ledger.empty();
        }
        try (InputStream in = Files.newInputStream(file);
             Workbook workbook = WorkbookFactory.create(in)) {
            List<ReconciliationRecord> records = readSheet(workbook.getSheet(RegisterLayout.REGISTER_SHEET), WorkbookLedgerStore::toRecord);
            List<CategoryTotals> totals = readSheet(workbook.getSheet(RegisterLayout.QUANTITIES_SHEET), WorkbookLedgerStore::toTotals);
            return new Ledger(records, totals);
        } catch (IOException e) {
            throw new LedgerWriteException("Cannot read ledger " + file, e);
        } catch (RuntimeException e) {
            throw new LedgerWriteException("Ledger " + file + " is malformed", new IOException(e.getMessage(), e));
        }
    }

    /**
     * Drops every row of the period and appends the new ones, then rewrites the file.
     *
     * @return the ledger as written
     * @throws LedgerWriteException on any I/O failure
     */
    public Ledger replacePeriod(Path dataDir, Period period,
                                List<ReconciliationRecord> records, List<CategoryTotals> totals) {
        Ledger current = load(dataDir);
        Ledger updated = new Ledger(
                aggregator.replacePeriod(current.records(), period, records),
                aggregator.replacePeriod(current.totals(), period, totals));
        write(dataDir, updated);
        log.info("Ledger updated for {} {}: {} records, {} quantity rows (total {} / {})",
                period.month(), period.year(), records.size(), totals.size(),
                updated.records().size(), updated.totals().size());
        return updated;
    }

    private void write(Path dataDir, Ledger ledger) {
        Path file = dataDir.resolve(LEDGER_FILE);
        try (Workbook workbook = new XSSFWorkbook()) {
            SheetWriter register = SheetWriter.create(workbook, RegisterLayout.REGISTER_SHEET)
                    .header(RegisterLayout.REGISTER_HEADERS);
            ledger.records().forEach(r -> register.row(RegisterLayout.registerRow(r)));

            SheetWriter quantities = SheetWriter.create(workbook, RegisterLayout.QUANTITIES_SHEET)
                    .header(RegisterLayout.quantityHeaders());
            ledger.totals().forEach(t -> quantities.row(RegisterLayout.quantityRow(t)));

            Files.createDirectories(dataDir);
            Path temp = Files.createTempFile(dataDir, "base_general", ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                workbook.write(out);
            }
            move(temp, file);
        } catch (IOException e) {
            throw new LedgerWriteException("Cannot write ledger " + file, e);
        }
    }

    private static void move(Path temp, Path file) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported, replacing {} directly", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private interface RowMapper<T> {
        T map(RowValues row);
    }

    private static <T> List<T> readSheet(Sheet sheet, RowMapper<T> mapper) {
        List<T> result = new ArrayList<>();
        if (sheet == null || sheet.getRow(0) == null) {
            return result;
        }
        Map<String, Integer> columns = new HashMap<>();
        for (Cell cell : sheet.getRow(0)) {
            columns.put(cell.getStringCellValue().trim(), cell.getColumnIndex());
        }
        for (int r = 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            result.add(mapper.map(new RowValues(row, columns)));
        }
        return result;
    }

    private static ReconciliationRecord toRecord(RowValues row) {
        return new ReconciliationRecord(
                row.integer(RegisterLayout.YEAR),
                row.text(RegisterLayout.MONTH),
                row.text(RegisterLayout.FILE),
                row.text(RegisterLayout.CONTRACTOR),
                row.text(RegisterLayout.ITEM),
                row.text(RegisterLayout.DESCRIPTION),
                row.text(RegisterLayout.UNIT),
                row.decimal(RegisterLayout.PAID_UNIT_PRICE),
                row.decimal(RegisterLayout.AGREED_UNIT_PRICE),
                row.decimal(RegisterLayout.QUANTITY),
                row.decimal(RegisterLayout.ADJUSTED_VALUE),
                row.mode());
    }

    private static CategoryTotals toTotals(RowValues row) {
        Map<Category, BigDecimal> quantities = new EnumMap<>(Category.class);
        for (Category category : Category.values()) {
            quantities.put(category, row.decimal(category.label()));
        }
        return new CategoryTotals(
                row.integer(RegisterLayout.YEAR),
                row.text(RegisterLayout.MONTH),
                row.text(RegisterLayout.FILE),
                row.text(RegisterLayout.CONTRACTOR),
                quantities,
                row.mode());
    }

    private static final class RowValues {

        private static final DataFormatter FORMATTER = new DataFormatter();

        private final Row row;
        private final Map<String, Integer> columns;

        RowValues(Row row, Map<String, Integer> columns) {
            this.row = row;
            this.columns = columns;
        }

        private Cell cell(String header) {
            Integer index = columns.get(header);
            if (index == null) {
                throw new IllegalStateException("Ledger column missing: " + header);
            }
            return row.getCell(index);
        }

        String text(String header) {
            Cell cell = cell(header);
            return cell == null ? "" : FORMATTER.formatCellValue(cell);
        }

        BigDecimal decimal(String header) {
            Cell cell = cell(header);
            if (cell == null || cell.getCellType() == CellType.BLANK) {
                return BigDecimal.ZERO;
            }
            if (cell.getCellType() == CellType.NUMERIC) {
                return BigDecimal.valueOf(cell.getNumericCellValue());
            }
            return new BigDecimal(cell.getStringCellValue().trim());
        }

        int integer(String header) {
            return decimal(header).intValue();
        }

        OperatingMode mode() {
            String value = text(RegisterLayout.MODE);
            return value.isBlank() ? OperatingMode.NORMAL : OperatingMode.valueOf(value.trim());
        }
    }
}
