package com.controlactas.service.output;

import com.controlactas.model.Category;
import com.controlactas.model.ContractorCategorySummary;
import com.controlactas.model.ContractorSummary;
import com.controlactas.model.PeriodContractorSummary;
import com.controlactas.model.ReconciliationRecord;
import com.controlactas.model.RunReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Writes the period summary, the global summary and the run report.
 * Summaries are written even when there is nothing flagged, so a run always
 * leaves its artifacts behind.
 */
@Component
@Slf4j
public class PeriodSummaryWriter {

    public static final String GLOBAL_SUMMARY_FILE = "resumen_global.xlsx";
    public static final String RUN_REPORT_FILE = "run_report.json";

    private static final List<String> CONTRACTOR_HEADERS =
            List.of(RegisterLayout.CONTRACTOR, "items_con_diferencia", "valor_ajustado_total");

    private final ObjectMapper objectMapper;

    public PeriodSummaryWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static String periodSummaryFile(String folderName) {
        return "resumen_" + folderName + ".xlsx";
    }

    public Path writePeriodSummary(Path dir,
                                   String folderName,
                                   List<ContractorSummary> contractors,
                                   List<ReconciliationRecord> records,
                                   List<ContractorCategorySummary> categories) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            SheetWriter summary = SheetWriter.create(workbook, RegisterLayout.SUMMARY_SHEET).header(CONTRACTOR_HEADERS);
            for (ContractorSummary s : contractors) {
                summary.row(Arrays.asList(s.contractor(), s.flaggedItems(), s.adjustedValueSum()));
            }

            SheetWriter register = SheetWriter.create(workbook, RegisterLayout.REGISTER_SHEET)
                    .header(RegisterLayout.REGISTER_HEADERS);
            records.forEach(r -> register.row(RegisterLayout.registerRow(r)));

            List<String> quantityHeaders = new ArrayList<>();
            quantityHeaders.add(RegisterLayout.CONTRACTOR);
            for (Category category : Category.values()) {
                quantityHeaders.add(category.label());
            }
            SheetWriter quantities = SheetWriter.create(workbook, RegisterLayout.QUANTITIES_SHEET).header(quantityHeaders);
            for (ContractorCategorySummary c : categories) {
                List<Object> row = new ArrayList<>();
                row.add(c.contractor());
                for (Category category : Category.values()) {
                    row.add(c.quantities().get(category));
                }
                quantities.row(row);
            }

            return save(workbook, dir.resolve(periodSummaryFile(folderName)));
        }
    }

    /**
     * RESUMEN groups the whole ledger by (year, month, contractor); REGISTRO is the ledger itself.
     */
    public Path writeGlobalSummary(Path dir,
                                   List<PeriodContractorSummary> summaries,
                                   List<ReconciliationRecord> ledger) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            List<String> headers = new ArrayList<>(List.of(RegisterLayout.YEAR, RegisterLayout.MONTH));
            headers.addAll(CONTRACTOR_HEADERS);
            SheetWriter summary = SheetWriter.create(workbook, RegisterLayout.SUMMARY_SHEET).header(headers);
            for (PeriodContractorSummary s : summaries) {
                summary.row(Arrays.asList(s.year(), s.month(), s.contractor(), s.flaggedItems(), s.adjustedValueSum()));
            }

            SheetWriter register = SheetWriter.create(workbook, RegisterLayout.REGISTER_SHEET)
                    .header(RegisterLayout.REGISTER_HEADERS);
            ledger.forEach(r -> register.row(RegisterLayout.registerRow(r)));

            return save(workbook, dir.resolve(GLOBAL_SUMMARY_FILE));
        }
    }

    public Path writeRunReport(Path dir, RunReport report) throws IOException {
        Files.createDirectories(dir);
        Path target = dir.resolve(RUN_REPORT_FILE);
        objectMapper.writeValue(target.toFile(), report);
        return target;
    }

    private static Path save(Workbook workbook, Path target) throws IOException {
        Files.createDirectories(target.getParent());
        try (OutputStream out = Files.newOutputStream(target)) {
            workbook.write(out);
        }
        log.debug("Wrote {}", target);
        return target;
    }
}
