package com.controlactas.service.period;

import com.controlactas.model.Period;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Folders involved in processing one period.
 *
 * @param certificatesDir   actas/&lt;folder&gt;, the input certificates
 * @param outputDir         salidas/&lt;folder&gt;, verified copies
 * @param dataDir           datos, the cross-period ledger
 * @param summaryDir        resumen, the global summary
 * @param periodSummaryDir  resumen/&lt;folder&gt;, the period summary and run report
 */
public record PeriodWorkspace(
    Period period,
    Path certificatesDir,
    Path outputDir,
    Path dataDir,
    Path summaryDir,
    Path periodSummaryDir
) {

    /**
     * Certificate workbooks of the period, sorted by file name. Office lock files are skipped.
     */
    public List<Path> certificates() {
        if (!Files.isDirectory(certificatesDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(certificatesDir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.toLowerCase(Locale.ROOT).endsWith(".xlsx") && !name.startsWith("~$");
                    })
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list certificates in " + certificatesDir, e);
        }
    }

    public void createOutputDirectories() throws IOException {
        Files.createDirectories(outputDir);
        Files.createDirectories(dataDir);
        Files.createDirectories(periodSummaryDir);
    }
}
