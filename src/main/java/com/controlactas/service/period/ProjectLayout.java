package com.controlactas.service.period;

import com.controlactas.model.Period;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Folder structure of a project:
 * <pre>
 * &lt;baseRoot&gt;/&lt;project&gt;/control_actas/
 *     actas/&lt;month folder&gt;/*.xlsx
 *     salidas/&lt;month folder&gt;/
 *     datos/base_general.xlsx
 *     resumen/resumen_global.xlsx
 *     resumen/&lt;month folder&gt;/
 * </pre>
 */
@Slf4j
public class ProjectLayout {

    private final Path root;

    public ProjectLayout(Path baseRoot, String project) {
        this.root = baseRoot.resolve(project).resolve("control_actas");
    }

    public Path root() {
        return root;
    }

    public Path certificatesRoot() {
        return root.resolve("actas");
    }

    public PeriodWorkspace workspaceFor(Period period) {
        String folder = period.folderName();
        return new PeriodWorkspace(
                period,
                certificatesRoot().resolve(folder),
                root.resolve("salidas").resolve(folder),
                root.resolve("datos"),
                root.resolve("resumen"),
                root.resolve("resumen").resolve(folder)
        );
    }

    public Optional<PeriodWorkspace> workspaceFor(String folderName) {
        return PeriodParser.parse(folderName).map(this::workspaceFor);
    }

    /**
     * Month folders under actas/, oldest first. Folders whose name has no
     * recognizable year and month are skipped.
     */
    public List<PeriodWorkspace> listPeriods() {
        Path actas = certificatesRoot();
        if (!Files.isDirectory(actas)) {
            return List.of();
        }
        List<Period> periods = new ArrayList<>();
        try (Stream<Path> dirs = Files.list(actas)) {
            dirs.filter(Files::isDirectory).forEach(dir -> {
                String name = dir.getFileName().toString();
                Optional<Period> period = PeriodParser.parse(name);
                if (period.isPresent()) {
                    periods.add(period.get());
                } else {
                    log.warn("Skipping folder without a recognizable period: {}", name);
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list month folders in " + actas, e);
        }
        periods.sort(Comparator.comparingInt(Period::year)
                .thenComparingInt(p -> PeriodParser.monthNumber(p.month()))
                .thenComparing(Period::folderName));
        return periods.stream().map(this::workspaceFor).toList();
    }
}
