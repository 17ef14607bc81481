package com.controlactas.service;

import com.controlactas.config.ControlActasProperties;
import com.controlactas.model.OperatingMode;
import com.controlactas.model.PeriodResult;
import com.controlactas.service.period.PeriodWorkspace;
import com.controlactas.service.period.ProjectLayout;
import com.controlactas.service.reference.ReferenceResolver;
import com.controlactas.service.reference.ReferenceResolverFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for running reconciliations on the configured project.
 */
@Service
@Slf4j
public class ReconciliationService {

    private final ControlActasProperties properties;
    private final ReferenceResolverFactory resolverFactory;
    private final ReconciliationBatchRunner runner;

    public ReconciliationService(ControlActasProperties properties,
                                 ReferenceResolverFactory resolverFactory,
                                 ReconciliationBatchRunner runner) {
        this.properties = properties;
        this.resolverFactory = resolverFactory;
        this.runner = runner;
    }

    public ProjectLayout layout() {
        return new ProjectLayout(Path.of(properties.getBaseRoot()), properties.getProject());
    }

    public List<PeriodWorkspace> listPeriods() {
        return layout().listPeriods();
    }

    /**
     * @param mode null means the configured default mode
     * @throws PeriodNotFoundException if the folder does not exist or has no period in its name
     */
    public PeriodResult runPeriod(String folderName, OperatingMode mode) {
        PeriodWorkspace workspace = layout().workspaceFor(folderName)
                .filter(w -> Files.isDirectory(w.certificatesDir()))
                .orElseThrow(() -> new PeriodNotFoundException(folderName));
        ReferenceResolver resolver = resolverFactory.create(effective(mode));
        return runner.runPeriod(workspace, resolver);
    }

    public List<PeriodResult> runAllPeriods(OperatingMode mode) {
        List<PeriodWorkspace> workspaces = listPeriods();
        if (workspaces.isEmpty()) {
            log.warn("No period folders under {}", layout().certificatesRoot());
            return List.of();
        }
        return runner.runBatch(workspaces, resolverFactory.create(effective(mode)));
    }

    private OperatingMode effective(OperatingMode mode) {
        return mode != null ? mode : properties.getMode();
    }
}
