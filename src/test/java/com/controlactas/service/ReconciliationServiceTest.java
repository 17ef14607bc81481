package com.controlactas.service;

import com.controlactas.config.ControlActasProperties;
import com.controlactas.model.OperatingMode;
import com.controlactas.model.PeriodResult;
import com.controlactas.service.period.PeriodWorkspace;
import com.controlactas.service.reference.ReferenceResolver;
import com.controlactas.service.reference.ReferenceResolverFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReconciliationServiceTest {

    @TempDir
    Path baseRoot;

    @Mock private ReferenceResolverFactory resolverFactory;
    @Mock private ReconciliationBatchRunner runner;
    @Mock private ReferenceResolver resolver;
    @Mock private PeriodResult result;

    private ControlActasProperties properties;
    private ReconciliationService service;

    @BeforeEach
    void setUp() {
        properties = new ControlActasProperties();
        properties.setBaseRoot(baseRoot.toString());
        properties.setProject("Grupo 4");
        properties.setMode(OperatingMode.CRITICAL);
        service = new ReconciliationService(properties, resolverFactory, runner);
    }

    @Test
    void runPeriod_usesConfiguredModeWhenNoneGiven() throws Exception {
        Files.createDirectories(service.layout().certificatesRoot().resolve("julio2025"));
        when(resolverFactory.create(OperatingMode.CRITICAL)).thenReturn(resolver);
        when(runner.runPeriod(any(PeriodWorkspace.class), eq(resolver))).thenReturn(result);

        assertThat(service.runPeriod("julio2025", null)).isSameAs(result);

        ArgumentCaptor<PeriodWorkspace> workspace = ArgumentCaptor.forClass(PeriodWorkspace.class);
        verify(runner).runPeriod(workspace.capture(), eq(resolver));
        assertThat(workspace.getValue().period().month()).isEqualTo("julio");
    }

    @Test
    void runPeriod_explicitModeWins() throws Exception {
        Files.createDirectories(service.layout().certificatesRoot().resolve("julio2025"));
        when(resolverFactory.create(OperatingMode.NORMAL)).thenReturn(resolver);
        when(runner.runPeriod(any(PeriodWorkspace.class), eq(resolver))).thenReturn(result);

        service.runPeriod("julio2025", OperatingMode.NORMAL);

        verify(resolverFactory).create(OperatingMode.NORMAL);
    }

    @Test
    void runPeriod_unknownFolder() {
        assertThatThrownBy(() -> service.runPeriod("julio2025", null)).isInstanceOf(PeriodNotFoundException.class);
        assertThatThrownBy(() -> service.runPeriod("borrador", null)).isInstanceOf(PeriodNotFoundException.class);
        verifyNoInteractions(resolverFactory, runner);
    }

    @Test
    void runAllPeriods_buildsOneResolverForTheBatch() throws Exception {
        Files.createDirectories(service.layout().certificatesRoot().resolve("julio2025"));
        Files.createDirectories(service.layout().certificatesRoot().resolve("agosto2025"));
        when(resolverFactory.create(OperatingMode.NORMAL)).thenReturn(resolver);
        when(runner.runBatch(anyList(), eq(resolver))).thenReturn(List.of(result, result));

        assertThat(service.runAllPeriods(OperatingMode.NORMAL)).hasSize(2);
        verify(resolverFactory, times(1)).create(OperatingMode.NORMAL);
    }

    @Test
    void runAllPeriods_noFolders() {
        assertThat(service.runAllPeriods(null)).isEmpty();
        verifyNoInteractions(resolverFactory, runner);
    }
}
