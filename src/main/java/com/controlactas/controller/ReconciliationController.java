package com.controlactas.controller;

import com.controlactas.model.OperatingMode;
import com.controlactas.model.Period;
import com.controlactas.model.PeriodResult;
import com.controlactas.model.RunReport;
import com.controlactas.service.PeriodNotFoundException;
import com.controlactas.service.ReconciliationService;
import com.controlactas.service.period.PeriodWorkspace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Triggers reconciliation runs.
 *
 * GET  /api/reconciliation/periods
 * POST /api/reconciliation/periods/{folder}/run?mode=NORMAL|CRITICAL
 * POST /api/reconciliation/runs?mode=NORMAL|CRITICAL
 */
@RestController
@RequestMapping("/api/reconciliation")
@RequiredArgsConstructor
@Slf4j
public class ReconciliationController {

    private final ReconciliationService service;

    @GetMapping("/periods")
    public List<Period> getPeriods() {
        return service.listPeriods().stream().map(PeriodWorkspace::period).toList();
    }

    @PostMapping("/periods/{folder}/run")
    public ResponseEntity<?> runPeriod(@PathVariable String folder,
                                       @RequestParam(required = false) OperatingMode mode) {
        try {
            PeriodResult result = service.runPeriod(folder, mode);
            return ResponseEntity.ok(result.report());
        } catch (PeriodNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (RuntimeException e) {
            log.error("Run of {} failed: {}", folder, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of(
                    "period", folder,
                    "error", String.valueOf(e.getMessage())
            ));
        }
    }

    @PostMapping("/runs")
    public ResponseEntity<?> runAll(@RequestParam(required = false) OperatingMode mode) {
        try {
            List<RunReport> reports = service.runAllPeriods(mode).stream().map(PeriodResult::report).toList();
            return ResponseEntity.ok(reports);
        } catch (RuntimeException e) {
            log.error("Batch run failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
