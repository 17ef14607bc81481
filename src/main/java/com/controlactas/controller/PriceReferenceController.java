package com.controlactas.controller;

import com.controlactas.model.PriceReferenceEntry;
import com.controlactas.repository.PriceReferenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Maintenance of the reference price store used by NORMAL runs.
 */
@RestController
@RequestMapping("/api/prices")
@RequiredArgsConstructor
@Slf4j
public class PriceReferenceController {

    private final PriceReferenceRepository repository;

    public record PriceRequest(String activity, BigDecimal price, String unit) {}

    @GetMapping
    public List<PriceReferenceEntry> getPrices() {
        return repository.findAll();
    }

    @PutMapping
    public ResponseEntity<?> upsert(@RequestBody PriceRequest request) {
        try {
            return ResponseEntity.ok(repository.upsert(request.activity(), request.price(), request.unit()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @DeleteMapping
    public ResponseEntity<Void> delete(@RequestParam String activity) {
        if (repository.delete(activity)) {
            log.info("Deleted reference price for '{}'", activity);
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.notFound().build();
    }
}
