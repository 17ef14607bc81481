package com.controlactas.service.reference;

import com.controlactas.config.AppMetrics;
import com.controlactas.config.ControlActasProperties;
import com.controlactas.model.OperatingMode;
import com.controlactas.repository.PriceReferenceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the resolver for one run. The NORMAL snapshot is read from the price store
 * each time, so prices updated between runs are picked up.
 */
@Component
@Slf4j
public class ReferenceResolverFactory {

    private final PriceReferenceRepository repository;
    private final ControlActasProperties properties;
    private final AppMetrics metrics;

    public ReferenceResolverFactory(PriceReferenceRepository repository,
                                    ControlActasProperties properties,
                                    AppMetrics metrics) {
        this.repository = repository;
        this.properties = properties;
        this.metrics = metrics;
    }

    public ReferenceResolver create(OperatingMode mode) {
        long start = System.currentTimeMillis();
        ReferenceResolver resolver = switch (mode) {
            case NORMAL -> ExactModeResolver.fromEntries(repository.findAll());
            case CRITICAL -> new KeywordModeResolver(
                    KeywordPriceTable.of(properties.getCritical().getActivities()),
                    properties.getCritical().isWordBoundary());
        };
        long elapsed = System.currentTimeMillis() - start;
        metrics.recordReferenceLoad(elapsed);
        log.info("Reference snapshot ready: mode={}, entries={}, {}ms", mode, resolver.size(), elapsed);
        return resolver;
    }
}
