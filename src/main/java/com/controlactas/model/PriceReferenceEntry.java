package com.controlactas.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Row of the reference price store.
 */
public record PriceReferenceEntry(
    String activity,
    BigDecimal price,
    String unit,
    LocalDateTime updatedAt
) {}
