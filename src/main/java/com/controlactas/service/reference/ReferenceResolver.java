package com.controlactas.service.reference;

import com.controlactas.model.OperatingMode;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Looks up the authoritative unit price of an activity.
 * Implementations hold an immutable snapshot taken at construction time.
 */
public interface ReferenceResolver {

    OperatingMode mode();

    /**
     * @param normalizedDescription normalized description of the line item
     * @param normalizedUnit        normalized unit, may be empty
     * @return the reference unit price, or empty when the item is not reconcilable
     */
    Optional<BigDecimal> lookup(String normalizedDescription, String normalizedUnit);

    /**
     * Number of keys in the snapshot.
     */
    int size();
}
