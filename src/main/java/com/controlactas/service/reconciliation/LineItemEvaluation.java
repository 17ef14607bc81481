package com.controlactas.service.reconciliation;

import com.controlactas.model.Category;
import com.controlactas.model.LineItem;

import java.math.BigDecimal;

/**
 * How one line item went through the engine.
 *
 * @param category       quantity family, null when the description matches none
 * @param normalizedUnit unit as used for the lookup
 * @param reference      reference unit price, null for {@link LineItemOutcome#NO_REFERENCE}
 * @param difference     declared minus reference, null for {@link LineItemOutcome#NO_REFERENCE}
 */
public record LineItemEvaluation(
    LineItem item,
    Category category,
    String normalizedUnit,
    LineItemOutcome outcome,
    BigDecimal reference,
    BigDecimal difference
) {

    public boolean isFlagged() {
        return outcome == LineItemOutcome.FLAGGED;
    }

    /**
     * reference × quantity, the corrected payable amount.
     */
    public BigDecimal adjustedValue() {
        return reference == null ? null : reference.multiply(item.quantity());
    }
}
