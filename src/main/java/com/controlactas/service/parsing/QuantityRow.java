package com.controlactas.service.parsing;

import java.math.BigDecimal;

/**
 * A row with an item, a description and a nonzero quantity, read before the labor and
 * price filters. These rows feed the CUADRO_CANTIDADES sheet of the verified copy.
 */
public record QuantityRow(
    String itemCode,
    String description,
    String unit,
    BigDecimal quantity,
    int rowIndex
) {
}
