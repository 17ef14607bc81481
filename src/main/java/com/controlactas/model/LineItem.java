package com.controlactas.model;

import java.math.BigDecimal;

/**
 * One billed row of a certificate, as read from the CORTE sheet.
 * rowIndex is zero based and only used to place annotations.
 */
public record LineItem(
    String itemCode,
    String description,
    String unit,
    BigDecimal declaredUnitPrice,
    BigDecimal quantity,
    String sourceFile,
    int rowIndex
) {}
