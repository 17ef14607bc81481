package com.controlactas.model;

/**
 * Directive to colour one cell of the verified workbook.
 */
public record CellAnnotation(
    int rowIndex,
    int columnIndex,
    Deviation deviation
) {}
