package com.controlactas.service.parsing;

import com.controlactas.model.LineItem;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of reading one certificate workbook.
 *
 * @param path         file that was read, reopened later to write the verified copy
 * @param sheetName    actual name of the CORTE sheet
 * @param priceColumn  zero based column of the declared unit price
 * @param quantityRows every row with a valid quantity, labor and price-less rows included
 */
public record ParsedCertificate(
    Path path,
    String contractor,
    String sheetName,
    int priceColumn,
    List<LineItem> items,
    List<QuantityRow> quantityRows,
    ParseStatistics statistics
) {

    public String sourceFile() {
        return path.getFileName().toString();
    }
}
