package com.controlactas.service.parsing;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HeaderColumnMapTest {

    @Test
    void read_joinsBothHeaderRowsAndIgnoresAccents() throws Exception {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("CORTE");
            Row first = sheet.createRow(7);
            Row second = sheet.createRow(8);
            first.createCell(0).setCellValue("Ítem");
            first.createCell(5).setCellValue("VALOR");
            second.createCell(5).setCellValue("UNITARIO");
            second.createCell(6).setCellValue("VALOR UNITARIO ACTA");

            HeaderColumnMap headers = HeaderColumnMap.read(sheet, 7, 8);

            assertEquals(Optional.of(0), headers.find("ITEM"));
            assertEquals(Optional.of(5), headers.findContaining("VALOR UNITARIO"));
            assertEquals(3, headers.columnOr("UN", 3));
            assertTrue(headers.find("DESCRIPCION").isEmpty());
        }
    }

    @Test
    void findContaining_fallsBackToPartialMatch() throws Exception {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("CORTE");
            sheet.createRow(7).createCell(4).setCellValue("Valor unitario contractual");

            HeaderColumnMap headers = HeaderColumnMap.read(sheet, 7, 8);

            assertEquals(Optional.of(4), headers.findContaining("VALOR UNITARIO"));
            assertTrue(headers.findContaining("CANTIDAD").isEmpty());
        }
    }
}
