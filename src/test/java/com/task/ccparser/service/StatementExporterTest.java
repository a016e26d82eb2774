package com.task.ccparser.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.task.ccparser.model.Completeness;
import com.task.ccparser.model.ExtractedFields;
import com.task.ccparser.model.ParseResult;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;

import static org.junit.jupiter.api.Assertions.*;

public class StatementExporterTest {

    private final StatementExporter exporter = new StatementExporter();

    private static ParseResult sample() {
        ExtractedFields fields = new ExtractedFields("American Express", "1005", "Jan 1 - Jan 31, 2024",
                "2024-02-25", "2500.00", ExtractedFields.NOT_FOUND);
        return ParseResult.success(fields, new Completeness(4, 5, 80.0), StatementParser.METHOD);
    }

    @Test
    public void testToCsv_HeaderAndQuotedRow() throws Exception {
        String csv = exporter.toCsv(sample());

        String[] lines = csv.split("\n");
        assertEquals("Issuer,Card Last 4,Statement Date,Due Date,Total Balance,Minimum Payment", lines[0]);
        assertEquals("\"American Express\",\"1005\",\"Jan 1 - Jan 31, 2024\",\"2024-02-25\",\"2500.00\",\"Not found\"",
                lines[1]);
    }

    @Test
    public void testToCsv_MissingDataUsesPlaceholder() throws Exception {
        String csv = exporter.toCsv(ParseResult.failure("No JSON object found in AI response"));

        assertTrue(csv.endsWith("\"N/A\",\"N/A\",\"N/A\",\"N/A\",\"N/A\",\"N/A\"\n"));
    }

    @Test
    public void testToCsv_EmbeddedQuotesAreEscaped() throws Exception {
        ExtractedFields fields = new ExtractedFields("Bank \"One\"", "1", "a", "b", "10", "1");
        String csv = exporter.toCsv(ParseResult.success(fields, new Completeness(5, 5, 100.0), StatementParser.METHOD));

        assertTrue(csv.split("\n")[1].startsWith("\"Bank \"\"One\"\"\","));
    }

    @Test
    public void testToXlsx_SingleStatementSheet() throws Exception {
        byte[] xlsx = exporter.toXlsx(sample());

        try (Workbook wb = new XSSFWorkbook(new ByteArrayInputStream(xlsx))) {
            Sheet sheet = wb.getSheet("Statement");
            assertNotNull(sheet);
            assertEquals(1, sheet.getLastRowNum());
            assertEquals("Issuer", sheet.getRow(0).getCell(0).getStringCellValue());
            assertEquals("Minimum Payment", sheet.getRow(0).getCell(5).getStringCellValue());
            assertEquals("American Express", sheet.getRow(1).getCell(0).getStringCellValue());
            assertEquals("2500.00", sheet.getRow(1).getCell(4).getStringCellValue());
        }
    }

    @Test
    public void testToXlsx_MissingDataUsesPlaceholder() throws Exception {
        byte[] xlsx = exporter.toXlsx(ParseResult.failure("Could not extract text from PDF"));

        try (Workbook wb = new XSSFWorkbook(new ByteArrayInputStream(xlsx))) {
            assertEquals("N/A", wb.getSheet("Statement").getRow(1).getCell(2).getStringCellValue());
        }
    }

    @Test
    public void testToJson_SnakeCaseFields() throws Exception {
        JsonNode node = new ObjectMapper().readTree(exporter.toJson(sample()));

        assertTrue(node.get("success").asBoolean());
        assertEquals("1005", node.get("data").get("card_last4").asText());
        assertEquals(80.0, node.get("success_rate").asDouble());
        assertFalse(node.has("error"));
    }

    @Test
    public void testFileName() {
        assertTrue(exporter.fileName("csv").matches("statement_\\d{8}_\\d{6}\\.csv"));
    }
}
