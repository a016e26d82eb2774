package com.task.ccparser.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.opencsv.CSVWriter;
import com.task.ccparser.model.ExtractedFields;
import com.task.ccparser.model.ParseResult;
import com.task.ccparser.model.StatementField;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders a parse result as a downloadable CSV row, an Excel sheet or pretty-printed JSON.
 */
@Component
public class StatementExporter {

    static final String SHEET_NAME = "Statement";
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String MISSING = "N/A";

    private static final List<Column> COLUMNS = List.of(
            new Column("Issuer", StatementField.ISSUER),
            new Column("Card Last 4", StatementField.CARD_LAST4),
            new Column("Statement Date", StatementField.STATEMENT_DATE),
            new Column("Due Date", StatementField.DUE_DATE),
            new Column("Total Balance", StatementField.TOTAL_BALANCE),
            new Column("Minimum Payment", StatementField.MINIMUM_PAYMENT)
    );

    private final ObjectMapper om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public String toCsv(ParseResult result) throws IOException {
        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(headers(), false);
            writer.writeNext(values(result));
        }
        return out.toString();
    }

    public byte[] toXlsx(ParseResult result) throws IOException {
        try (Workbook wb = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = wb.createSheet(SHEET_NAME);
            writeRow(sheet.createRow(0), headers());
            writeRow(sheet.createRow(1), values(result));
            wb.write(out);
            return out.toByteArray();
        }
    }

    public String toJson(ParseResult result) throws JsonProcessingException {
        return om.writeValueAsString(result);
    }

    public String fileName(String extension) {
        return "statement_" + LocalDateTime.now().format(FILE_STAMP) + "." + extension;
    }

    private static String[] headers() {
        return COLUMNS.stream().map(Column::header).toArray(String[]::new);
    }

    private static String[] values(ParseResult result) {
        ExtractedFields data = result == null ? null : result.data();
        return COLUMNS.stream()
                .map(c -> data == null || data.value(c.field()) == null ? MISSING : data.value(c.field()))
                .toArray(String[]::new);
    }

    private static void writeRow(Row row, String[] cells) {
        for (int i = 0; i < cells.length; i++) {
            row.createCell(i).setCellValue(cells[i]);
        }
    }

    private record Column(String header, StatementField field) {
    }
}
