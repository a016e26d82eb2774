package com.task.ccparser.controller;

import com.task.ccparser.exception.StatementParsingException;
import com.task.ccparser.model.ParseResult;
import com.task.ccparser.service.CreditCardStatementService;
import com.task.ccparser.service.FieldNormalizer;
import com.task.ccparser.service.ParseHistory;
import com.task.ccparser.service.StatementExporter;
import com.task.ccparser.service.StatementParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class StatementController {

    private static final Logger LOGGER = LoggerFactory.getLogger(StatementController.class);

    private static final MediaType XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final CreditCardStatementService statementService;
    private final ParseHistory history;
    private final StatementExporter exporter;

    public StatementController(
            CreditCardStatementService statementService,
            ParseHistory history,
            StatementExporter exporter
    ) {
        this.statementService = statementService;
        this.history = history;
        this.exporter = exporter;
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "message", "API is running",
                "parser", StatementParser.METHOD
        ));
    }

    @PostMapping(path = "/parse", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> parse(@RequestPart(value = "file", required = false) MultipartFile file) throws IOException {
        if (file == null) {
            return badRequest("No file provided");
        }
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return badRequest("No file selected");
        }
        if (!fileName.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            return badRequest("Only PDF files are allowed");
        }

        ParseResult result = statementService.parseAndRecord(file.getBytes(), fileName);
        return ResponseEntity.ok(result);
    }

    @GetMapping("/history")
    public ResponseEntity<?> getHistory() {
        return ResponseEntity.ok(Map.of(
                "success", true,
                "history", history.entries()
        ));
    }

    @DeleteMapping("/history")
    public ResponseEntity<?> clearHistory() {
        history.clear();
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "History cleared"
        ));
    }

    @GetMapping("/stats")
    public ResponseEntity<?> stats() {
        return history.stats()
                .<ResponseEntity<?>>map(stats -> ResponseEntity.ok(Map.of("success", true, "stats", stats)))
                .orElseGet(() -> ResponseEntity.ok(Map.of(
                        "success", false,
                        "error", "No statements parsed yet"
                )));
    }

    @GetMapping("/supported-issuers")
    public ResponseEntity<?> supportedIssuers() {
        List<String> issuers = new ArrayList<>();
        FieldNormalizer.ISSUER_RULES.forEach(rule -> issuers.add(rule.issuer()));
        issuers.add("Any Bank (AI-Powered)");
        return ResponseEntity.ok(Map.of("issuers", issuers));
    }

    @PostMapping("/export/csv")
    public ResponseEntity<String> exportCsv(@RequestBody ParseResult result) throws IOException {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + exporter.fileName("csv"))
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(exporter.toCsv(result));
    }

    @PostMapping("/export/excel")
    public ResponseEntity<byte[]> exportExcel(@RequestBody ParseResult result) throws IOException {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + exporter.fileName("xlsx"))
                .contentType(XLSX)
                .body(exporter.toXlsx(result));
    }

    @PostMapping("/export/json")
    public ResponseEntity<String> exportJson(@RequestBody ParseResult result) throws IOException {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + exporter.fileName("json"))
                .contentType(MediaType.APPLICATION_JSON)
                .body(exporter.toJson(result));
    }

    @ExceptionHandler(StatementParsingException.class)
    public ResponseEntity<Map<String, Object>> handleParsingException(StatementParsingException ex) {
        LOGGER.error("Statement parsing failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "success", false,
                "error", String.valueOf(ex.getMessage())
        ));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(RuntimeException ex) {
        LOGGER.error("Unexpected error while handling request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "success", false,
                "error", String.valueOf(ex.getMessage())
        ));
    }

    private ResponseEntity<?> badRequest(String error) {
        return ResponseEntity.badRequest().body(Map.of(
                "success", false,
                "error", error
        ));
    }
}
