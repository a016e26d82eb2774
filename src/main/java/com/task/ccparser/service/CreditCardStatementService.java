package com.task.ccparser.service;

import com.task.ccparser.model.ParseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the statement parser and, for successful results, attaches insights and records history.
 */
@Service
public class CreditCardStatementService {

    private static final Logger LOGGER = LoggerFactory.getLogger(CreditCardStatementService.class);

    private final StatementParser parser;
    private final InsightGenerator insightGenerator;
    private final ParseHistory history;

    public CreditCardStatementService(StatementParser parser, InsightGenerator insightGenerator, ParseHistory history) {
        this.parser = parser;
        this.insightGenerator = insightGenerator;
        this.history = history;
    }

    public ParseResult parseAndRecord(byte[] pdfBytes, String fileName) {
        ParseResult result = parser.parse(pdfBytes, fileName);
        if (!result.success()) {
            LOGGER.warn("Parsing '{}' failed: {}", fileName, result.error());
            return result;
        }

        ParseResult withInsights = result.withInsights(
                insightGenerator.generate(result.data().totalBalance(), result.data().minimumPayment()));
        history.record(fileName, withInsights);
        LOGGER.info("Parsed '{}' with {} insights", fileName, withInsights.insights().size());
        return withInsights;
    }
}
