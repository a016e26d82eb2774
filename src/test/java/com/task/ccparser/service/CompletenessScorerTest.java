package com.task.ccparser.service;

import com.task.ccparser.model.Completeness;
import com.task.ccparser.model.ExtractedFields;
import org.junit.jupiter.api.Test;

import static com.task.ccparser.model.ExtractedFields.NOT_FOUND;
import static org.junit.jupiter.api.Assertions.*;

public class CompletenessScorerTest {

    private final CompletenessScorer scorer = new CompletenessScorer();

    @Test
    public void testScore_AllRequiredFound() {
        Completeness completeness = scorer.score(
                new ExtractedFields(NOT_FOUND, "1234", "2024-01-01", "2024-01-25", "500", "25"));

        assertEquals(5, completeness.extractedCount());
        assertEquals(5, completeness.totalRequired());
        assertEquals(100.0, completeness.successRate());
    }

    @Test
    public void testScore_IssuerIsNotCounted() {
        Completeness completeness = scorer.score(
                new ExtractedFields("Chase", NOT_FOUND, NOT_FOUND, NOT_FOUND, NOT_FOUND, NOT_FOUND));

        assertEquals(0, completeness.extractedCount());
        assertEquals(0.0, completeness.successRate());
    }

    @Test
    public void testScore_Partial() {
        Completeness completeness = scorer.score(
                new ExtractedFields("Citi", "9876", NOT_FOUND, "2024-02-10", "1200.00", NOT_FOUND));

        assertEquals(3, completeness.extractedCount());
        assertEquals(60.0, completeness.successRate());
    }
}
