package com.task.ccparser.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of one statement parse. Failures carry {@code error} and, when the model answered,
 * its {@code raw_response}; successes carry the normalized fields and completeness figures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParseResult(
        @JsonProperty("success")
        boolean success,

        @JsonProperty("data")
        ExtractedFields data,

        @JsonProperty("extracted_fields")
        Integer extractedFields,

        @JsonProperty("total_fields")
        Integer totalFields,

        @JsonProperty("success_rate")
        Double successRate,

        @JsonProperty("method")
        String method,

        @JsonProperty("error")
        String error,

        @JsonProperty("raw_response")
        String rawResponse,

        @JsonProperty("insights")
        List<Insight> insights
) {

    public static ParseResult success(ExtractedFields data, Completeness completeness, String method) {
        return new ParseResult(true, data, completeness.extractedCount(), completeness.totalRequired(),
                completeness.successRate(), method, null, null, null);
    }

    public static ParseResult failure(String error) {
        return failure(error, null);
    }

    public static ParseResult failure(String error, String rawResponse) {
        return new ParseResult(false, null, null, null, null, null, error, rawResponse, null);
    }

    public ParseResult withInsights(List<Insight> newInsights) {
        return new ParseResult(success, data, extractedFields, totalFields, successRate, method, error,
                rawResponse, List.copyOf(newInsights));
    }
}
