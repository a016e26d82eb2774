package com.task.ccparser.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record HistoryStats(
        @JsonProperty("total_parsed")
        int totalParsed,

        @JsonProperty("issuers_breakdown")
        Map<String, Integer> issuersBreakdown,

        @JsonProperty("total_balance_parsed")
        double totalBalanceParsed,

        @JsonProperty("average_success_rate")
        double averageSuccessRate
) {
}
