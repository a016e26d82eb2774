package com.task.ccparser.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HistoryEntry(
        @JsonProperty("id")
        String id,

        @JsonProperty("filename")
        String fileName,

        @JsonProperty("timestamp")
        String timestamp,

        @JsonProperty("result")
        ParseResult result
) {
}
