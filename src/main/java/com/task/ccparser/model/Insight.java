package com.task.ccparser.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public record Insight(
        @JsonProperty("type")
        Type type,

        @JsonProperty("title")
        String title,

        @JsonProperty("message")
        String message,

        @JsonProperty("priority")
        Priority priority
) {

    public enum Type {
        WARNING, CRITICAL, INFO;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Priority {
        HIGH, CRITICAL, MEDIUM;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
