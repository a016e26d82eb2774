package com.task.ccparser.model;

import java.util.Map;

/**
 * Raw model output together with the result of recovering a JSON object from it.
 */
public record ModelResponse(String rawText, ParseStatus status, Map<String, Object> payload, String error) {

    public enum ParseStatus {
        PARSED,
        NO_JSON_OBJECT,
        INVALID_JSON
    }

    public static ModelResponse parsed(String rawText, Map<String, Object> payload) {
        return new ModelResponse(rawText, ParseStatus.PARSED, payload, null);
    }

    public static ModelResponse failed(String rawText, ParseStatus status, String error) {
        return new ModelResponse(rawText, status, null, error);
    }

    public boolean isParsed() {
        return status == ParseStatus.PARSED;
    }
}
