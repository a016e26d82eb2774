package com.task.ccparser.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.task.ccparser.model.ModelResponse;
import com.task.ccparser.model.ModelResponse.ParseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Recovers the JSON object from model output that may be wrapped in prose or code fences.
 * The payload is taken from the first {@code '{'} to the last {@code '}'}.
 */
@Component
public class JsonResponseExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonResponseExtractor.class);

    static final String NO_JSON_OBJECT = "No JSON object found in AI response";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private final ObjectMapper om = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    public ModelResponse extract(String rawText) {
        String raw = rawText == null ? "" : rawText;
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end < start) {
            LOGGER.warn("{} (response length {})", NO_JSON_OBJECT, raw.length());
            return ModelResponse.failed(raw, ParseStatus.NO_JSON_OBJECT, NO_JSON_OBJECT);
        }

        String json = raw.substring(start, end + 1);
        try {
            Map<String, Object> payload = om.readValue(json, MAP_TYPE);
            return ModelResponse.parsed(raw, payload);
        } catch (JsonProcessingException ex) {
            LOGGER.warn("JSON parse error: {}", ex.getOriginalMessage());
            return ModelResponse.failed(raw, ParseStatus.INVALID_JSON,
                    "AI returned invalid JSON: " + ex.getOriginalMessage());
        }
    }
}
