package com.task.ccparser.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Connection settings for the OpenAI-compatible Groq chat completion endpoint.
 */
@ConfigurationProperties(prefix = "groq")
public record ModelSettings(
        String apiKey,
        @DefaultValue("https://api.groq.com/openai/v1") String baseUrl,
        @DefaultValue("llama-3.1-8b-instant") String model,
        @DefaultValue("0.2") double temperature,
        @DefaultValue("1024") int maxTokens,
        @DefaultValue("120s") Duration timeout
) {

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        return "ModelSettings[baseUrl=" + baseUrl + ", model=" + model + ", temperature=" + temperature
                + ", maxTokens=" + maxTokens + ", timeout=" + timeout + ", apiKey=" + (hasApiKey() ? "***" : "<unset>") + "]";
    }
}
