package com.task.ccparser.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Exports pipeline spans to Langfuse over OTLP/HTTP when credentials are configured, otherwise
 * falls back to a no-op tracer.
 */
@Configuration
public class OpenTelemetryConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenTelemetryConfig.class);

    @Bean
    public OpenTelemetry openTelemetry(
            @Value("${langfuse.otlp-endpoint:https://cloud.langfuse.com/api/public/otel/v1/traces}") String endpoint,
            @Value("${langfuse.public-key:}") String publicKey,
            @Value("${langfuse.secret-key:}") String secretKey
    ) {
        if (publicKey.isBlank() || secretKey.isBlank()) {
            LOGGER.info("Langfuse keys not configured; tracing disabled");
            return OpenTelemetry.noop();
        }

        String credentials = publicKey + ":" + secretKey;
        String basicAuth = "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));

        OtlpHttpSpanExporter exporter = OtlpHttpSpanExporter.builder()
                .setEndpoint(endpoint)
                .addHeader("Authorization", basicAuth)
                .build();

        Resource resource = Resource.getDefault().toBuilder()
                .put(AttributeKey.stringKey("service.name"), "ccparser")
                .build();

        SdkTracerProvider provider = SdkTracerProvider.builder()
                .addSpanProcessor(BatchSpanProcessor.builder(exporter).build())
                .setResource(resource)
                .build();

        LOGGER.info("OpenTelemetry exporting to {}", endpoint);
        return OpenTelemetrySdk.builder()
                .setTracerProvider(provider)
                .build();
    }

    @Bean
    public Tracer tracer(OpenTelemetry otel) {
        return otel.getTracer("com.task.ccparser");
    }
}
