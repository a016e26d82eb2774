package com.task.ccparser.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class OpenTelemetryConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(OpenTelemetryConfig.class);

    @Test
    public void testNoopWithoutLangfuseKeys() {
        contextRunner.run(context -> {
            OpenTelemetry otel = context.getBean(OpenTelemetry.class);
            assertFalse(otel instanceof OpenTelemetrySdk);
            Span span = context.getBean(Tracer.class).spanBuilder("statement.parse").startSpan();
            assertFalse(span.getSpanContext().isValid());
        });
    }

    @Test
    public void testSdkShutDownWithContext() {
        AtomicReference<OpenTelemetrySdk> sdk = new AtomicReference<>();

        contextRunner
                .withPropertyValues(
                        "langfuse.otlp-endpoint=http://localhost:4318/v1/traces",
                        "langfuse.public-key=pk-test",
                        "langfuse.secret-key=sk-test")
                .run(context -> {
                    OpenTelemetry otel = context.getBean(OpenTelemetry.class);
                    assertInstanceOf(OpenTelemetrySdk.class, otel);
                    sdk.set((OpenTelemetrySdk) otel);
                    assertTrue(otel.getTracer("test").spanBuilder("live").startSpan().getSpanContext().isValid());
                });

        Span afterClose = sdk.get().getTracer("test").spanBuilder("closed").startSpan();
        assertFalse(afterClose.getSpanContext().isValid());
    }
}
