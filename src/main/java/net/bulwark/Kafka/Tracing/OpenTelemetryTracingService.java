package net.bulwark.Kafka.Tracing;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * OpenTelemetry implementation of TracingService.
 *
 * Imports OpenTelemetry classes directly, so it is only instantiated when
 * {@code @ConditionalOnClass} finds the API on the classpath. Without a configured SDK,
 * {@link GlobalOpenTelemetry} hands out no-op tracers and every span is dropped.
 */
public class OpenTelemetryTracingService implements TracingService {

    private static final Logger logger = LoggerFactory.getLogger(OpenTelemetryTracingService.class);
    private static final String INSTRUMENTATION_NAME = "net.bulwark.kafka";

    private final Tracer tracer;

    public OpenTelemetryTracingService() {
        this(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME, "0.1.0"));
    }

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
        logger.info("OpenTelemetryTracingService initialized - distributed tracing enabled");
    }

    @Override
    public TracingSpan startProcessingSpan(String topic, int partition, @Nullable String eventId, int retryCount) {
        Span span = tracer.spanBuilder("bulwark.kafka.process")
            .setSpanKind(SpanKind.CONSUMER)
            .startSpan();

        span.setAttribute("messaging.system", "kafka");
        span.setAttribute("messaging.destination", topic);
        span.setAttribute("messaging.kafka.partition", (long) partition);
        span.setAttribute("messaging.operation", "process");
        span.setAttribute("bulwark.retry_count", (long) retryCount);

        if (eventId != null) {
            span.setAttribute("bulwark.event_id", eventId);
        }

        return new OpenTelemetryTracingSpan(span);
    }

    @Override
    public TracingSpan startDeadLetterSpan(String originalTopic, String dlqTopic, @Nullable String eventId,
                                           int retryCount, String reason) {
        Span span = tracer.spanBuilder("bulwark.dlq.route")
            .setSpanKind(SpanKind.PRODUCER)
            .startSpan();

        span.setAttribute("messaging.system", "kafka");
        span.setAttribute("messaging.source_destination", originalTopic);
        span.setAttribute("messaging.destination", dlqTopic);
        span.setAttribute("bulwark.component", "dead-letter-router");
        span.setAttribute("bulwark.dlq.retry_count", (long) retryCount);
        span.setAttribute("bulwark.dlq.reason", reason);

        if (eventId != null) {
            span.setAttribute("bulwark.event_id", eventId);
        }

        return new OpenTelemetryTracingSpan(span);
    }

    @Override
    public boolean isEnabled() {
        return true;
    }
}
