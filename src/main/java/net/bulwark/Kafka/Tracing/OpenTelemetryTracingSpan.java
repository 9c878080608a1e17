package net.bulwark.Kafka.Tracing;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;

/**
 * Span handle backed by OpenTelemetry. Attributes are set by {@link OpenTelemetryTracingService}
 * when the span starts; this class only settles its status and closes it.
 */
public class OpenTelemetryTracingSpan implements TracingSpan {

    private final Span span;

    public OpenTelemetryTracingSpan(Span span) {
        this.span = span;
    }

    @Override
    public TracingSpan recordException(Throwable exception) {
        span.recordException(exception);
        span.setStatus(StatusCode.ERROR, exception.getClass().getSimpleName() + ": " + exception.getMessage());
        return this;
    }

    @Override
    public TracingSpan setSuccess() {
        span.setStatus(StatusCode.OK);
        return this;
    }

    @Override
    public TracingSpan setError(String description) {
        span.setStatus(StatusCode.ERROR, description);
        return this;
    }

    @Override
    public void end() {
        span.end();
    }
}
