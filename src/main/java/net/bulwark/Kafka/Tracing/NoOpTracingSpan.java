package net.bulwark.Kafka.Tracing;

/**
 * Span handle that records nothing, used when OpenTelemetry is not on the classpath.
 */
public final class NoOpTracingSpan implements TracingSpan {

    public static final NoOpTracingSpan INSTANCE = new NoOpTracingSpan();

    private NoOpTracingSpan() {
    }

    @Override
    public TracingSpan recordException(Throwable exception) {
        return this;
    }

    @Override
    public TracingSpan setSuccess() {
        return this;
    }

    @Override
    public TracingSpan setError(String message) {
        return this;
    }

    @Override
    public void end() {
    }
}
