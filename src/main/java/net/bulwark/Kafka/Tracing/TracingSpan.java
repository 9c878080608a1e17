package net.bulwark.Kafka.Tracing;

/**
 * Handle on an open span, independent of the tracing backend.
 */
public interface TracingSpan {

    /**
     * Records an exception in the span and marks it as failed.
     */
    TracingSpan recordException(Throwable exception);

    TracingSpan setSuccess();

    TracingSpan setError(String message);

    /**
     * Ends the span. Must be called when the operation is complete.
     */
    void end();
}
