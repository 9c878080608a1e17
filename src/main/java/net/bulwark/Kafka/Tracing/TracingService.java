package net.bulwark.Kafka.Tracing;

import org.springframework.lang.Nullable;

/**
 * Interface for tracing operations in the resilience layer.
 *
 * This interface allows OpenTelemetry to be an optional dependency.
 * When OpenTelemetry is on the classpath, the real implementation (OpenTelemetryTracingService)
 * is used. When OpenTelemetry is absent, a no-op implementation (NoOpTracingService) is used.
 *
 * Spans are wrapped in TracingSpan so no OpenTelemetry type leaks into the interface.
 */
public interface TracingService {

    /**
     * Creates a span covering one message from receipt to terminal state.
     *
     * @param topic      the Kafka topic
     * @param partition  the partition
     * @param eventId    the event ID (optional)
     * @param retryCount the retry counter carried by the message
     * @return a TracingSpan wrapper (never null, but may be a no-op)
     */
    TracingSpan startProcessingSpan(String topic, int partition, @Nullable String eventId, int retryCount);

    /**
     * Creates a span for one dead-letter routing attempt.
     *
     * @param originalTopic the topic the message was consumed from
     * @param dlqTopic      the dead-letter topic
     * @param eventId       the event ID (optional)
     * @param retryCount    the retry counter written to the envelope
     * @param reason        the reason for dead-lettering
     * @return a TracingSpan wrapper
     */
    TracingSpan startDeadLetterSpan(String originalTopic, String dlqTopic, @Nullable String eventId,
                                    int retryCount, String reason);

    /**
     * Checks if tracing is enabled and functional.
     */
    boolean isEnabled();
}
