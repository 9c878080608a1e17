package net.bulwark.Kafka.Tracing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * No-op implementation of TracingService used when OpenTelemetry is not available.
 */
public class NoOpTracingService implements TracingService {

    private static final Logger logger = LoggerFactory.getLogger(NoOpTracingService.class);

    public NoOpTracingService() {
        logger.info("OpenTelemetry not available - tracing disabled. " +
                   "Add opentelemetry-api dependency to enable distributed tracing.");
    }

    @Override
    public TracingSpan startProcessingSpan(String topic, int partition, @Nullable String eventId, int retryCount) {
        return NoOpTracingSpan.INSTANCE;
    }

    @Override
    public TracingSpan startDeadLetterSpan(String originalTopic, String dlqTopic, @Nullable String eventId,
                                           int retryCount, String reason) {
        return NoOpTracingSpan.INSTANCE;
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
