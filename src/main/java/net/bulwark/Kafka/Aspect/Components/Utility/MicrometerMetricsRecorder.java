package net.bulwark.Kafka.Aspect.Components.Utility;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import net.bulwark.Kafka.Processing.ProcessingOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of MetricsRecorder.
 */
public class MicrometerMetricsRecorder implements MetricsRecorder {

    private static final Logger logger = LoggerFactory.getLogger(MicrometerMetricsRecorder.class);
    private final MeterRegistry meterRegistry;

    public MicrometerMetricsRecorder(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordOutcome(String topic, ProcessingOutcome outcome, long startTime) {
        try {
            String status = outcome.status().name().toLowerCase();
            boolean duplicate = outcome instanceof ProcessingOutcome.Acked acked && acked.duplicate();

            Timer.builder("kafka.bulwark.processing.time")
                    .tag("topic", topic)
                    .tag("outcome", status)
                    .register(meterRegistry)
                    .record(System.currentTimeMillis() - startTime, TimeUnit.MILLISECONDS);

            Counter.builder("kafka.bulwark.processing.count")
                    .tag("topic", topic)
                    .tag("outcome", status)
                    .tag("duplicate", String.valueOf(duplicate))
                    .register(meterRegistry)
                    .increment();

            if (outcome instanceof ProcessingOutcome.DeadLettered deadLettered) {
                Counter.builder("kafka.bulwark.dlq.count")
                        .tag("topic", topic)
                        .tag("error", String.valueOf(deadLettered.envelope().getErrorKind()))
                        .register(meterRegistry)
                        .increment();
            }
        } catch (Exception e) {
            logger.warn("failed to record outcome metrics for topic {}: {}", topic, e.getMessage());
        }
    }

    @Override
    public void recordFailure(String topic, Exception exception, int retryCount) {
        try {
            Counter.builder("kafka.bulwark.exception.count")
                    .tag("topic", topic)
                    .tag("exception", exception.getClass().getSimpleName())
                    .register(meterRegistry)
                    .increment();

            Counter.builder("kafka.bulwark.retry.count")
                    .tag("topic", topic)
                    .tag("retry_count", String.valueOf(retryCount))
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            logger.warn("failed to record failure metrics for topic {}: {}", topic, e.getMessage());
        }
    }

    @Override
    public void recordRoutingFailure(String topic) {
        try {
            Counter.builder("kafka.bulwark.dlq.routing.failed")
                    .tag("topic", topic)
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            logger.warn("failed to record routing failure metrics for topic {}: {}", topic, e.getMessage());
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
