package net.bulwark.Kafka.Aspect.Components.Utility;

import net.bulwark.Kafka.Processing.ProcessingOutcome;

/**
 * No-Op implementation of MetricsRecorder.
 * Used when Micrometer is not available.
 */
public class NoOpMetricsRecorder implements MetricsRecorder {

    @Override
    public void recordOutcome(String topic, ProcessingOutcome outcome, long startTime) {
        // No-Op
    }

    @Override
    public void recordFailure(String topic, Exception exception, int retryCount) {
        // No-Op
    }

    @Override
    public void recordRoutingFailure(String topic) {
        // No-Op
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
