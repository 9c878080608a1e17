package net.bulwark.Kafka.Aspect.Components.Utility;

import net.bulwark.Kafka.Processing.ProcessingOutcome;

/**
 * Interface responsible for recording metrics.
 * Decouples the library from specific metrics implementations like Micrometer.
 */
public interface MetricsRecorder {

    /**
     * Records the terminal outcome of one delivery.
     *
     * @param topic     the Kafka topic
     * @param outcome   the terminal outcome
     * @param startTime the start time in milliseconds
     */
    void recordOutcome(String topic, ProcessingOutcome outcome, long startTime);

    /**
     * Records a failed business call.
     *
     * @param topic      the Kafka topic
     * @param exception  the exception that occurred
     * @param retryCount the retry counter of the failed delivery
     */
    void recordFailure(String topic, Exception exception, int retryCount);

    /**
     * Records a dead-letter publish that itself failed.
     *
     * @param topic the Kafka topic the message came from
     */
    void recordRoutingFailure(String topic);

    /**
     * Checks if metrics recording is available.
     *
     * @return true if metrics recording is enabled and available
     */
    boolean isAvailable();
}
