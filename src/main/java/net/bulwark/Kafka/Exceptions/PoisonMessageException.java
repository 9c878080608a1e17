package net.bulwark.Kafka.Exceptions;

/**
 * Marks a message whose retry counter reached the configured maximum.
 * Always routed to the dead-letter topic, never surfaced to the consumer.
 */
public class PoisonMessageException extends BulwarkException {

    public static final String MAX_RETRIES_EXCEEDED = "max retries exceeded";

    private final int retryCount;
    private final int maxRetries;

    public PoisonMessageException(int retryCount, int maxRetries) {
        super(MAX_RETRIES_EXCEEDED);
        this.retryCount = retryCount;
        this.maxRetries = maxRetries;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }
}
