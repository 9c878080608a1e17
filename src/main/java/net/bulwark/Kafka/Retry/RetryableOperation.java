package net.bulwark.Kafka.Retry;

/**
 * A unit of work the {@link RetryExecutor} may call several times.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface RetryableOperation<T> {

    /**
     * @param attempt 0-based attempt number
     */
    T call(int attempt) throws Exception;
}
