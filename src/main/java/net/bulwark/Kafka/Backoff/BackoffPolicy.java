package net.bulwark.Kafka.Backoff;

import java.time.Duration;

/**
 * Maps a 0-based attempt number to the wait before the next attempt.
 */
public interface BackoffPolicy {

    /**
     * Pure delay function.
     *
     * @param attempt 0-based attempt that just failed
     * @return wait before attempt {@code attempt + 1}
     * @throws IllegalArgumentException if attempt is negative
     */
    Duration delay(int attempt);

    /**
     * Suspends the calling thread for {@link #delay(int)}. Interruption is the cancellation signal:
     * the wait returns early by throwing {@link InterruptedException}.
     */
    void await(int attempt) throws InterruptedException;
}
