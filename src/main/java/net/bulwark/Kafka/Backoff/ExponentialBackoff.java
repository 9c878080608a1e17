package net.bulwark.Kafka.Backoff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * {@code delay(attempt) = min(initialDelay * multiplier^attempt, maxDelay)}.
 *
 * The product is computed in floating point and compared against the cap before converting back,
 * so large attempts return {@code maxDelay} instead of overflowing.
 */
public class ExponentialBackoff implements BackoffPolicy {

    private static final Logger logger = LoggerFactory.getLogger(ExponentialBackoff.class);

    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(100);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);
    public static final double DEFAULT_MULTIPLIER = 2.0;

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final Sleeper sleeper;

    public ExponentialBackoff() {
        this(DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY, DEFAULT_MULTIPLIER);
    }

    public ExponentialBackoff(Duration initialDelay, Duration maxDelay, double multiplier) {
        this(initialDelay, maxDelay, multiplier, Sleeper.THREAD_SLEEP);
    }

    public ExponentialBackoff(Duration initialDelay, Duration maxDelay, double multiplier, Sleeper sleeper) {
        if (initialDelay == null || initialDelay.isZero() || initialDelay.isNegative()) {
            throw new IllegalArgumentException("Initial delay must be positive");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("Max delay must be greater than or equal to the initial delay");
        }
        // below 1 the delay would shrink with every attempt
        if (Double.isNaN(multiplier) || Double.isInfinite(multiplier) || multiplier < 1.0) {
            throw new IllegalArgumentException("Multiplier must be a finite value >= 1.0");
        }
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.sleeper = sleeper;
    }

    @Override
    public Duration delay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt must be greater than or equal to 0");
        }
        double maxNanos = maxDelay.toNanos();
        double nanos = initialDelay.toNanos() * Math.pow(multiplier, attempt);
        if (!(nanos < maxNanos)) {
            return maxDelay;
        }
        return Duration.ofNanos((long) nanos);
    }

    @Override
    public void await(int attempt) throws InterruptedException {
        Duration delay = delay(attempt);
        logger.debug("Exponential backoff: waiting {}ms (attempt {})", delay.toMillis(), attempt + 1);
        sleeper.sleep(delay);
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getMultiplier() {
        return multiplier;
    }

    @Override
    public String toString() {
        return "ExponentialBackoff{" +
                "initialDelay=" + initialDelay +
                ", maxDelay=" + maxDelay +
                ", multiplier=" + multiplier +
                '}';
    }
}
